package com.pld.mft.templates.masterdata.config;

import com.pld.mft.config.ImportProperties;
import com.pld.mft.service.contract.TemplateDefinition;
import com.pld.mft.templates.TemplateTypes;
import com.pld.mft.templates.masterdata.dto.MasterDataCommonData;
import com.pld.mft.templates.masterdata.dto.MasterDataRowDto;
import com.pld.mft.templates.masterdata.service.MasterDataImportService;
import com.pld.mft.templates.masterdata.service.MasterDataKeyConsistencyChecker;
import com.pld.mft.templates.masterdata.service.MasterDataTextCleaner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class MasterDataTemplateConfig {

  @Bean
  public TemplateDefinition<MasterDataRowDto, MasterDataCommonData> masterDataTemplate(
      MasterDataImportService persistenceHandler,
      MasterDataKeyConsistencyChecker consistencyChecker,
      MasterDataTextCleaner textCleaner,
      ImportProperties properties) {
    return new TemplateDefinition<>(
        TemplateTypes.MASTER_DATA,
        MasterDataRowDto.class,
        MasterDataCommonData.class,
        new MasterDataImportConfig(properties.getErrorColumnName()),
        persistenceHandler,
        consistencyChecker,
        textCleaner);
  }
}
