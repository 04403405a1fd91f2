package com.pld.mft.templates.masterdata.config;

import com.pld.mft.config.ExcelImportConfig;

/** Header on the first row, data right below it, no footer. */
public class MasterDataImportConfig implements ExcelImportConfig {

  private final String errorColumnName;

  public MasterDataImportConfig(String errorColumnName) {
    this.errorColumnName = errorColumnName;
  }

  @Override
  public String getErrorColumnName() {
    return errorColumnName == null || errorColumnName.isBlank()
        ? ExcelImportConfig.super.getErrorColumnName()
        : errorColumnName;
  }
}
