package com.pld.mft.service.contract;

import com.pld.mft.config.ExcelImportConfig;
import com.pld.mft.validation.RowError;
import java.util.Collections;
import java.util.List;
import lombok.Getter;

/**
 * Everything the import pipeline needs to know about one upload type. Registered as a bean and
 * looked up by {@link #getTemplateType()}.
 *
 * @param <T> row DTO
 * @param <C> commonData type
 */
@Getter
public class TemplateDefinition<T, C extends CommonData> {

  private final String templateType;
  private final Class<T> dtoClass;
  private final Class<C> commonDataClass;
  private final ExcelImportConfig config;
  private final PersistenceHandler<T, C> persistenceHandler;
  private final DatabaseUniquenessChecker<T, C> dbUniquenessChecker;
  private final RowNormalizer<T> rowNormalizer;

  public TemplateDefinition(
      String templateType,
      Class<T> dtoClass,
      Class<C> commonDataClass,
      ExcelImportConfig config,
      PersistenceHandler<T, C> persistenceHandler,
      DatabaseUniquenessChecker<T, C> dbUniquenessChecker) {
    this(
        templateType,
        dtoClass,
        commonDataClass,
        config,
        persistenceHandler,
        dbUniquenessChecker,
        null);
  }

  public TemplateDefinition(
      String templateType,
      Class<T> dtoClass,
      Class<C> commonDataClass,
      ExcelImportConfig config,
      PersistenceHandler<T, C> persistenceHandler,
      DatabaseUniquenessChecker<T, C> dbUniquenessChecker,
      RowNormalizer<T> rowNormalizer) {
    this.templateType = templateType;
    this.dtoClass = dtoClass;
    this.commonDataClass = commonDataClass;
    this.config = config;
    this.persistenceHandler = persistenceHandler;
    this.dbUniquenessChecker = dbUniquenessChecker;
    this.rowNormalizer = rowNormalizer;
  }

  public void normalize(List<T> rows) {
    if (rowNormalizer != null) {
      rows.forEach(rowNormalizer::normalize);
    }
  }

  public List<RowError> checkDbUniqueness(
      List<T> rows, List<Integer> sourceRowNumbers, C commonData) {
    if (dbUniquenessChecker == null) {
      return Collections.emptyList();
    }
    return dbUniquenessChecker.check(rows, dtoClass, sourceRowNumbers, commonData);
  }
}
