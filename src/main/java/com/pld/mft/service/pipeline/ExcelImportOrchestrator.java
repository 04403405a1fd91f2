package com.pld.mft.service.pipeline;

import com.pld.mft.config.ExcelImportConfig;
import com.pld.mft.config.ImportProperties;
import com.pld.mft.service.contract.CommonData;
import com.pld.mft.service.contract.PersistenceHandler;
import com.pld.mft.service.contract.TemplateDefinition;
import com.pld.mft.service.file.ExcelUploadFileService;
import com.pld.mft.service.pipeline.parse.ColumnResolutionBatchException;
import com.pld.mft.service.pipeline.parse.ExcelParserService;
import com.pld.mft.service.pipeline.report.ExcelErrorReportService;
import com.pld.mft.service.pipeline.validation.ExcelValidationService;
import com.pld.mft.util.SecureExcelUtils;
import com.pld.mft.validation.CellError;
import com.pld.mft.validation.ExcelValidationResult;
import com.pld.mft.validation.RowError;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import lombok.Builder;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;

/**
 * Runs one workbook upload end to end: store, pre-count, parse, validate, check against stored
 * data, then either persist everything or write an error report and persist nothing. The stored
 * upload is deleted once processing ends.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ExcelImportOrchestrator {

  public static final String DOWNLOAD_PATH = "/api/excel/download/";

  private static final int MAX_CUSTOM_ID_LENGTH = 35;

  private final ExcelUploadFileService uploadFileService;
  private final ExcelParserService parserService;
  private final ExcelValidationService validationService;
  private final ExcelErrorReportService errorReportService;
  private final ImportProperties properties;
  private final List<TemplateDefinition<?, ?>> templateDefinitions;

  @Builder
  public record ImportResult(
      boolean success,
      int rowsProcessed,
      int rowsCreated,
      int rowsUpdated,
      int errorRows,
      int errorCount,
      String errorFileId,
      String downloadUrl,
      String originalFilename,
      String message) {}

  public ImportResult processUpload(MultipartFile file, String templateType, CommonData commonData)
      throws IOException {
    return doProcess(findTemplate(templateType), file, commonData);
  }

  public Class<? extends CommonData> getCommonDataClass(String templateType) {
    return findTemplate(templateType).getCommonDataClass();
  }

  private TemplateDefinition<?, ?> findTemplate(String templateType) {
    return templateDefinitions.stream()
        .filter(t -> t.getTemplateType().equals(templateType))
        .findFirst()
        .orElseThrow(() -> new IllegalArgumentException("Unknown template type: " + templateType));
  }

  @SuppressWarnings("unchecked")
  private <T, C extends CommonData> ImportResult doProcess(
      TemplateDefinition<?, ?> rawTemplate, MultipartFile file, CommonData commonData)
      throws IOException {
    TemplateDefinition<T, C> template = (TemplateDefinition<T, C>) rawTemplate;
    if (!template.getCommonDataClass().isInstance(commonData)) {
      throw new IllegalArgumentException("commonData does not match the template type");
    }
    C typedCommonData = template.getCommonDataClass().cast(commonData);
    ExcelImportConfig config = template.getConfig();
    String sanitizedFilename = sanitizeOriginalFilename(file);

    Path uploadArea = properties.getTempDirectoryPath().resolve(resolveCustomIdPath(commonData));
    Files.createDirectories(uploadArea);
    Path xlsxFile = uploadFileService.storeAndValidateXlsx(file, uploadArea);
    log.info(
        "Import of {} ({}) started for {}",
        sanitizedFilename,
        template.getTemplateType(),
        commonData.getCustomId());

    try {
      int roughRowCount = SecureExcelUtils.countRows(xlsxFile, config.getSheetIndex());
      int preCountThreshold =
          properties.getMaxRows() + (config.getDataStartRow() - 1) + properties.getPreCountBuffer();
      if (roughRowCount > preCountThreshold) {
        log.info("Pre-count rejected {}: about {} rows", sanitizedFilename, roughRowCount);
        return rowLimitExceeded(
            roughRowCount, "The file contains about " + roughRowCount + " rows");
      }

      ExcelParserService.ParseResult<T> parseResult =
          parserService.parse(xlsxFile, template.getDtoClass(), config, properties.getMaxRows());
      if (parseResult.rows().size() > properties.getMaxRows()) {
        return rowLimitExceeded(parseResult.rows().size(), "The file has more data rows");
      }
      template.normalize(parseResult.rows());

      ExcelValidationResult validationResult =
          validationService.validate(
              parseResult.rows(), template.getDtoClass(), parseResult.sourceRowNumbers());
      validationResult.merge(
          template.checkDbUniqueness(
              parseResult.rows(), parseResult.sourceRowNumbers(), typedCommonData));
      validationResult.merge(parseResult.parseErrors());
      locateColumns(validationResult, parseResult);

      if (validationResult.isValid()) {
        PersistenceHandler.SaveResult saved =
            template
                .getPersistenceHandler()
                .saveAll(parseResult.rows(), parseResult.sourceRowNumbers(), typedCommonData);
        log.info(
            "Import of {} for {} saved {} rows ({} created, {} updated)",
            sanitizedFilename,
            commonData.getCustomId(),
            parseResult.rows().size(),
            saved.created(),
            saved.updated());
        return ImportResult.builder()
            .success(true)
            .rowsProcessed(parseResult.rows().size())
            .rowsCreated(saved.created())
            .rowsUpdated(saved.updated())
            .originalFilename(sanitizedFilename)
            .message("Upload complete")
            .build();
      }

      Path errorFile =
          errorReportService.generateErrorReport(
              xlsxFile, validationResult, config, sanitizedFilename);
      String errorFileId = errorFile.getFileName().toString().replace(".xlsx", "");
      log.info(
          "Import of {} for {} rejected: {} errors in {} rows",
          sanitizedFilename,
          commonData.getCustomId(),
          validationResult.getTotalErrorCount(),
          validationResult.getErrorRowCount());
      return ImportResult.builder()
          .success(false)
          .rowsProcessed(validationResult.getTotalRows())
          .errorRows(validationResult.getErrorRowCount())
          .errorCount(validationResult.getTotalErrorCount())
          .errorFileId(errorFileId)
          .downloadUrl(DOWNLOAD_PATH + errorFileId)
          .originalFilename(sanitizedFilename)
          .message(
              "Found %d errors in %d rows"
                  .formatted(
                      validationResult.getTotalErrorCount(), validationResult.getErrorRowCount()))
          .build();
    } catch (ColumnResolutionBatchException e) {
      log.warn("Column resolution failed for {}: {}", sanitizedFilename, e.getMessage());
      return ImportResult.builder().success(false).message(e.toUserMessage()).build();
    } finally {
      uploadFileService.discard(xlsxFile);
    }
  }

  private ImportResult rowLimitExceeded(int rows, String detail) {
    return ImportResult.builder()
        .success(false)
        .rowsProcessed(rows)
        .message("Maximum row count (" + properties.getMaxRows() + ") exceeded. " + detail)
        .build();
  }

  /** Gives auto-detected columns their sheet position so the report can highlight them. */
  private void locateColumns(
      ExcelValidationResult result, ExcelParserService.ParseResult<?> parseResult) {
    for (RowError rowError : result.getRowErrors()) {
      rowError
          .getCellErrors()
          .replaceAll(
              error -> error.hasColumn() ? error : locate(error, parseResult));
    }
  }

  private CellError locate(CellError error, ExcelParserService.ParseResult<?> parseResult) {
    return parseResult
        .mappingFor(error.fieldName())
        .map(m -> error.withColumn(m.resolvedColumnIndex(), m.resolvedColumnLetter()))
        .orElse(error);
  }

  private String sanitizeOriginalFilename(MultipartFile file) {
    String originalName = file.getOriginalFilename();
    if (originalName == null || originalName.isBlank()) {
      return null;
    }
    try {
      return SecureExcelUtils.sanitizeFilename(originalName);
    } catch (IllegalArgumentException e) {
      log.warn("Could not sanitize original filename: {}", e.getMessage());
      return null;
    }
  }

  private String resolveCustomIdPath(CommonData commonData) {
    String customId = commonData.getCustomId();
    if (customId == null || customId.isBlank()) {
      throw new IllegalArgumentException("customId is required");
    }
    if (customId.length() > MAX_CUSTOM_ID_LENGTH) {
      throw new IllegalArgumentException(
          "customId must be at most " + MAX_CUSTOM_ID_LENGTH + " characters");
    }
    String sanitized = SecureExcelUtils.sanitizeSegment(customId.trim());
    if (sanitized.isBlank() || "errors".equals(sanitized)) {
      throw new IllegalArgumentException("customId is not usable as a directory name");
    }
    return sanitized;
  }
}
