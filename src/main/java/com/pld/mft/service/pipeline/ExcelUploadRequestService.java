package com.pld.mft.service.pipeline;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.cfg.CoercionAction;
import com.fasterxml.jackson.databind.cfg.CoercionInputShape;
import com.fasterxml.jackson.databind.type.LogicalType;
import com.pld.mft.config.ImportProperties;
import com.pld.mft.service.contract.CommonData;
import com.pld.mft.service.pipeline.ExcelImportOrchestrator.ImportResult;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import java.io.IOException;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MaxUploadSizeExceededException;
import org.springframework.web.multipart.MultipartFile;

/** Request-level checks in front of {@link ExcelImportOrchestrator}: file size and commonData. */
@Service
@RequiredArgsConstructor
public class ExcelUploadRequestService {

  private final ExcelImportOrchestrator orchestrator;
  private final ImportProperties properties;
  private final ObjectMapper objectMapper;
  private final Validator validator;

  public ImportResult upload(MultipartFile file, String templateType, String commonDataJson)
      throws IOException {
    checkFileSize(file);
    Class<? extends CommonData> commonDataClass = orchestrator.getCommonDataClass(templateType);
    CommonData commonData = parseAndValidateCommonData(commonDataJson, commonDataClass);
    return orchestrator.processUpload(file, templateType, commonData);
  }

  /**
   * {success, rowsProcessed, rowsCreated, rowsUpdated, errorRows, errorCount, downloadUrl?,
   * message}. downloadUrl is present only when an error report was written.
   */
  public Map<String, Object> toApiResponse(ImportResult result) {
    Map<String, Object> response = new LinkedHashMap<>();
    response.put("success", result.success());
    response.put("rowsProcessed", result.rowsProcessed());
    response.put("rowsCreated", result.rowsCreated());
    response.put("rowsUpdated", result.rowsUpdated());
    response.put("errorRows", result.errorRows());
    response.put("errorCount", result.errorCount());
    if (result.downloadUrl() != null) {
      response.put("downloadUrl", result.downloadUrl());
    }
    response.put("message", result.message());
    return response;
  }

  private void checkFileSize(MultipartFile file) {
    long maxBytes = (long) properties.getMaxFileSizeMb() * 1024 * 1024;
    if (file.getSize() > maxBytes) {
      throw new MaxUploadSizeExceededException(maxBytes);
    }
  }

  private CommonData parseAndValidateCommonData(
      String commonDataJson, Class<? extends CommonData> commonDataClass) {
    if (commonDataJson == null || commonDataJson.isBlank()) {
      throw new IllegalArgumentException("The commonData part is required");
    }

    ObjectMapper strictMapper =
        objectMapper.copy().enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    strictMapper.setConfig(
        strictMapper.getDeserializationConfig().without(MapperFeature.ALLOW_COERCION_OF_SCALARS));
    strictMapper
        .coercionConfigFor(LogicalType.Textual)
        .setCoercion(CoercionInputShape.Integer, CoercionAction.Fail)
        .setCoercion(CoercionInputShape.Float, CoercionAction.Fail)
        .setCoercion(CoercionInputShape.Boolean, CoercionAction.Fail);

    CommonData commonData;
    try {
      commonData = strictMapper.readValue(commonDataJson, commonDataClass);
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("commonData is not valid for this template");
    }
    validateCommonData(commonData);
    return commonData;
  }

  private void validateCommonData(CommonData commonData) {
    validator.validate(commonData).stream()
        .min(
            Comparator.comparing(
                (ConstraintViolation<CommonData> v) -> v.getPropertyPath().toString()))
        .map(ConstraintViolation::getMessage)
        .ifPresent(
            message -> {
              throw new IllegalArgumentException(message);
            });
  }
}
