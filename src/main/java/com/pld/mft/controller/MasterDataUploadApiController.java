package com.pld.mft.controller;

import com.pld.mft.service.pipeline.ExcelImportOrchestrator.ImportResult;
import com.pld.mft.service.pipeline.ExcelUploadRequestService;
import com.pld.mft.templates.TemplateTypes;
import java.io.IOException;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestPart;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

/** Multipart upload of a master data workbook, a {@code file} part plus JSON {@code commonData}. */
@RestController
@RequiredArgsConstructor
public class MasterDataUploadApiController {

  private final ExcelUploadRequestService uploadRequestService;

  @PostMapping("/api/excel/upload/" + TemplateTypes.MASTER_DATA)
  public ResponseEntity<Map<String, Object>> upload(
      @RequestPart("file") MultipartFile file,
      @RequestPart(value = "commonData", required = false) String commonDataJson)
      throws IOException {
    ImportResult result =
        uploadRequestService.upload(file, TemplateTypes.MASTER_DATA, commonDataJson);
    Map<String, Object> response = uploadRequestService.toApiResponse(result);
    if (result.success()) {
      return ResponseEntity.ok(response);
    }
    return ResponseEntity.badRequest().body(response);
  }
}
