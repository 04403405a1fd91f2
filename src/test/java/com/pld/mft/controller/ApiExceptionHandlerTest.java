package com.pld.mft.controller;

import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.not;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.multipart;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.pld.mft.catalog.exception.UniquenessViolationException;
import com.pld.mft.service.pipeline.ExcelUploadRequestService;
import com.pld.mft.templates.TemplateTypes;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.web.multipart.MaxUploadSizeExceededException;

@WebMvcTest(MasterDataUploadApiController.class)
@Import(ApiExceptionHandler.class)
class ApiExceptionHandlerTest {

  private static final String UPLOAD_URL = "/api/excel/upload/" + TemplateTypes.MASTER_DATA;

  @Autowired private MockMvc mockMvc;

  @MockBean private ExcelUploadRequestService uploadRequestService;

  @Test
  void unexpectedException_hidesInternalDetails() throws Exception {
    when(uploadRequestService.upload(any(), anyString(), anyString()))
        .thenThrow(new RuntimeException("internal /tmp/secret details"));

    mockMvc
        .perform(multipart(UPLOAD_URL).file(filePart()).file(commonDataPart()))
        .andExpect(status().isInternalServerError())
        .andExpect(jsonPath("$.success").value(false))
        .andExpect(
            jsonPath("$.message").value("An unexpected error occurred. Contact the administrator."))
        .andExpect(jsonPath("$.message", not(containsString("internal"))))
        .andExpect(jsonPath("$.message", not(containsString("/tmp"))));
  }

  @Test
  void maxUploadSize_mapsTo413() throws Exception {
    when(uploadRequestService.upload(any(), anyString(), anyString()))
        .thenThrow(new MaxUploadSizeExceededException(1024));

    mockMvc
        .perform(multipart(UPLOAD_URL).file(filePart()).file(commonDataPart()))
        .andExpect(status().isPayloadTooLarge())
        .andExpect(jsonPath("$.success").value(false))
        .andExpect(jsonPath("$.message").value("The uploaded file exceeds the size limit."));
  }

  @Test
  void securityException_mapsTo400WithGenericMessage() throws Exception {
    when(uploadRequestService.upload(any(), anyString(), anyString()))
        .thenThrow(new SecurityException("magic bytes 0x00 at /tmp/x"));

    mockMvc
        .perform(multipart(UPLOAD_URL).file(filePart()).file(commonDataPart()))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.message").value("The uploaded file failed security checks."));
  }

  @Test
  void illegalArgument_mapsTo400WithMessage() throws Exception {
    when(uploadRequestService.upload(any(), anyString(), anyString()))
        .thenThrow(new IllegalArgumentException("customId is required"));

    mockMvc
        .perform(multipart(UPLOAD_URL).file(filePart()).file(commonDataPart()))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.message").value("customId is required"));
  }

  @Test
  void uniquenessViolation_mapsTo409WithTableAndKey() throws Exception {
    when(uploadRequestService.upload(any(), anyString(), anyString()))
        .thenThrow(new UniquenessViolationException("part_to_model", "PRT_1/MDL_1"));

    mockMvc
        .perform(multipart(UPLOAD_URL).file(filePart()).file(commonDataPart()))
        .andExpect(status().isConflict())
        .andExpect(jsonPath("$.table").value("part_to_model"))
        .andExpect(jsonPath("$.value").value("PRT_1/MDL_1"));
  }

  @Test
  void missingFilePart_mapsTo400() throws Exception {
    mockMvc
        .perform(multipart(UPLOAD_URL).file(commonDataPart()))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.message").value("The multipart request could not be processed."));
  }

  private MockMultipartFile filePart() {
    return new MockMultipartFile(
        "file",
        "a.xlsx",
        "application/vnd.openxmlformats-officedocument.spreadsheetml.sheet",
        "a".getBytes());
  }

  private MockMultipartFile commonDataPart() {
    return new MockMultipartFile(
        "commonData",
        "commonData",
        MediaType.APPLICATION_JSON_VALUE,
        "{\"customId\":\"PLANT-01\"}".getBytes());
  }
}
