package com.pld.mft.controller;

import com.pld.mft.config.ImportProperties;
import java.io.IOException;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.regex.Pattern;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RestController;

/**
 * Download of error reports written by a rejected upload. Only ids of the generated UUID form are
 * accepted, so a request can never name a path outside the reports directory.
 */
@Slf4j
@RestController
@RequiredArgsConstructor
public class ExcelFileController {

  static final MediaType XLSX =
      MediaType.parseMediaType("application/vnd.openxmlformats-officedocument.spreadsheetml.sheet");

  private static final Pattern UUID_PATTERN =
      Pattern.compile("^[0-9a-f]{8}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{12}$");

  private final ImportProperties properties;

  @GetMapping("/api/excel/download/{fileId}")
  public ResponseEntity<Resource> downloadErrorFile(@PathVariable String fileId) {
    if (!UUID_PATTERN.matcher(fileId).matches()) {
      return ResponseEntity.badRequest().build();
    }

    Path errorsDir = properties.getErrorsDirectoryPath();
    Path errorFile = errorsDir.resolve(fileId + ".xlsx");
    if (!Files.isRegularFile(errorFile)) {
      return ResponseEntity.notFound().build();
    }

    return ResponseEntity.ok()
        .contentType(XLSX)
        .header(
            HttpHeaders.CONTENT_DISPOSITION,
            contentDisposition(downloadFilename(fileId, errorsDir), fileId))
        .body(new FileSystemResource(errorFile));
  }

  /** "errors_" plus the original upload name when it was recorded. */
  private String downloadFilename(String fileId, Path errorsDir) {
    Path metaFile = errorsDir.resolve(fileId + ".meta");
    if (Files.exists(metaFile)) {
      try {
        String originalName = Files.readString(metaFile, StandardCharsets.UTF_8).trim();
        if (!originalName.isBlank()) {
          return "errors_" + originalName;
        }
      } catch (IOException e) {
        log.warn("Could not read meta file for {}: {}", fileId, e.getMessage());
      }
    }
    return "errors_" + fileId + ".xlsx";
  }

  /** ASCII fallback name plus an RFC 5987 encoded one for non-ASCII file names. */
  private String contentDisposition(String downloadFilename, String fileId) {
    String encoded =
        URLEncoder.encode(downloadFilename, StandardCharsets.UTF_8).replace("+", "%20");
    return "attachment; filename=\"" + fileId + ".xlsx\"; filename*=UTF-8''" + encoded;
  }
}
