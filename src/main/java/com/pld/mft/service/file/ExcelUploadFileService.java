package com.pld.mft.service.file;

import com.pld.mft.util.SecureExcelUtils;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.UUID;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;

/** Stores an uploaded workbook in its own directory and checks that it really is an xlsx file. */
@Slf4j
@Service
public class ExcelUploadFileService {

  /**
   * Saves {@code file} as {@code <baseDir>/<uuid>/<sanitized name>}.
   *
   * @throws IllegalArgumentException for a missing name or a non-.xlsx extension
   * @throws SecurityException if the content is not a ZIP container
   */
  public Path storeAndValidateXlsx(MultipartFile file, Path baseDir) throws IOException {
    String originalName = file.getOriginalFilename();
    if (originalName == null || originalName.isBlank()) {
      throw new IllegalArgumentException("Uploaded file has no name");
    }

    String lowerName = originalName.trim().toLowerCase(Locale.ROOT);
    if (lowerName.endsWith(".xls")) {
      throw new IllegalArgumentException("Legacy .xls workbooks are not supported, upload .xlsx");
    }
    if (!lowerName.endsWith(".xlsx")) {
      throw new IllegalArgumentException("Only .xlsx files can be uploaded");
    }

    Path uploadDir = Files.createDirectories(baseDir.resolve(UUID.randomUUID().toString()));
    Path target = uploadDir.resolve(SecureExcelUtils.sanitizeFilename(originalName));
    file.transferTo(target);
    try {
      SecureExcelUtils.validateFileContent(target);
    } catch (SecurityException e) {
      discard(target);
      throw e;
    }
    log.debug("Stored upload {} ({} bytes)", target, file.getSize());
    return target;
  }

  /** Removes a stored upload and its directory. Failures are logged, not thrown. */
  public void discard(Path storedFile) {
    try {
      Files.deleteIfExists(storedFile);
      Path dir = storedFile.getParent();
      if (dir != null) {
        try (var entries = Files.list(dir)) {
          if (entries.findAny().isEmpty()) {
            Files.delete(dir);
          }
        }
      }
    } catch (IOException e) {
      log.warn("Could not delete upload {}: {}", storedFile, e.getMessage());
    }
  }
}
