package com.pld.mft.service.file;

import com.pld.mft.config.ImportProperties;
import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

/**
 * Nightly removal of uploads and error reports older than {@code mft.import.retention-days}. Empty
 * directories left behind are removed too; the temp root itself is kept.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TempFileCleanupService {

  private final ImportProperties properties;

  @Scheduled(cron = "0 0 2 * * *")
  public void cleanupOldFiles() {
    Instant cutoff = Instant.now().minus(properties.getRetentionDays(), ChronoUnit.DAYS);
    int deleted = cleanupOlderThan(cutoff);
    log.info("Temp file cleanup removed {} files older than {}", deleted, cutoff);
  }

  /** Returns the number of files deleted. */
  public int cleanupOlderThan(Instant cutoff) {
    Path tempDir = properties.getTempDirectoryPath();
    if (!Files.isDirectory(tempDir)) {
      return 0;
    }

    int[] deleted = {0};
    try {
      Files.walkFileTree(
          tempDir,
          new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
              if (attrs.lastModifiedTime().toInstant().isBefore(cutoff)) {
                try {
                  Files.deleteIfExists(file);
                  deleted[0]++;
                  log.debug("Deleted expired temp file {}", file);
                } catch (IOException e) {
                  log.warn("Could not delete expired temp file {}: {}", file, e.getMessage());
                }
              }
              return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFileFailed(Path file, IOException exc) {
              log.warn("Could not inspect temp file {}: {}", file, exc.getMessage());
              return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult postVisitDirectory(Path dir, IOException exc) {
              if (!dir.equals(tempDir) && !dir.equals(properties.getErrorsDirectoryPath())) {
                deleteIfEmpty(dir);
              }
              return FileVisitResult.CONTINUE;
            }
          });
    } catch (IOException e) {
      log.warn("Temp file cleanup stopped early: {}", e.getMessage());
    }
    return deleted[0];
  }

  private void deleteIfEmpty(Path dir) {
    try (DirectoryStream<Path> entries = Files.newDirectoryStream(dir)) {
      if (!entries.iterator().hasNext()) {
        Files.delete(dir);
        log.debug("Deleted empty temp directory {}", dir);
      }
    } catch (IOException e) {
      log.warn("Could not delete temp directory {}: {}", dir, e.getMessage());
    }
  }
}
