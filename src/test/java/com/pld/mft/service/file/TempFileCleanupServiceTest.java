package com.pld.mft.service.file;

import static org.assertj.core.api.Assertions.assertThat;

import com.pld.mft.config.ImportProperties;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class TempFileCleanupServiceTest {

  @TempDir Path tempDir;

  private ImportProperties properties;
  private TempFileCleanupService cleanupService;

  @BeforeEach
  void setUp() {
    properties = new ImportProperties();
    properties.setTempDirectory(tempDir.toString());
    cleanupService = new TempFileCleanupService(properties);
  }

  @Test
  void cleanup_removesOldFilesAndTheirEmptyDirectories() throws IOException {
    Path oldUpload = file("PLANT-01/5a1c/parts.xlsx", 40);
    Path freshUpload = file("PLANT-01/7b2d/parts.xlsx", 1);
    Path oldReport = file("errors/3f9e.xlsx", 40);
    Path oldMeta = file("errors/3f9e.meta", 40);

    int deleted = cleanupService.cleanupOlderThan(Instant.now().minus(30, ChronoUnit.DAYS));

    assertThat(deleted).isEqualTo(3);
    assertThat(oldUpload).doesNotExist();
    assertThat(oldUpload.getParent()).doesNotExist();
    assertThat(oldReport).doesNotExist();
    assertThat(oldMeta).doesNotExist();
    assertThat(freshUpload).exists();
    assertThat(tempDir.resolve("PLANT-01")).exists();
  }

  @Test
  void cleanup_keepsTempRootAndErrorsDirectory() throws IOException {
    file("errors/3f9e.xlsx", 40);
    file("PLANT-02/1c4e/parts.xlsx", 40);

    cleanupService.cleanupOlderThan(Instant.now().minus(30, ChronoUnit.DAYS));

    assertThat(tempDir).exists();
    assertThat(properties.getErrorsDirectoryPath()).isDirectory();
    assertThat(tempDir.resolve("PLANT-02")).doesNotExist();
  }

  @Test
  void cleanup_missingTempDirectory_deletesNothing() {
    properties.setTempDirectory(tempDir.resolve("never-created").toString());

    assertThat(cleanupService.cleanupOlderThan(Instant.now())).isZero();
  }

  @Test
  void scheduledRun_usesRetentionDays() throws IOException {
    properties.setRetentionDays(7);
    Path tenDaysOld = file("PLANT-01/a/parts.xlsx", 10);
    Path threeDaysOld = file("PLANT-01/b/parts.xlsx", 3);

    cleanupService.cleanupOldFiles();

    assertThat(tenDaysOld).doesNotExist();
    assertThat(threeDaysOld).exists();
  }

  private Path file(String relative, int ageDays) throws IOException {
    Path file = tempDir.resolve(relative);
    Files.createDirectories(file.getParent());
    Files.writeString(file, "x");
    Files.setLastModifiedTime(
        file, FileTime.from(Instant.now().minus(ageDays, ChronoUnit.DAYS)));
    return file;
  }
}
