package com.pld.mft.config;

import jakarta.annotation.PostConstruct;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Data
@Component
@ConfigurationProperties(prefix = "mft.import")
public class ImportProperties {

  private int maxFileSizeMb = 10;
  private int maxRows = 10000;
  private int preCountBuffer = 100;
  private int retentionDays = 30;
  private String tempDirectory = System.getProperty("java.io.tmpdir") + "/mft-import";
  private String errorColumnName = "_ERRORS";

  @PostConstruct
  public void init() throws IOException {
    Files.createDirectories(getTempDirectoryPath());
  }

  public Path getTempDirectoryPath() {
    return Path.of(tempDirectory);
  }

  public Path getErrorsDirectoryPath() {
    return getTempDirectoryPath().resolve("errors");
  }
}
