package com.pld.mft.service.pipeline.parse;

import com.pld.mft.annotation.HeaderMatchMode;
import lombok.Getter;

/** A required column whose header is missing or does not match. */
@Getter
public class ColumnResolutionException extends RuntimeException {

  private final String fieldName;
  private final String expectedHeader;
  private final String actualHeader;
  private final String columnLetter;
  private final HeaderMatchMode matchMode;

  public ColumnResolutionException(
      String fieldName,
      String expectedHeader,
      String actualHeader,
      String columnLetter,
      HeaderMatchMode matchMode) {
    super(buildMessage(fieldName, expectedHeader, actualHeader, columnLetter));
    this.fieldName = fieldName;
    this.expectedHeader = expectedHeader;
    this.actualHeader = actualHeader;
    this.columnLetter = columnLetter;
    this.matchMode = matchMode;
  }

  /** Message for the uploader; unlike {@link #getMessage()} it leaves out the DTO field name. */
  public String toUserMessage() {
    if (columnLetter != null && actualHeader != null && !actualHeader.isBlank()) {
      return "Column %s has header '%s', expected '%s'"
          .formatted(columnLetter, actualHeader, expectedHeader);
    }
    if (columnLetter != null) {
      return "Column %s has no header, expected '%s'".formatted(columnLetter, expectedHeader);
    }
    return "Required column '%s' not found".formatted(expectedHeader);
  }

  private static String buildMessage(
      String fieldName, String expectedHeader, String actualHeader, String columnLetter) {
    if (columnLetter != null) {
      return "Column %s header mismatch for field '%s': expected '%s', actual '%s'"
          .formatted(columnLetter, fieldName, expectedHeader, actualHeader);
    }
    return "Could not find column for field '%s' with header '%s'"
        .formatted(fieldName, expectedHeader);
  }
}
