package com.pld.mft.validation;

import lombok.Builder;

/**
 * One rejected cell. {@code columnIndex} is 0-based and -1 while the column is unknown; {@code
 * columnLetter} is "?" in that case.
 */
@Builder
public record CellError(
    int columnIndex,
    String columnLetter,
    String fieldName,
    String headerName,
    Object rejectedValue,
    String message) {

  public boolean hasColumn() {
    return columnIndex >= 0;
  }

  public CellError withColumn(int index, String letter) {
    return new CellError(index, letter, fieldName, headerName, rejectedValue, message);
  }
}
