package com.pld.mft.validation;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RowError {

  /** 1-based sheet row. */
  private int rowNumber;

  @Builder.Default private List<CellError> cellErrors = new ArrayList<>();

  /** "[C] message; [F] message", as written to the report's error column. */
  public String getFormattedMessage() {
    return cellErrors.stream()
        .map(e -> "[" + e.columnLetter() + "] " + e.message())
        .collect(Collectors.joining("; "));
  }

  /** Adds {@code cellError} to the entry for {@code rowNumber}, creating it when missing. */
  public static void addTo(List<RowError> errors, int rowNumber, CellError cellError) {
    for (RowError existing : errors) {
      if (existing.getRowNumber() == rowNumber) {
        existing.getCellErrors().add(cellError);
        return;
      }
    }
    errors.add(
        RowError.builder()
            .rowNumber(rowNumber)
            .cellErrors(new ArrayList<>(List.of(cellError)))
            .build());
  }
}
