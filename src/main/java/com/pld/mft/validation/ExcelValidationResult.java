package com.pld.mft.validation;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ExcelValidationResult {

  private boolean valid;
  private int totalRows;
  private int errorRowCount;
  private int totalErrorCount;
  @Builder.Default private List<RowError> rowErrors = new ArrayList<>();

  public static ExcelValidationResult success(int totalRows) {
    return ExcelValidationResult.builder().valid(true).totalRows(totalRows).build();
  }

  public static ExcelValidationResult failure(int totalRows, List<RowError> rowErrors) {
    ExcelValidationResult result = success(totalRows);
    result.merge(rowErrors);
    return result;
  }

  /** Folds {@code additionalErrors} in, joining errors of the same row. */
  public void merge(List<RowError> additionalErrors) {
    for (RowError source : additionalErrors) {
      for (CellError cellError : source.getCellErrors()) {
        RowError.addTo(rowErrors, source.getRowNumber(), cellError);
      }
    }
    if (!rowErrors.isEmpty()) {
      rowErrors.sort(Comparator.comparingInt(RowError::getRowNumber));
      valid = false;
      errorRowCount = rowErrors.size();
      totalErrorCount = rowErrors.stream().mapToInt(r -> r.getCellErrors().size()).sum();
    }
  }
}
