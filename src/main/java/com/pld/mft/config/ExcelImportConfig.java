package com.pld.mft.config;

/** Sheet layout of one upload template. Rows are 1-based, the sheet index 0-based. */
public interface ExcelImportConfig {

  default int getHeaderRow() {
    return 1;
  }

  default int getDataStartRow() {
    return 2;
  }

  default int getSheetIndex() {
    return 0;
  }

  /**
   * A row with a cell containing this marker ends the data section. Null or empty disables footer
   * detection.
   */
  default String getFooterMarker() {
    return null;
  }

  /** Header of the column the error report appends to the data sheet. */
  default String getErrorColumnName() {
    return "_ERRORS";
  }
}
