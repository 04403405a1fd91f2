package com.pld.mft.annotation;

/** How a header cell is compared against {@link ExcelColumn#header()}. Values are trimmed first. */
public enum HeaderMatchMode {
  /** Case-insensitive equality. */
  EXACT,
  CONTAINS,
  STARTS_WITH,
  REGEX
}
