package com.pld.mft.util;

/** Conversions between spreadsheet column letters and 0-based indexes. */
public final class ExcelColumnUtil {

  private static final int RADIX = 26;

  private ExcelColumnUtil() {}

  /** "A" is 0, "Z" is 25, "AA" is 26. Blank input gives -1. */
  public static int letterToIndex(String column) {
    if (column == null || column.isBlank()) {
      return -1;
    }

    String letters = column.trim().toUpperCase();
    int position = 0;
    for (char c : letters.toCharArray()) {
      if (c < 'A' || c > 'Z') {
        throw new IllegalArgumentException("Invalid column letter: " + column);
      }
      position = position * RADIX + (c - 'A' + 1);
    }
    return position - 1;
  }

  /** Inverse of {@link #letterToIndex(String)}. */
  public static String indexToLetter(int index) {
    if (index < 0) {
      throw new IllegalArgumentException("Column index must be non-negative: " + index);
    }

    StringBuilder letters = new StringBuilder();
    int remaining = index + 1;
    while (remaining > 0) {
      int digit = (remaining - 1) % RADIX;
      letters.insert(0, (char) ('A' + digit));
      remaining = (remaining - 1) / RADIX;
    }
    return letters.toString();
  }
}
