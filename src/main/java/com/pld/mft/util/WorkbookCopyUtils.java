package com.pld.mft.util;

import java.util.HashMap;
import java.util.Map;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellStyle;
import org.apache.poi.ss.usermodel.DateUtil;
import org.apache.poi.ss.usermodel.FillPatternType;
import org.apache.poi.ss.usermodel.IndexedColors;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.util.CellRangeAddress;

/** Copies styles, values and sheet layout from one xlsx workbook into another. */
public final class WorkbookCopyUtils {

  private WorkbookCopyUtils() {}

  /**
   * Clones every cell style of {@code source} into {@code target}, keyed by source style index.
   * The default style (index 0) exists in every workbook and is overwritten rather than added.
   */
  public static Map<Integer, CellStyle> buildStyleMapping(Workbook source, Workbook target) {
    var styles = new HashMap<Integer, CellStyle>();
    for (int i = 0; i < source.getNumCellStyles(); i++) {
      CellStyle copy = i == 0 ? target.getCellStyleAt(0) : target.createCellStyle();
      copy.cloneStyleFrom(source.getCellStyleAt(i));
      styles.put(i, copy);
    }
    return styles;
  }

  /**
   * {@code base} with a rose fill. One error style is created per base style, so large reports stay
   * under the workbook's style limit.
   *
   * @param cache per-report cache, mutated here
   */
  public static CellStyle getOrCreateErrorStyle(
      Workbook workbook, CellStyle base, Map<Integer, CellStyle> cache) {
    return cache.computeIfAbsent(
        (int) base.getIndex(),
        key -> {
          CellStyle errorStyle = workbook.createCellStyle();
          errorStyle.cloneStyleFrom(base);
          errorStyle.setFillForegroundColor(IndexedColors.ROSE.getIndex());
          errorStyle.setFillPattern(FillPatternType.SOLID_FOREGROUND);
          return errorStyle;
        });
  }

  public static void copyCellValue(Cell source, Cell target) {
    switch (source.getCellType()) {
      case STRING -> target.setCellValue(source.getStringCellValue());
      case NUMERIC -> {
        if (DateUtil.isCellDateFormatted(source)) {
          target.setCellValue(source.getLocalDateTimeCellValue());
        } else {
          target.setCellValue(source.getNumericCellValue());
        }
      }
      case BOOLEAN -> target.setCellValue(source.getBooleanCellValue());
      case FORMULA -> target.setCellFormula(source.getCellFormula());
      case ERROR -> target.setCellErrorValue(source.getErrorCellValue());
      case BLANK -> target.setBlank();
      default -> {
        // _NONE: nothing to copy
      }
    }
  }

  /** Copies widths and hidden flags of columns {@code [0, maxCol)} plus the sheet defaults. */
  public static void copyColumnWidths(Sheet source, Sheet target, int maxCol) {
    target.setDefaultColumnWidth(source.getDefaultColumnWidth());
    target.setDefaultRowHeight(source.getDefaultRowHeight());
    for (int col = 0; col < maxCol; col++) {
      target.setColumnWidth(col, source.getColumnWidth(col));
      target.setColumnHidden(col, source.isColumnHidden(col));
    }
  }

  public static void copyMergedRegions(Sheet source, Sheet target) {
    for (CellRangeAddress region : source.getMergedRegions()) {
      target.addMergedRegion(region);
    }
  }
}
