package com.pld.mft.service.pipeline.report;

import com.pld.mft.config.ExcelImportConfig;
import com.pld.mft.config.ImportProperties;
import com.pld.mft.util.SecureExcelUtils;
import com.pld.mft.util.WorkbookCopyUtils;
import com.pld.mft.validation.CellError;
import com.pld.mft.validation.ExcelValidationResult;
import com.pld.mft.validation.RowError;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellStyle;
import org.apache.poi.ss.usermodel.Font;
import org.apache.poi.ss.usermodel.IndexedColors;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.util.CellRangeAddress;
import org.apache.poi.xssf.streaming.SXSSFSheet;
import org.apache.poi.xssf.streaming.SXSSFWorkbook;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.springframework.stereotype.Service;

/**
 * Writes a copy of a rejected upload with the failing cells filled rose and an error column
 * appended to the data sheet. Reports are stored as {@code errors/<uuid>.xlsx} under the import
 * temp directory, next to a {@code <uuid>.meta} file holding the original file name.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ExcelErrorReportService {

  static final String NOTICE =
      "This file was regenerated to show import errors. "
          + "Some formatting may differ from the original upload.";

  private static final int ROW_ACCESS_WINDOW = 100;

  private final ImportProperties properties;

  /** Returns the path of the written report. */
  public Path generateErrorReport(
      Path originalXlsx,
      ExcelValidationResult validationResult,
      ExcelImportConfig config,
      String originalFilename)
      throws IOException {
    try (Workbook source = SecureExcelUtils.createWorkbook(originalXlsx);
        XSSFWorkbook targetXssf = new XSSFWorkbook();
        SXSSFWorkbook target = new SXSSFWorkbook(targetXssf, ROW_ACCESS_WINDOW)) {
      Map<Integer, CellStyle> styles = WorkbookCopyUtils.buildStyleMapping(source, targetXssf);
      Map<Integer, RowError> errorsByRow = new HashMap<>();
      for (RowError rowError : validationResult.getRowErrors()) {
        errorsByRow.put(rowError.getRowNumber(), rowError);
      }

      for (int sheetIdx = 0; sheetIdx < source.getNumberOfSheets(); sheetIdx++) {
        Sheet srcSheet = source.getSheetAt(sheetIdx);
        SXSSFSheet tgtSheet = target.createSheet(srcSheet.getSheetName());
        if (sheetIdx == config.getSheetIndex()) {
          copyDataSheet(srcSheet, tgtSheet, target, styles, errorsByRow, config);
        } else {
          copySheet(srcSheet, tgtSheet, styles);
        }
      }

      Path errorsDir = properties.getErrorsDirectoryPath();
      Files.createDirectories(errorsDir);
      String fileId = UUID.randomUUID().toString();
      Path report = errorsDir.resolve(fileId + ".xlsx");
      try (OutputStream out = Files.newOutputStream(report)) {
        target.write(out);
      }
      if (originalFilename != null && !originalFilename.isBlank()) {
        Files.writeString(
            errorsDir.resolve(fileId + ".meta"), originalFilename, StandardCharsets.UTF_8);
      }

      log.info(
          "Error report {} written for {} rows with errors",
          report.getFileName(),
          validationResult.getErrorRowCount());
      return report;
    }
  }

  private void copySheet(Sheet srcSheet, SXSSFSheet tgtSheet, Map<Integer, CellStyle> styles) {
    int maxCol = maxColumn(srcSheet);
    WorkbookCopyUtils.copyColumnWidths(srcSheet, tgtSheet, maxCol);
    WorkbookCopyUtils.copyMergedRegions(srcSheet, tgtSheet);
    for (int rowIdx = 0; rowIdx <= srcSheet.getLastRowNum(); rowIdx++) {
      Row srcRow = srcSheet.getRow(rowIdx);
      if (srcRow != null) {
        copyRow(srcRow, tgtSheet.createRow(rowIdx), styles, Set.of(), null, null);
      }
    }
  }

  private void copyDataSheet(
      Sheet srcSheet,
      SXSSFSheet tgtSheet,
      SXSSFWorkbook target,
      Map<Integer, CellStyle> styles,
      Map<Integer, RowError> errorsByRow,
      ExcelImportConfig config) {
    int errorCol = maxColumn(srcSheet);
    WorkbookCopyUtils.copyColumnWidths(srcSheet, tgtSheet, errorCol);
    WorkbookCopyUtils.copyMergedRegions(srcSheet, tgtSheet);

    Map<Integer, CellStyle> errorStyles = new HashMap<>();
    int headerRowIdx = config.getHeaderRow() - 1;
    int lastRowNum = srcSheet.getLastRowNum();

    // SXSSF only writes forward, so every row is created in order even when the source has gaps.
    for (int rowIdx = 0; rowIdx <= lastRowNum; rowIdx++) {
      Row srcRow = srcSheet.getRow(rowIdx);
      Row tgtRow = tgtSheet.createRow(rowIdx);
      RowError rowError = errorsByRow.get(rowIdx + 1);

      if (srcRow != null) {
        copyRow(srcRow, tgtRow, styles, errorColumns(rowError), target, errorStyles);
      }
      if (rowIdx == headerRowIdx) {
        Cell header = tgtRow.createCell(errorCol);
        header.setCellValue(config.getErrorColumnName());
        header.setCellStyle(fontStyle(target, true, false, null));
      }
      if (rowError != null) {
        tgtRow
            .createCell(errorCol)
            .setCellValue(SecureExcelUtils.sanitizeForExcelCell(rowError.getFormattedMessage()));
      }
    }

    int noticeRowIdx = lastRowNum + 2;
    Cell notice = tgtSheet.createRow(noticeRowIdx).createCell(0);
    notice.setCellValue(NOTICE);
    notice.setCellStyle(fontStyle(target, false, true, IndexedColors.GREY_50_PERCENT));
    if (errorCol > 0) {
      tgtSheet.addMergedRegion(new CellRangeAddress(noticeRowIdx, noticeRowIdx, 0, errorCol - 1));
    }
  }

  private void copyRow(
      Row srcRow,
      Row tgtRow,
      Map<Integer, CellStyle> styles,
      Set<Integer> errorColumns,
      Workbook target,
      Map<Integer, CellStyle> errorStyles) {
    tgtRow.setHeight(srcRow.getHeight());
    for (int colIdx = 0; colIdx < srcRow.getLastCellNum(); colIdx++) {
      Cell srcCell = srcRow.getCell(colIdx);
      if (srcCell == null) {
        continue;
      }
      Cell tgtCell = tgtRow.createCell(colIdx);
      WorkbookCopyUtils.copyCellValue(srcCell, tgtCell);
      CellStyle style = styles.get((int) srcCell.getCellStyle().getIndex());
      if (style != null && errorColumns.contains(colIdx)) {
        style = WorkbookCopyUtils.getOrCreateErrorStyle(target, style, errorStyles);
      }
      if (style != null) {
        tgtCell.setCellStyle(style);
      }
    }
  }

  private Set<Integer> errorColumns(RowError rowError) {
    Set<Integer> columns = new HashSet<>();
    if (rowError != null) {
      for (CellError cellError : rowError.getCellErrors()) {
        if (cellError.hasColumn()) {
          columns.add(cellError.columnIndex());
        }
      }
    }
    return columns;
  }

  private int maxColumn(Sheet sheet) {
    int maxCol = 0;
    for (Row row : sheet) {
      maxCol = Math.max(maxCol, row.getLastCellNum());
    }
    return maxCol;
  }

  private CellStyle fontStyle(
      Workbook workbook, boolean bold, boolean italic, IndexedColors color) {
    Font font = workbook.createFont();
    font.setBold(bold);
    font.setItalic(italic);
    if (color != null) {
      font.setColor(color.getIndex());
    }
    CellStyle style = workbook.createCellStyle();
    style.setFont(font);
    return style;
  }
}
