package com.pld.mft.service.pipeline.report;

import static org.assertj.core.api.Assertions.assertThat;

import com.pld.mft.config.ExcelImportConfig;
import com.pld.mft.config.ImportProperties;
import com.pld.mft.templates.masterdata.config.MasterDataImportConfig;
import com.pld.mft.validation.CellError;
import com.pld.mft.validation.ExcelValidationResult;
import com.pld.mft.validation.RowError;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.apache.poi.ss.usermodel.CellStyle;
import org.apache.poi.ss.usermodel.FillPatternType;
import org.apache.poi.ss.usermodel.IndexedColors;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ExcelErrorReportServiceTest {

  @TempDir Path tempDir;

  private ExcelErrorReportService reportService;
  private ExcelImportConfig config;

  @BeforeEach
  void setUp() {
    ImportProperties properties = new ImportProperties();
    properties.setTempDirectory(tempDir.toString());
    reportService = new ExcelErrorReportService(properties);
    config = new MasterDataImportConfig("ERRORS");
  }

  @Test
  void report_appendsErrorColumnAndHighlightsFailingCells() throws IOException {
    Path upload = createUpload();
    ExcelValidationResult result =
        ExcelValidationResult.failure(
            3,
            List.of(
                rowError(3, cellError(1, "B", "modelCode", "is not a known model code")),
                rowError(
                    4,
                    cellError(0, "A", "partNumber", "PART_NUMBER is required"),
                    cellError(-1, "?", "lineCode", "LINE_CODE L1 belongs to workshop AS"))));

    Path report = reportService.generateErrorReport(upload, result, config, "parts.xlsx");

    assertThat(report.getParent()).isEqualTo(tempDir.resolve("errors"));
    try (XSSFWorkbook wb = new XSSFWorkbook(Files.newInputStream(report))) {
      Sheet sheet = wb.getSheetAt(0);
      assertThat(sheet.getRow(0).getCell(3).getStringCellValue()).isEqualTo("ERRORS");
      assertThat(sheet.getRow(1).getCell(3)).isNull();
      assertThat(sheet.getRow(2).getCell(3).getStringCellValue())
          .isEqualTo("[B] is not a known model code");
      assertThat(sheet.getRow(3).getCell(3).getStringCellValue())
          .isEqualTo("[A] PART_NUMBER is required; [?] LINE_CODE L1 belongs to workshop AS");

      assertRose(sheet.getRow(2).getCell(1).getCellStyle());
      assertRose(sheet.getRow(3).getCell(0).getCellStyle());
      assertThat(sheet.getRow(2).getCell(0).getCellStyle().getFillPattern())
          .isEqualTo(FillPatternType.NO_FILL);

      assertThat(sheet.getRow(1).getCell(0).getStringCellValue()).isEqualTo("P-1");
      assertThat(sheet.getRow(2).getCell(2).getNumericCellValue()).isEqualTo(2.5);
      assertThat(sheet.getRow(5).getCell(0).getStringCellValue())
          .isEqualTo(ExcelErrorReportService.NOTICE);
    }
  }

  @Test
  void report_copiesOtherSheetsUnchanged() throws IOException {
    Path upload = createUpload();

    Path report =
        reportService.generateErrorReport(
            upload,
            ExcelValidationResult.failure(
                1, List.of(rowError(2, cellError(0, "A", "partNumber", "bad")))),
            config,
            "parts.xlsx");

    try (XSSFWorkbook wb = new XSSFWorkbook(Files.newInputStream(report))) {
      assertThat(wb.getNumberOfSheets()).isEqualTo(2);
      Sheet notes = wb.getSheet("notes");
      assertThat(notes.getRow(0).getCell(0).getStringCellValue()).isEqualTo("Filled by planning");
      assertThat(notes.getRow(0).getLastCellNum()).isEqualTo((short) 1);
    }
  }

  @Test
  void report_writesMetaFileWithOriginalName() throws IOException {
    Path upload = createUpload();

    Path report =
        reportService.generateErrorReport(
            upload,
            ExcelValidationResult.failure(
                1, List.of(rowError(2, cellError(0, "A", "partNumber", "bad")))),
            config,
            "Детали.xlsx");

    String fileId = report.getFileName().toString().replace(".xlsx", "");
    Path meta = tempDir.resolve("errors").resolve(fileId + ".meta");
    assertThat(Files.readString(meta, StandardCharsets.UTF_8)).isEqualTo("Детали.xlsx");
  }

  @Test
  void report_withoutOriginalName_writesNoMetaFile() throws IOException {
    Path upload = createUpload();

    Path report =
        reportService.generateErrorReport(
            upload,
            ExcelValidationResult.failure(
                1, List.of(rowError(2, cellError(0, "A", "partNumber", "bad")))),
            config,
            null);

    String fileId = report.getFileName().toString().replace(".xlsx", "");
    assertThat(tempDir.resolve("errors").resolve(fileId + ".meta")).doesNotExist();
  }

  private void assertRose(CellStyle style) {
    assertThat(style.getFillForegroundColor()).isEqualTo(IndexedColors.ROSE.getIndex());
    assertThat(style.getFillPattern()).isEqualTo(FillPatternType.SOLID_FOREGROUND);
  }

  private Path createUpload() throws IOException {
    Path file = tempDir.resolve("upload.xlsx");
    try (XSSFWorkbook wb = new XSSFWorkbook(); OutputStream out = Files.newOutputStream(file)) {
      Sheet sheet = wb.createSheet("parts");
      Row header = sheet.createRow(0);
      header.createCell(0).setCellValue("PART_NUMBER");
      header.createCell(1).setCellValue("MODEL_CODE");
      header.createCell(2).setCellValue("PART_WEIGHT_KG");
      for (int i = 1; i <= 3; i++) {
        Row row = sheet.createRow(i);
        row.createCell(0).setCellValue("P-" + i);
        row.createCell(1).setCellValue(i == 2 ? "Z99" : "A01");
        row.createCell(2).setCellValue(i * 1.25);
      }
      wb.createSheet("notes").createRow(0).createCell(0).setCellValue("Filled by planning");
      wb.write(out);
    }
    return file;
  }

  private RowError rowError(int rowNumber, CellError... errors) {
    return RowError.builder()
        .rowNumber(rowNumber)
        .cellErrors(new ArrayList<>(List.of(errors)))
        .build();
  }

  private CellError cellError(int index, String letter, String field, String message) {
    return CellError.builder()
        .columnIndex(index)
        .columnLetter(letter)
        .fieldName(field)
        .headerName(field)
        .message(message)
        .build();
  }
}
