package com.pld.mft.service.pipeline.parse;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowableOfType;
import static org.assertj.core.api.Assertions.tuple;

import com.pld.mft.annotation.ExcelColumn;
import com.pld.mft.annotation.HeaderMatchMode;
import com.pld.mft.config.ExcelImportConfig;
import com.pld.mft.templates.masterdata.config.MasterDataImportConfig;
import com.pld.mft.templates.masterdata.dto.MasterDataRowDto;
import com.pld.mft.validation.CellError;
import java.io.IOException;
import java.io.OutputStream;
import java.math.BigDecimal;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.LocalDateTime;
import lombok.Data;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.util.CellRangeAddress;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ExcelParserServiceTest {

  private ExcelParserService parserService;
  private ExcelImportConfig config;

  @TempDir Path tempDir;

  @BeforeEach
  void setUp() {
    parserService = new ExcelParserService();
    config = new MasterDataImportConfig(null);
  }

  @Test
  void parse_masterDataSheet_findsColumnsInAnyOrder() throws IOException {
    Path file =
        write(
            wb -> {
              Sheet sheet = wb.createSheet("parts");
              header(sheet, "MODEL_CODE", "PART_WEIGHT_KG", "PART_NUMBER", "BOX_LENGTH_MM");
              Row row = sheet.createRow(1);
              row.createCell(0).setCellValue("A01");
              row.createCell(1).setCellValue(1.25);
              row.createCell(2).setCellValue("  P-100  ");
              row.createCell(3).setCellValue(600);
            });

    ExcelParserService.ParseResult<MasterDataRowDto> result =
        parserService.parse(file, MasterDataRowDto.class, config);

    assertThat(result.rows()).hasSize(1);
    MasterDataRowDto row = result.rows().get(0);
    assertThat(row.getPartNumber()).isEqualTo("P-100");
    assertThat(row.getModelCode()).isEqualTo("A01");
    assertThat(row.getPartWeightKg()).isEqualByComparingTo("1.25");
    assertThat(row.getBoxLengthMm()).isEqualTo(600);
    assertThat(row.getSupplierName()).isNull();
    assertThat(result.sourceRowNumbers()).containsExactly(2);
    assertThat(result.mappingFor("partNumber"))
        .map(ExcelParserService.ColumnMapping::resolvedColumnLetter)
        .contains("C");
    assertThat(result.mappingFor("supplierName")).isEmpty();
  }

  @Test
  void parse_missingRequiredHeader_reportsAllAtOnce() throws IOException {
    Path file =
        write(
            wb -> {
              Sheet sheet = wb.createSheet();
              header(sheet, "NAME");
              sheet.createRow(1).createCell(0).setCellValue("x");
            });

    ColumnResolutionBatchException ex =
        catchThrowableOfType(
            () -> parserService.parse(file, RequiredColumns.class, simpleConfig()),
            ColumnResolutionBatchException.class);

    assertThat(ex.getExceptions())
        .extracting(ColumnResolutionException::getExpectedHeader)
        .containsExactly("CODE", "QTY");
    assertThat(ex.toUserMessage()).contains("Required column 'CODE' not found");
  }

  @Test
  void parse_fixedColumnWithWrongHeader_failsWithColumnLetter() throws IOException {
    Path file =
        write(
            wb -> {
              Sheet sheet = wb.createSheet();
              header(sheet, "NAME", "CODE_X");
              sheet.createRow(1).createCell(0).setCellValue("x");
            });

    assertThatThrownBy(() -> parserService.parse(file, FixedColumn.class, simpleConfig()))
        .isInstanceOf(ColumnResolutionBatchException.class)
        .extracting(e -> ((ColumnResolutionBatchException) e).toUserMessage())
        .isEqualTo("Column B has header 'CODE_X', expected 'CODE'");
  }

  @Test
  void parse_headerMatchModes() throws IOException {
    Path file =
        write(
            wb -> {
              Sheet sheet = wb.createSheet();
              header(sheet, "part number", "Total weight (kg)", "Line code A", "QTY-7");
              Row row = sheet.createRow(1);
              row.createCell(0).setCellValue("P-1");
              row.createCell(1).setCellValue(2.5);
              row.createCell(2).setCellValue("L1");
              row.createCell(3).setCellValue(7);
            });

    ExcelParserService.ParseResult<MatchModes> result =
        parserService.parse(file, MatchModes.class, simpleConfig());

    MatchModes row = result.rows().get(0);
    assertThat(row.getPartNumber()).isEqualTo("P-1");
    assertThat(row.getWeight()).isEqualByComparingTo("2.5");
    assertThat(row.getLine()).isEqualTo("L1");
    assertThat(row.getQuantity()).isEqualTo(7);
  }

  @Test
  void parse_unconvertibleCells_leaveFieldNullAndRecordError() throws IOException {
    Path file =
        write(
            wb -> {
              Sheet sheet = wb.createSheet();
              header(sheet, "NAME", "QTY", "DAY", "AT");
              Row row = sheet.createRow(1);
              row.createCell(0).setCellValue("ok");
              row.createCell(1).setCellValue("twelve");
              row.createCell(2).setCellValue("01/03/2024");
              row.createCell(3).setCellValue("2024-03-01 08:30");
            });

    ExcelParserService.ParseResult<Typed> result =
        parserService.parse(file, Typed.class, simpleConfig());

    Typed row = result.rows().get(0);
    assertThat(row.getName()).isEqualTo("ok");
    assertThat(row.getQuantity()).isNull();
    assertThat(row.getDay()).isNull();
    assertThat(row.getAt()).isEqualTo(LocalDateTime.of(2024, 3, 1, 8, 30));

    assertThat(result.parseErrors()).hasSize(1);
    assertThat(result.parseErrors().get(0).getRowNumber()).isEqualTo(2);
    assertThat(result.parseErrors().get(0).getCellErrors())
        .extracting(CellError::columnLetter, CellError::message)
        .containsExactly(
            tuple("B", "'twelve' is not a valid whole number"),
            tuple("C", "'01/03/2024' is not a valid date (yyyy-MM-dd)"));
  }

  @Test
  void parse_numbersWithSeparatorsAsText() throws IOException {
    Path file =
        write(
            wb -> {
              Sheet sheet = wb.createSheet();
              header(sheet, "NAME", "QTY");
              Row row = sheet.createRow(1);
              row.createCell(0).setCellValue("a");
              row.createCell(1).setCellValue("1,200");
            });

    Typed row = parserService.parse(file, Typed.class, simpleConfig()).rows().get(0);

    assertThat(row.getQuantity()).isEqualTo(1200);
  }

  @Test
  void parse_blankRowsSkippedAndFooterStops() throws IOException {
    Path file =
        write(
            wb -> {
              Sheet sheet = wb.createSheet();
              header(sheet, "NAME");
              sheet.createRow(1).createCell(0).setCellValue("first");
              sheet.createRow(2).createCell(0).setCellValue("   ");
              sheet.createRow(4).createCell(0).setCellValue("second");
              sheet.createRow(5).createCell(0).setCellValue("END OF DATA");
              sheet.createRow(6).createCell(0).setCellValue("after footer");
            });
    ExcelImportConfig withFooter =
        new ExcelImportConfig() {
          @Override
          public String getFooterMarker() {
            return "END OF DATA";
          }
        };

    ExcelParserService.ParseResult<Typed> result =
        parserService.parse(file, Typed.class, withFooter);

    assertThat(result.rows()).extracting(Typed::getName).containsExactly("first", "second");
    assertThat(result.sourceRowNumbers()).containsExactly(2, 5);
  }

  @Test
  void parse_mergedCellReadsTopLeftValue() throws IOException {
    Path file =
        write(
            wb -> {
              Sheet sheet = wb.createSheet();
              header(sheet, "NAME", "QTY");
              sheet.createRow(1).createCell(0).setCellValue("shared");
              sheet.getRow(1).createCell(1).setCellValue(1);
              sheet.createRow(2).createCell(1).setCellValue(2);
              sheet.addMergedRegion(new CellRangeAddress(1, 2, 0, 0));
            });

    ExcelParserService.ParseResult<Typed> result =
        parserService.parse(file, Typed.class, simpleConfig());

    assertThat(result.rows()).extracting(Typed::getName).containsExactly("shared", "shared");
  }

  @Test
  void parse_maxRows_stopsOneRowPastTheLimit() throws IOException {
    Path file =
        write(
            wb -> {
              Sheet sheet = wb.createSheet();
              header(sheet, "NAME");
              for (int i = 1; i <= 10; i++) {
                sheet.createRow(i).createCell(0).setCellValue("row" + i);
              }
            });

    ExcelParserService.ParseResult<Typed> result =
        parserService.parse(file, Typed.class, simpleConfig(), 3);

    assertThat(result.rows()).hasSize(4);
  }

  @Test
  void parse_emptyHeaderRow_rejected() throws IOException {
    Path file = write(wb -> wb.createSheet().createRow(3).createCell(0).setCellValue("x"));

    assertThatThrownBy(() -> parserService.parse(file, Typed.class, simpleConfig()))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("Header row 1");
  }

  private ExcelImportConfig simpleConfig() {
    return new ExcelImportConfig() {};
  }

  private void header(Sheet sheet, String... names) {
    Row row = sheet.createRow(0);
    for (int i = 0; i < names.length; i++) {
      row.createCell(i).setCellValue(names[i]);
    }
  }

  private Path write(SheetWriter writer) throws IOException {
    Path file = Files.createTempFile(tempDir, "parse", ".xlsx");
    try (XSSFWorkbook wb = new XSSFWorkbook(); OutputStream out = Files.newOutputStream(file)) {
      writer.accept(wb);
      wb.write(out);
    }
    return file;
  }

  @FunctionalInterface
  private interface SheetWriter {
    void accept(XSSFWorkbook workbook);
  }

  @Data
  static class RequiredColumns {
    @ExcelColumn(header = "NAME", required = true)
    private String name;

    @ExcelColumn(header = "CODE", required = true)
    private String code;

    @ExcelColumn(header = "QTY", required = true)
    private Integer quantity;

    @ExcelColumn(header = "NOTE")
    private String note;
  }

  @Data
  static class FixedColumn {
    @ExcelColumn(header = "NAME", column = "A", required = true)
    private String name;

    @ExcelColumn(header = "CODE", column = "B", required = true)
    private String code;
  }

  @Data
  static class MatchModes {
    @ExcelColumn(header = "PART NUMBER")
    private String partNumber;

    @ExcelColumn(header = "weight", matchMode = HeaderMatchMode.CONTAINS)
    private BigDecimal weight;

    @ExcelColumn(header = "Line code", matchMode = HeaderMatchMode.STARTS_WITH)
    private String line;

    @ExcelColumn(header = "QTY-\\d+", matchMode = HeaderMatchMode.REGEX)
    private Integer quantity;
  }

  @Data
  static class Typed {
    @ExcelColumn(header = "NAME")
    private String name;

    @ExcelColumn(header = "QTY")
    private Integer quantity;

    @ExcelColumn(header = "DAY", dateFormat = "yyyy-MM-dd")
    private LocalDate day;

    @ExcelColumn(header = "AT")
    private LocalDateTime at;
  }
}
