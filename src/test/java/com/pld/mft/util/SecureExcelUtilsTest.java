package com.pld.mft.util;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullSource;
import org.junit.jupiter.params.provider.ValueSource;

class SecureExcelUtilsTest {

  @TempDir Path tempDir;

  // ===== sanitizeFilename =====

  @ParameterizedTest
  @NullSource
  @ValueSource(strings = {"", "   ", "\t"})
  void sanitizeFilename_nullOrBlank_throws(String input) {
    assertThatThrownBy(() -> SecureExcelUtils.sanitizeFilename(input))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void sanitizeFilename_pathTraversal_keepsLastSegment() {
    assertThat(SecureExcelUtils.sanitizeFilename("../../../etc/passwd.xlsx"))
        .isEqualTo("passwd.xlsx");
    assertThat(SecureExcelUtils.sanitizeFilename("C:\\Users\\Admin\\parts.xlsx"))
        .isEqualTo("parts.xlsx");
  }

  @Test
  void sanitizeFilename_controlCharactersRemoved() {
    assertThat(SecureExcelUtils.sanitizeFilename("mas\u0000ter\u0001.xlsx"))
        .isEqualTo("master.xlsx");
  }

  @Test
  void sanitizeFilename_specialCharactersReplaced() {
    assertThat(SecureExcelUtils.sanitizeFilename("parts<>|?*.xlsx")).isEqualTo("parts_____.xlsx");
  }

  @Test
  void sanitizeFilename_dotsCollapsedAndTrimmed() {
    assertThat(SecureExcelUtils.sanitizeFilename("...parts..list.xlsx  "))
        .isEqualTo("parts.list.xlsx");
  }

  @Test
  void sanitizeFilename_nonLatinLettersPreserved() {
    assertThat(SecureExcelUtils.sanitizeFilename("Детали 2024.xlsx")).isEqualTo("Детали 2024.xlsx");
  }

  @ParameterizedTest
  @ValueSource(strings = {"parts.xls", "parts.csv", "parts"})
  void sanitizeFilename_otherExtension_throws(String filename) {
    assertThatThrownBy(() -> SecureExcelUtils.sanitizeFilename(filename))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("extension");
  }

  @Test
  void sanitizeSegment_keepsNoExtensionRequirement() {
    assertThat(SecureExcelUtils.sanitizeSegment("plant/01")).isEqualTo("01");
    assertThat(SecureExcelUtils.sanitizeSegment("PLANT:01")).isEqualTo("PLANT_01");
    assertThat(SecureExcelUtils.sanitizeSegment("..")).isEmpty();
  }

  // ===== sanitizeForExcelCell =====

  @ParameterizedTest
  @ValueSource(strings = {"=SUM(A1)", "+1", "-1", "@cmd"})
  void sanitizeForExcelCell_formulaPrefix_quoted(String value) {
    assertThat(SecureExcelUtils.sanitizeForExcelCell(value)).isEqualTo("'" + value);
  }

  @Test
  void sanitizeForExcelCell_plainText_unchanged() {
    assertThat(SecureExcelUtils.sanitizeForExcelCell("[B] must be at most 32767"))
        .isEqualTo("[B] must be at most 32767");
    assertThat(SecureExcelUtils.sanitizeForExcelCell(null)).isNull();
  }

  // ===== validateFileContent / createWorkbook =====

  @Test
  void validateFileContent_validXlsx_passes() throws IOException {
    Path xlsx = writeWorkbook("valid.xlsx", 3);

    assertThatCode(() -> SecureExcelUtils.validateFileContent(xlsx)).doesNotThrowAnyException();
  }

  @Test
  void validateFileContent_wrongExtension_throwsSecurityException() throws IOException {
    Path xls = tempDir.resolve("legacy.xls");
    Files.write(xls, new byte[] {(byte) 0xD0, (byte) 0xCF, 0x11, (byte) 0xE0});

    assertThatThrownBy(() -> SecureExcelUtils.validateFileContent(xls))
        .isInstanceOf(SecurityException.class)
        .hasMessageContaining(".xlsx");
  }

  @Test
  void validateFileContent_pdfRenamedToXlsx_throwsSecurityException() throws IOException {
    Path fake = tempDir.resolve("fake.xlsx");
    Files.write(fake, new byte[] {0x25, 0x50, 0x44, 0x46, 0x2D});

    assertThatThrownBy(() -> SecureExcelUtils.validateFileContent(fake))
        .isInstanceOf(SecurityException.class)
        .hasMessageContaining("xlsx format");
  }

  @Test
  void validateFileContent_tooSmall_throwsSecurityException() throws IOException {
    Path tiny = tempDir.resolve("tiny.xlsx");
    Files.write(tiny, new byte[] {0x50});

    assertThatThrownBy(() -> SecureExcelUtils.validateFileContent(tiny))
        .isInstanceOf(SecurityException.class)
        .hasMessageContaining("too small");
  }

  @Test
  void createWorkbook_opensSheets() throws IOException {
    Path xlsx = writeWorkbook("parts.xlsx", 2);

    try (Workbook workbook = SecureExcelUtils.createWorkbook(xlsx)) {
      assertThat(workbook.getSheetAt(0).getLastRowNum()).isEqualTo(1);
    }
  }

  // ===== countRows =====

  @Test
  void countRows_countsWrittenRowsOfRequestedSheet() throws IOException {
    Path xlsx;
    try (XSSFWorkbook workbook = new XSSFWorkbook()) {
      Sheet first = workbook.createSheet("Data");
      for (int i = 0; i < 5; i++) {
        first.createRow(i).createCell(0).setCellValue("r" + i);
      }
      workbook.createSheet("Notes").createRow(0).createCell(0).setCellValue("n");
      xlsx = save(workbook, "two-sheets.xlsx");
    }

    assertThat(SecureExcelUtils.countRows(xlsx, 0)).isEqualTo(5);
    assertThat(SecureExcelUtils.countRows(xlsx, 1)).isEqualTo(1);
  }

  @Test
  void countRows_missingSheet_throwsIOException() throws IOException {
    Path xlsx = writeWorkbook("one-sheet.xlsx", 1);

    assertThatThrownBy(() -> SecureExcelUtils.countRows(xlsx, 3))
        .isInstanceOf(IOException.class)
        .hasMessageContaining("Sheet index 3");
  }

  private Path writeWorkbook(String name, int rows) throws IOException {
    try (XSSFWorkbook workbook = new XSSFWorkbook()) {
      Sheet sheet = workbook.createSheet("Sheet1");
      for (int i = 0; i < rows; i++) {
        sheet.createRow(i).createCell(0).setCellValue("value" + i);
      }
      return save(workbook, name);
    }
  }

  private Path save(XSSFWorkbook workbook, String name) throws IOException {
    Path file = tempDir.resolve(name);
    try (OutputStream out = Files.newOutputStream(file)) {
      workbook.write(out);
    }
    return file;
  }
}
