package com.pld.mft.service.file;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.usermodel.WorkbookFactory;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.mock.web.MockMultipartFile;

class ExcelUploadFileServiceTest {

  private static final String XLSX_TYPE =
      "application/vnd.openxmlformats-officedocument.spreadsheetml.sheet";

  private ExcelUploadFileService uploadFileService;

  @TempDir Path tempDir;

  @BeforeEach
  void setUp() {
    uploadFileService = new ExcelUploadFileService();
  }

  @Test
  void xlsx_storedInOwnDirectory() throws IOException {
    MockMultipartFile file =
        new MockMultipartFile("file", "parts.xlsx", XLSX_TYPE, xlsxBytes("P-100"));

    Path stored = uploadFileService.storeAndValidateXlsx(file, tempDir);

    assertThat(stored.getFileName().toString()).isEqualTo("parts.xlsx");
    assertThat(stored.getParent().getParent()).isEqualTo(tempDir);
    try (Workbook wb = WorkbookFactory.create(stored.toFile())) {
      assertThat(wb.getSheetAt(0).getRow(0).getCell(0).getStringCellValue()).isEqualTo("P-100");
    }
  }

  @Test
  void twoUploadsWithSameName_doNotCollide() throws IOException {
    byte[] bytes = xlsxBytes("P-100");

    Path first =
        uploadFileService.storeAndValidateXlsx(
            new MockMultipartFile("file", "parts.xlsx", XLSX_TYPE, bytes), tempDir);
    Path second =
        uploadFileService.storeAndValidateXlsx(
            new MockMultipartFile("file", "parts.xlsx", XLSX_TYPE, bytes), tempDir);

    assertThat(first).isNotEqualTo(second);
    assertThat(first).exists();
    assertThat(second).exists();
  }

  @Test
  void legacyXls_rejected() throws IOException {
    MockMultipartFile file =
        new MockMultipartFile("file", "parts.xls", "application/vnd.ms-excel", xlsxBytes("x"));

    assertThatThrownBy(() -> uploadFileService.storeAndValidateXlsx(file, tempDir))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining(".xlsx");
  }

  @Test
  void otherExtension_rejected() {
    MockMultipartFile file =
        new MockMultipartFile("file", "parts.csv", "text/csv", "a,b,c".getBytes());

    assertThatThrownBy(() -> uploadFileService.storeAndValidateXlsx(file, tempDir))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessage("Only .xlsx files can be uploaded");
  }

  @Test
  void missingName_rejected() {
    MockMultipartFile file =
        new MockMultipartFile("file", null, "application/octet-stream", new byte[0]);

    assertThatThrownBy(() -> uploadFileService.storeAndValidateXlsx(file, tempDir))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessage("Uploaded file has no name");
  }

  @Test
  void traversalName_sanitized() throws IOException {
    MockMultipartFile file =
        new MockMultipartFile("file", "../../etc/parts.xlsx", XLSX_TYPE, xlsxBytes("x"));

    Path stored = uploadFileService.storeAndValidateXlsx(file, tempDir);

    assertThat(stored.normalize()).startsWith(tempDir);
    assertThat(stored.getFileName().toString()).doesNotContain("..").endsWith(".xlsx");
  }

  @Test
  void fakeXlsx_rejectedAndDiscarded() throws IOException {
    byte[] pdf = new byte[2048];
    System.arraycopy("%PDF-1.7".getBytes(), 0, pdf, 0, 8);
    MockMultipartFile file = new MockMultipartFile("file", "parts.xlsx", XLSX_TYPE, pdf);

    assertThatThrownBy(() -> uploadFileService.storeAndValidateXlsx(file, tempDir))
        .isInstanceOf(SecurityException.class);
    try (var entries = Files.list(tempDir)) {
      assertThat(entries).isEmpty();
    }
  }

  @Test
  void discard_removesFileAndItsDirectory() throws IOException {
    Path stored =
        uploadFileService.storeAndValidateXlsx(
            new MockMultipartFile("file", "parts.xlsx", XLSX_TYPE, xlsxBytes("x")), tempDir);

    uploadFileService.discard(stored);

    assertThat(stored).doesNotExist();
    assertThat(stored.getParent()).doesNotExist();
    assertThat(tempDir).exists();
  }

  @Test
  void discard_missingFile_doesNotThrow() {
    uploadFileService.discard(tempDir.resolve("gone").resolve("parts.xlsx"));

    assertThat(tempDir).exists();
  }

  private byte[] xlsxBytes(String value) throws IOException {
    try (XSSFWorkbook wb = new XSSFWorkbook(); var out = new ByteArrayOutputStream()) {
      wb.createSheet().createRow(0).createCell(0).setCellValue(value);
      wb.write(out);
      return out.toByteArray();
    }
  }
}
