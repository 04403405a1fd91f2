package com.pld.mft.util;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.Locale;
import javax.xml.stream.XMLInputFactory;
import javax.xml.stream.XMLStreamConstants;
import javax.xml.stream.XMLStreamReader;
import org.apache.poi.openxml4j.opc.OPCPackage;
import org.apache.poi.openxml4j.opc.PackageAccess;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.util.IOUtils;
import org.apache.poi.xssf.eventusermodel.XSSFReader;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;

/**
 * Opening and checking uploaded xlsx files.
 *
 * <p>Workbooks are opened read-only through {@link OPCPackage}, whose XML parsing has external
 * entities disabled. POI's global allocation cap guards against zip bombs. Anything that looks
 * like a disguised or hostile file raises {@link SecurityException}.
 */
public final class SecureExcelUtils {

  /** Largest single allocation POI may make while reading a workbook. */
  private static final int MAX_BYTE_ARRAY_SIZE = 200_000_000;

  /** Local file header of a ZIP archive ("PK\3\4"). */
  private static final byte[] XLSX_MAGIC = {0x50, 0x4B, 0x03, 0x04};

  private static final String XLSX_EXTENSION = ".xlsx";

  static {
    IOUtils.setByteArrayMaxOverride(MAX_BYTE_ARRAY_SIZE);
  }

  private SecureExcelUtils() {}

  /**
   * Opens {@code path} read-only after checking its extension and signature. The caller closes the
   * workbook.
   */
  public static Workbook createWorkbook(Path path) throws IOException {
    validateFileContent(path);
    try {
      return new XSSFWorkbook(OPCPackage.open(path.toFile(), PackageAccess.READ));
    } catch (Exception e) {
      throw new IOException("Failed to open xlsx file: " + e.getMessage(), e);
    }
  }

  /**
   * @throws SecurityException if the file is not named .xlsx or does not start with a ZIP header
   */
  public static void validateFileContent(Path path) throws IOException {
    String fileName = path.getFileName().toString().toLowerCase(Locale.ROOT);
    if (!fileName.endsWith(XLSX_EXTENSION)) {
      throw new SecurityException("Only .xlsx files are supported");
    }
    if (!startsWith(readHeader(path), XLSX_MAGIC)) {
      throw new SecurityException("File content does not match the xlsx format");
    }
  }

  /**
   * Reduces a client-supplied name to a safe file name: directory parts and control characters go,
   * anything but letters, digits, dot, dash, underscore and space becomes '_', and runs of dots
   * collapse.
   *
   * @throws IllegalArgumentException if nothing usable remains or the extension is not .xlsx
   */
  public static String sanitizeFilename(String originalFilename) {
    if (originalFilename == null || originalFilename.isBlank()) {
      throw new IllegalArgumentException("Filename cannot be empty");
    }

    String filename = sanitizeSegment(originalFilename);
    if (filename.isBlank()) {
      throw new IllegalArgumentException("Filename is invalid after sanitization");
    }
    if (!filename.toLowerCase(Locale.ROOT).endsWith(XLSX_EXTENSION)) {
      throw new IllegalArgumentException("Invalid file extension");
    }
    return filename;
  }

  /**
   * The same character rules as {@link #sanitizeFilename(String)} without the extension check.
   * Returns an empty string when nothing usable remains.
   */
  public static String sanitizeSegment(String value) {
    String segment = value;
    int lastSlash = Math.max(segment.lastIndexOf('/'), segment.lastIndexOf('\\'));
    if (lastSlash >= 0) {
      segment = segment.substring(lastSlash + 1);
    }
    return segment
        .replaceAll("[\\x00-\\x1F\\x7F]", "")
        .replaceAll("[^\\p{L}\\p{N}.\\-_\\s]", "_")
        .replaceAll("\\.{2,}", ".")
        .replaceAll("^[.\\s]+|[.\\s]+$", "");
  }

  /** Quotes values Excel would otherwise evaluate as a formula. */
  public static String sanitizeForExcelCell(String value) {
    if (value == null || value.isEmpty()) {
      return value;
    }
    char first = value.charAt(0);
    if (first == '=' || first == '+' || first == '-' || first == '@' || first == '\t'
        || first == '\r' || first == '\n') {
      return "'" + value;
    }
    return value;
  }

  /**
   * Counts {@code <row>} elements of one sheet by streaming its XML, without building the workbook.
   * Empty rows Excel never wrote are not counted.
   *
   * @param sheetIndex 0-based
   */
  public static int countRows(Path xlsxFile, int sheetIndex) throws IOException {
    try (OPCPackage pkg = OPCPackage.open(xlsxFile.toFile(), PackageAccess.READ)) {
      Iterator<InputStream> sheets = new XSSFReader(pkg).getSheetsData();
      for (int current = 0; sheets.hasNext(); current++) {
        try (InputStream sheet = sheets.next()) {
          if (current == sheetIndex) {
            return countRowElements(sheet);
          }
        }
      }
      throw new IOException("Sheet index " + sheetIndex + " not found in workbook");
    } catch (IOException e) {
      throw e;
    } catch (Exception e) {
      throw new IOException("Failed to count rows: " + e.getMessage(), e);
    }
  }

  private static int countRowElements(InputStream sheetXml) throws IOException {
    XMLInputFactory factory = XMLInputFactory.newInstance();
    factory.setProperty(XMLInputFactory.IS_SUPPORTING_EXTERNAL_ENTITIES, false);
    factory.setProperty(XMLInputFactory.SUPPORT_DTD, false);
    try {
      XMLStreamReader reader = factory.createXMLStreamReader(sheetXml);
      int rows = 0;
      while (reader.hasNext()) {
        if (reader.next() == XMLStreamConstants.START_ELEMENT
            && "row".equals(reader.getLocalName())) {
          rows++;
        }
      }
      reader.close();
      return rows;
    } catch (Exception e) {
      throw new IOException("Failed to read sheet XML: " + e.getMessage(), e);
    }
  }

  private static byte[] readHeader(Path path) throws IOException {
    try (InputStream in = Files.newInputStream(path)) {
      byte[] header = in.readNBytes(XLSX_MAGIC.length);
      if (header.length < XLSX_MAGIC.length) {
        throw new SecurityException("File is too small to be an xlsx workbook");
      }
      return header;
    }
  }

  private static boolean startsWith(byte[] header, byte[] magic) {
    for (int i = 0; i < magic.length; i++) {
      if (header[i] != magic[i]) {
        return false;
      }
    }
    return true;
  }
}
