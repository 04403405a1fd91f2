package com.pld.mft.service.pipeline.parse;

import com.pld.mft.annotation.ExcelColumn;
import com.pld.mft.annotation.HeaderMatchMode;
import com.pld.mft.config.ExcelImportConfig;
import com.pld.mft.util.ExcelColumnUtil;
import com.pld.mft.util.SecureExcelUtils;
import com.pld.mft.validation.CellError;
import com.pld.mft.validation.RowError;
import java.io.IOException;
import java.lang.reflect.Field;
import java.math.BigDecimal;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellType;
import org.apache.poi.ss.usermodel.DataFormatter;
import org.apache.poi.ss.usermodel.DateUtil;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.util.CellRangeAddress;
import org.springframework.stereotype.Service;

/**
 * Reads the data sheet of an upload into row DTOs annotated with {@link ExcelColumn}.
 *
 * <p>Columns are resolved from the header row first; all required columns that cannot be found are
 * reported together as a {@link ColumnResolutionBatchException}. Cells that cannot be converted to
 * the field type leave the field null and produce a {@link CellError} instead of failing the row.
 */
@Slf4j
@Service
public class ExcelParserService {

  private static final ThreadLocal<DataFormatter> DATA_FORMATTER =
      ThreadLocal.withInitial(DataFormatter::new);

  public record ColumnMapping(
      Field field, ExcelColumn annotation, int resolvedColumnIndex, String resolvedColumnLetter) {}

  public record ParseResult<T>(
      List<T> rows,
      List<Integer> sourceRowNumbers,
      List<ColumnMapping> columnMappings,
      List<RowError> parseErrors) {

    public Optional<ColumnMapping> mappingFor(String fieldName) {
      return columnMappings.stream().filter(m -> m.field().getName().equals(fieldName)).findFirst();
    }
  }

  public <T> ParseResult<T> parse(Path xlsxFile, Class<T> dtoClass, ExcelImportConfig config)
      throws IOException {
    return parse(xlsxFile, dtoClass, config, Integer.MAX_VALUE);
  }

  /**
   * Stops after {@code maxRows + 1} data rows, which is enough for the caller to tell the limit was
   * exceeded.
   */
  public <T> ParseResult<T> parse(
      Path xlsxFile, Class<T> dtoClass, ExcelImportConfig config, int maxRows) throws IOException {
    try (Workbook workbook = SecureExcelUtils.createWorkbook(xlsxFile)) {
      Sheet sheet = workbook.getSheetAt(config.getSheetIndex());
      Row headerRow = sheet.getRow(config.getHeaderRow() - 1);
      if (headerRow == null) {
        throw new IllegalArgumentException("Header row " + config.getHeaderRow() + " is empty");
      }

      List<ColumnMapping> mappings = resolveColumnMappings(dtoClass, headerRow, sheet);
      List<RowError> parseErrors = new ArrayList<>();
      List<Integer> sourceRowNumbers = new ArrayList<>();
      List<T> rows =
          parseDataRows(
              sheet, dtoClass, mappings, config, parseErrors, sourceRowNumbers, maxRows);

      log.debug("Parsed {} data rows from {}", rows.size(), xlsxFile.getFileName());
      return new ParseResult<>(rows, sourceRowNumbers, mappings, parseErrors);
    }
  }

  private List<ColumnMapping> resolveColumnMappings(Class<?> dtoClass, Row headerRow, Sheet sheet) {
    Map<Integer, String> headers = buildHeaderMap(headerRow, sheet);
    List<ColumnMapping> mappings = new ArrayList<>();
    List<ColumnResolutionException> failures = new ArrayList<>();

    for (Field field : getAllFields(dtoClass)) {
      ExcelColumn annotation = field.getAnnotation(ExcelColumn.class);
      if (annotation == null) {
        continue;
      }
      try {
        int index = resolveColumnIndex(annotation, field.getName(), headers);
        if (index >= 0) {
          field.setAccessible(true);
          mappings.add(
              new ColumnMapping(field, annotation, index, ExcelColumnUtil.indexToLetter(index)));
        }
      } catch (ColumnResolutionException e) {
        failures.add(e);
      }
    }

    if (!failures.isEmpty()) {
      throw new ColumnResolutionBatchException(failures);
    }
    return mappings;
  }

  private Map<Integer, String> buildHeaderMap(Row headerRow, Sheet sheet) {
    var headers = new LinkedHashMap<Integer, String>();
    for (int i = 0; i < headerRow.getLastCellNum(); i++) {
      Cell cell = headerRow.getCell(i);
      if (cell == null) {
        cell = resolveMergedCell(sheet, headerRow.getRowNum(), i);
      }
      String value = getCellStringValue(cell);
      if (value != null && !value.isBlank()) {
        headers.put(i, value);
      }
    }
    return headers;
  }

  /** -1 for an optional column that is absent. */
  private int resolveColumnIndex(
      ExcelColumn annotation, String fieldName, Map<Integer, String> headers) {
    if (!annotation.column().isEmpty()) {
      int index = ExcelColumnUtil.letterToIndex(annotation.column());
      String actual = headers.get(index);
      if (matchHeader(actual, annotation.header(), annotation.matchMode())) {
        return index;
      }
      if (annotation.required()) {
        throw new ColumnResolutionException(
            fieldName, annotation.header(), actual, annotation.column(), annotation.matchMode());
      }
      log.warn(
          "Optional column {} skipped: expected header '{}', found '{}'",
          annotation.column(),
          annotation.header(),
          actual);
      return -1;
    }

    for (var header : headers.entrySet()) {
      if (matchHeader(header.getValue(), annotation.header(), annotation.matchMode())) {
        return header.getKey();
      }
    }
    if (annotation.required()) {
      throw new ColumnResolutionException(
          fieldName, annotation.header(), null, null, annotation.matchMode());
    }
    log.debug("Optional column '{}' not present", annotation.header());
    return -1;
  }

  private boolean matchHeader(String cellValue, String expected, HeaderMatchMode mode) {
    if (cellValue == null || cellValue.isBlank()) {
      return false;
    }
    String actual = cellValue.trim();
    String wanted = expected.trim();
    return switch (mode) {
      case EXACT -> actual.equalsIgnoreCase(wanted);
      case CONTAINS -> actual.contains(wanted);
      case STARTS_WITH -> actual.startsWith(wanted);
      case REGEX -> Pattern.matches(wanted, actual);
    };
  }

  private <T> List<T> parseDataRows(
      Sheet sheet,
      Class<T> dtoClass,
      List<ColumnMapping> mappings,
      ExcelImportConfig config,
      List<RowError> parseErrors,
      List<Integer> sourceRowNumbers,
      int maxRows) {
    List<T> rows = new ArrayList<>();

    for (int i = config.getDataStartRow() - 1; i <= sheet.getLastRowNum(); i++) {
      Row row = sheet.getRow(i);
      if (row == null) {
        continue;
      }
      if (isFooterRow(row, config.getFooterMarker())) {
        log.debug("Footer marker found at row {}, stopping", i + 1);
        break;
      }
      if (isBlankRow(row)) {
        continue;
      }

      int rowNumber = i + 1;
      T dto = newInstance(dtoClass);
      List<CellError> cellErrors = new ArrayList<>();
      for (ColumnMapping mapping : mappings) {
        Cell cell = row.getCell(mapping.resolvedColumnIndex());
        if (cell == null) {
          cell = resolveMergedCell(sheet, i, mapping.resolvedColumnIndex());
        }
        setField(dto, mapping.field(), getCellValue(cell, mapping, cellErrors));
      }

      if (!cellErrors.isEmpty()) {
        parseErrors.add(RowError.builder().rowNumber(rowNumber).cellErrors(cellErrors).build());
      }
      sourceRowNumbers.add(rowNumber);
      rows.add(dto);

      if (rows.size() > maxRows) {
        log.info("Row limit exceeded at row {}, stopping early", rowNumber);
        break;
      }
    }
    return rows;
  }

  private boolean isFooterRow(Row row, String footerMarker) {
    if (footerMarker == null || footerMarker.isEmpty()) {
      return false;
    }
    for (Cell cell : row) {
      String value = getCellStringValue(cell);
      if (value != null && value.contains(footerMarker)) {
        return true;
      }
    }
    return false;
  }

  private boolean isBlankRow(Row row) {
    for (Cell cell : row) {
      if (cell.getCellType() != CellType.BLANK) {
        String value = getCellStringValue(cell);
        if (value != null && !value.isBlank()) {
          return false;
        }
      }
    }
    return true;
  }

  private Object getCellValue(Cell cell, ColumnMapping mapping, List<CellError> cellErrors) {
    if (cell == null || cell.getCellType() == CellType.BLANK) {
      return null;
    }

    Class<?> type = mapping.field().getType();
    String dateFormat = mapping.annotation().dateFormat();
    try {
      if (type == Integer.class) {
        return getIntegerValue(cell);
      } else if (type == BigDecimal.class) {
        return getBigDecimalValue(cell);
      } else if (type == LocalDate.class) {
        return getLocalDateValue(cell, dateFormat);
      } else if (type == LocalDateTime.class) {
        return getLocalDateTimeValue(cell, dateFormat);
      } else if (type == Boolean.class) {
        return getBooleanValue(cell);
      }
      return getStringValue(cell);
    } catch (RuntimeException e) {
      String raw = getCellStringValue(cell);
      log.debug("Row {} column {}: cannot read '{}' as {}", cell.getRowIndex() + 1,
          mapping.resolvedColumnLetter(), raw, type.getSimpleName());
      cellErrors.add(
          CellError.builder()
              .columnIndex(mapping.resolvedColumnIndex())
              .columnLetter(mapping.resolvedColumnLetter())
              .fieldName(mapping.field().getName())
              .headerName(mapping.annotation().header())
              .rejectedValue(raw)
              .message("'" + raw + "' is not a valid " + describeType(type, dateFormat))
              .build());
      return null;
    }
  }

  private String describeType(Class<?> type, String dateFormat) {
    if (type == Integer.class) {
      return "whole number";
    } else if (type == BigDecimal.class) {
      return "number";
    } else if (type == LocalDate.class || type == LocalDateTime.class) {
      return "date (" + dateFormat + ")";
    }
    return type.getSimpleName();
  }

  private String getStringValue(Cell cell) {
    String value = getCellStringValue(cell);
    return value == null || value.isEmpty() ? null : value;
  }

  private Integer getIntegerValue(Cell cell) {
    if (cell.getCellType() == CellType.NUMERIC) {
      return BigDecimal.valueOf(cell.getNumericCellValue()).intValueExact();
    }
    String value = getStringValue(cell);
    return value == null ? null : Integer.valueOf(value.replaceAll("[,\\s]", ""));
  }

  private BigDecimal getBigDecimalValue(Cell cell) {
    if (cell.getCellType() == CellType.NUMERIC) {
      return BigDecimal.valueOf(cell.getNumericCellValue());
    }
    String value = getStringValue(cell);
    return value == null ? null : new BigDecimal(value.replaceAll("[,\\s]", ""));
  }

  private LocalDate getLocalDateValue(Cell cell, String dateFormat) {
    if (cell.getCellType() == CellType.NUMERIC && DateUtil.isCellDateFormatted(cell)) {
      return cell.getLocalDateTimeCellValue().toLocalDate();
    }
    String value = getStringValue(cell);
    return value == null ? null : LocalDate.parse(value, DateTimeFormatter.ofPattern(dateFormat));
  }

  private LocalDateTime getLocalDateTimeValue(Cell cell, String dateFormat) {
    if (cell.getCellType() == CellType.NUMERIC && DateUtil.isCellDateFormatted(cell)) {
      return cell.getLocalDateTimeCellValue();
    }
    String value = getStringValue(cell);
    return value == null
        ? null
        : LocalDateTime.parse(value, DateTimeFormatter.ofPattern(dateFormat));
  }

  private Boolean getBooleanValue(Cell cell) {
    if (cell.getCellType() == CellType.BOOLEAN) {
      return cell.getBooleanCellValue();
    }
    String value = getStringValue(cell);
    return "Y".equalsIgnoreCase(value) || "true".equalsIgnoreCase(value);
  }

  private Cell resolveMergedCell(Sheet sheet, int rowIdx, int colIdx) {
    for (CellRangeAddress range : sheet.getMergedRegions()) {
      if (range.isInRange(rowIdx, colIdx)) {
        Row topRow = sheet.getRow(range.getFirstRow());
        return topRow == null ? null : topRow.getCell(range.getFirstColumn());
      }
    }
    return null;
  }

  private String getCellStringValue(Cell cell) {
    if (cell == null) {
      return null;
    }
    return DATA_FORMATTER.get().formatCellValue(cell).trim();
  }

  private <T> T newInstance(Class<T> dtoClass) {
    try {
      return dtoClass.getDeclaredConstructor().newInstance();
    } catch (ReflectiveOperationException e) {
      throw new IllegalStateException("Cannot instantiate " + dtoClass.getName(), e);
    }
  }

  private void setField(Object dto, Field field, Object value) {
    try {
      field.set(dto, value);
    } catch (IllegalAccessException e) {
      throw new IllegalStateException("Cannot set field " + field.getName(), e);
    }
  }

  private List<Field> getAllFields(Class<?> type) {
    List<Field> fields = new ArrayList<>();
    for (Class<?> current = type; current != null && current != Object.class;
        current = current.getSuperclass()) {
      fields.addAll(Arrays.asList(current.getDeclaredFields()));
    }
    return fields;
  }
}
