package com.pld.mft.service.pipeline.validation;

import com.pld.mft.annotation.ExcelColumn;
import com.pld.mft.util.ExcelColumnUtil;
import com.pld.mft.validation.CellError;
import com.pld.mft.validation.ExcelValidationResult;
import com.pld.mft.validation.RowError;
import com.pld.mft.validation.WithinFileUniqueConstraintValidator;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import java.lang.reflect.Field;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Bean Validation per row, then within-file uniqueness. Auto-detected columns are reported with
 * index -1 here; the caller fills in positions from the parse result.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ExcelValidationService {

  private final Validator validator;
  private final WithinFileUniqueConstraintValidator withinFileUniqueConstraintValidator;

  public <T> ExcelValidationResult validate(
      List<T> rows, Class<T> dtoClass, List<Integer> sourceRowNumbers) {
    List<RowError> errors = new ArrayList<>();

    for (int i = 0; i < rows.size(); i++) {
      List<CellError> cellErrors =
          validator.validate(rows.get(i)).stream()
              .sorted(
                  Comparator.comparing(
                      (ConstraintViolation<T> v) -> v.getPropertyPath().toString()))
              .map(v -> toCellError(v, dtoClass))
              .toList();
      if (!cellErrors.isEmpty()) {
        errors.add(
            RowError.builder()
                .rowNumber(sourceRowNumbers.get(i))
                .cellErrors(new ArrayList<>(cellErrors))
                .build());
      }
    }

    ExcelValidationResult result = ExcelValidationResult.success(rows.size());
    result.merge(errors);
    result.merge(
        withinFileUniqueConstraintValidator.checkWithinFileUniqueness(
            rows, dtoClass, sourceRowNumbers));
    if (!result.isValid()) {
      log.debug("{} of {} rows failed validation", result.getErrorRowCount(), rows.size());
    }
    return result;
  }

  private <T> CellError toCellError(ConstraintViolation<T> violation, Class<T> dtoClass) {
    String fieldName = violation.getPropertyPath().toString();
    ExcelColumn column = findExcelColumn(fieldName, dtoClass);

    String message = violation.getMessage();
    if (column != null && !column.errorPrefix().isEmpty()) {
      message = column.errorPrefix() + ": " + message;
    }
    boolean fixed = column != null && !column.column().isEmpty();
    return CellError.builder()
        .columnIndex(fixed ? ExcelColumnUtil.letterToIndex(column.column()) : -1)
        .columnLetter(fixed ? column.column() : "?")
        .fieldName(fieldName)
        .headerName(column != null ? column.header() : fieldName)
        .rejectedValue(violation.getInvalidValue())
        .message(message)
        .build();
  }

  private ExcelColumn findExcelColumn(String fieldName, Class<?> dtoClass) {
    for (Class<?> current = dtoClass; current != null && current != Object.class;
        current = current.getSuperclass()) {
      try {
        Field field = current.getDeclaredField(fieldName);
        return field.getAnnotation(ExcelColumn.class);
      } catch (NoSuchFieldException e) {
        log.trace("{} not declared on {}", fieldName, current.getSimpleName());
      }
    }
    return null;
  }
}
