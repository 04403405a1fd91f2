package com.pld.mft.validation;

import com.pld.mft.annotation.ExcelColumn;
import com.pld.mft.annotation.ExcelCompositeUnique;
import java.lang.reflect.Field;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Enforces {@link ExcelCompositeUnique} across the rows of one file. The first occurrence of a
 * combination is accepted; each later one is reported against the first field of the combination.
 */
@Slf4j
@Component
public class WithinFileUniqueConstraintValidator {

  public <T> List<RowError> checkWithinFileUniqueness(
      List<T> rows, Class<T> dtoClass, List<Integer> sourceRowNumbers) {
    List<RowError> errors = new ArrayList<>();
    ExcelCompositeUnique[] composites = dtoClass.getAnnotationsByType(ExcelCompositeUnique.class);
    for (ExcelCompositeUnique composite : composites) {
      checkComposite(composite, rows, dtoClass, sourceRowNumbers, errors);
    }
    return errors;
  }

  private <T> void checkComposite(
      ExcelCompositeUnique composite,
      List<T> rows,
      Class<T> dtoClass,
      List<Integer> sourceRowNumbers,
      List<RowError> errors) {
    List<Field> fields = resolveFields(composite.fields(), dtoClass);
    if (fields.isEmpty()) {
      return;
    }

    Map<List<Object>, Integer> firstSeen = new HashMap<>();
    for (int i = 0; i < rows.size(); i++) {
      List<Object> key = new ArrayList<>();
      for (Field field : fields) {
        key.add(readField(field, rows.get(i)));
      }

      int rowNumber = sourceRowNumbers.get(i);
      Integer firstRow = firstSeen.putIfAbsent(key, rowNumber);
      if (firstRow != null) {
        Field first = fields.get(0);
        ExcelColumn column = first.getAnnotation(ExcelColumn.class);
        RowError.addTo(
            errors,
            rowNumber,
            CellError.builder()
                .columnIndex(-1)
                .columnLetter("?")
                .fieldName(first.getName())
                .headerName(column != null ? column.header() : first.getName())
                .rejectedValue(key.toString())
                .message(composite.message() + " (duplicate of row " + firstRow + ")")
                .build());
      }
    }
  }

  private List<Field> resolveFields(String[] names, Class<?> dtoClass) {
    List<Field> fields = new ArrayList<>();
    for (String name : names) {
      try {
        Field field = dtoClass.getDeclaredField(name);
        field.setAccessible(true);
        fields.add(field);
      } catch (NoSuchFieldException e) {
        log.warn("Composite unique field '{}' not found in {}", name, dtoClass.getName());
      }
    }
    return fields;
  }

  private Object readField(Field field, Object row) {
    try {
      return field.get(row);
    } catch (IllegalAccessException e) {
      throw new IllegalStateException("Cannot read field " + field.getName(), e);
    }
  }
}
