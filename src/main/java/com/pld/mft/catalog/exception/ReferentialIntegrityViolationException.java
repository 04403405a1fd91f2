package com.pld.mft.catalog.exception;

import java.util.List;
import lombok.Getter;

/**
 * A foreign key pointing at a row that does not exist, or a delete of a row that other rows still
 * reference.
 */
@Getter
public class ReferentialIntegrityViolationException extends SchemaViolationException {

  private final List<String> referencingTables;

  private ReferentialIntegrityViolationException(
      String table, String column, Object value, List<String> referencingTables, String message) {
    super(table, column, value, message);
    this.referencingTables = List.copyOf(referencingTables);
  }

  public ReferentialIntegrityViolationException(String table, String message, Throwable cause) {
    super(table, null, null, message, cause);
    this.referencingTables = List.of();
  }

  public static ReferentialIntegrityViolationException missingReference(
      String table, String column, Object value, String referencedTable) {
    return new ReferentialIntegrityViolationException(
        table,
        column,
        value,
        List.of(),
        "%s.%s = '%s' references a row missing from %s"
            .formatted(table, column, value, referencedTable));
  }

  public static ReferentialIntegrityViolationException stillReferenced(
      String table, String key, List<String> referencingTables) {
    return new ReferentialIntegrityViolationException(
        table,
        null,
        key,
        referencingTables,
        "Cannot delete %s row '%s': still referenced from %s"
            .formatted(table, key, String.join(", ", referencingTables)));
  }
}
