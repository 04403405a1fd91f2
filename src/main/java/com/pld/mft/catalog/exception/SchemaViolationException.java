package com.pld.mft.catalog.exception;

import lombok.Getter;

/**
 * A write rejected because it would break a schema rule. Subclasses name the kind of rule:
 * enumerated domain or check, foreign key, or primary key.
 */
@Getter
public abstract class SchemaViolationException extends RuntimeException {

  private final String table;
  private final String column;
  private final transient Object rejectedValue;

  protected SchemaViolationException(
      String table, String column, Object rejectedValue, String message) {
    super(message);
    this.table = table;
    this.column = column;
    this.rejectedValue = rejectedValue;
  }

  protected SchemaViolationException(
      String table, String column, Object rejectedValue, String message, Throwable cause) {
    super(message, cause);
    this.table = table;
    this.column = column;
    this.rejectedValue = rejectedValue;
  }
}
