package com.pld.mft.catalog.exception;

/** Primary key collision. */
public class UniquenessViolationException extends SchemaViolationException {

  public UniquenessViolationException(String table, String key) {
    super(table, null, key, "%s already contains a row with key '%s'".formatted(table, key));
  }

  public UniquenessViolationException(String table, String message, Throwable cause) {
    super(table, null, null, message, cause);
  }
}
