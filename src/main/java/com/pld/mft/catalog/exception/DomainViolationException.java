package com.pld.mft.catalog.exception;

/** A value outside its enumerated set, or one that fails a check or column-type constraint. */
public class DomainViolationException extends SchemaViolationException {

  public DomainViolationException(
      String table, String column, Object rejectedValue, String message) {
    super(table, column, rejectedValue, message);
  }

  public DomainViolationException(String table, String message, Throwable cause) {
    super(table, null, null, message, cause);
  }

  public static DomainViolationException notInDomain(
      String table, String column, String domain, String value, String allowedValues) {
    return new DomainViolationException(
        table,
        column,
        value,
        "Value '%s' is not in %s {%s}".formatted(value, domain, allowedValues));
  }

  public static DomainViolationException check(
      String table, String column, Object value, String rule) {
    return new DomainViolationException(
        table, column, value, "%s.%s = %s violates %s".formatted(table, column, value, rule));
  }
}
