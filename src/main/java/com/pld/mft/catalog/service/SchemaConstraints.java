package com.pld.mft.catalog.service;

import com.pld.mft.catalog.exception.DomainViolationException;
import com.pld.mft.catalog.exception.ReferentialIntegrityViolationException;
import java.math.BigDecimal;
import java.math.RoundingMode;
import org.springframework.data.repository.CrudRepository;

/**
 * Column-level rules of the schema, checked before a row reaches the database so the caller gets a
 * typed violation instead of a driver error.
 */
public final class SchemaConstraints {

  public static final int KEY_LENGTH = 12;

  private SchemaConstraints() {}

  /** Primary key or key part: not blank, at most {@value #KEY_LENGTH} characters. */
  public static void requireKey(String table, String column, String key) {
    if (key == null || key.isBlank()) {
      throw new DomainViolationException(
          table, column, key, "%s.%s must not be empty".formatted(table, column));
    }
    requireLength(table, column, key, KEY_LENGTH);
  }

  public static void requireLength(String table, String column, String value, int maxLength) {
    if (value != null && value.length() > maxLength) {
      throw DomainViolationException.check(
          table, column, value, "varchar(%d): length %d".formatted(maxLength, value.length()));
    }
  }

  public static void requireNotNull(String table, String column, Object value) {
    if (value == null) {
      throw DomainViolationException.check(table, column, null, "NOT NULL");
    }
  }

  /**
   * Rounds {@code value} half-up to {@code scale} digits, as a numeric column does on store, and
   * rejects values whose integer part does not fit.
   */
  public static BigDecimal decimal(
      String table, String column, BigDecimal value, int precision, int scale) {
    if (value == null) {
      return null;
    }
    BigDecimal rounded = value.setScale(scale, RoundingMode.HALF_UP);
    if (rounded.precision() - rounded.scale() > precision - scale) {
      throw DomainViolationException.check(
          table, column, value, "decimal(%d,%d): numeric overflow".formatted(precision, scale));
    }
    return rounded;
  }

  public static Short smallint(String table, String column, Integer value) {
    if (value == null) {
      return null;
    }
    if (value < Short.MIN_VALUE || value > Short.MAX_VALUE) {
      throw DomainViolationException.check(table, column, value, "smallint range");
    }
    return value.shortValue();
  }

  public static void requireNonNegative(
      String table, String column, BigDecimal value, String constraintName) {
    if (value != null && value.signum() < 0) {
      throw DomainViolationException.check(table, column, value, constraintName + " (>= 0)");
    }
  }

  /** A non-null foreign key must name an existing row of {@code referencedTable}. */
  public static <K> void requireReference(
      CrudRepository<?, K> referenced,
      K key,
      String table,
      String column,
      String referencedTable) {
    if (key != null && !referenced.existsById(key)) {
      throw ReferentialIntegrityViolationException.missingReference(
          table, column, key, referencedTable);
    }
  }
}
