package com.pld.mft.catalog.domain;

import com.pld.mft.catalog.exception.DomainViolationException;
import java.util.Arrays;
import java.util.Optional;
import java.util.stream.Collectors;

/** Lookup of {@link DbEnum} constants by their stored value. */
public final class DbEnums {

  private DbEnums() {}

  /**
   * Resolves {@code value} to the constant of {@code type} whose {@link DbEnum#dbValue()} matches
   * it exactly. Null stays null. A failure names the domain type in place of a column.
   *
   * @throws DomainViolationException if no constant matches
   */
  public static <E extends Enum<E> & DbEnum> E fromValue(
      Class<E> type, String domain, String value) {
    return fromValue(type, domain, null, domain, value);
  }

  /**
   * Like {@link #fromValue(Class, String, String)}, reporting a failure against {@code
   * table.column}.
   */
  public static <E extends Enum<E> & DbEnum> E fromValue(
      Class<E> type, String domain, String table, String column, String value) {
    if (value == null) {
      return null;
    }
    for (E constant : type.getEnumConstants()) {
      if (constant.dbValue().equals(value)) {
        return constant;
      }
    }
    throw DomainViolationException.notInDomain(
        table, column, domain, value, allowedValues(type));
  }

  /** Like {@link #fromValue} but empty instead of throwing for an unknown value. */
  public static <E extends Enum<E> & DbEnum> Optional<E> find(Class<E> type, String value) {
    return Arrays.stream(type.getEnumConstants())
        .filter(constant -> constant.dbValue().equals(value))
        .findFirst();
  }

  public static <E extends Enum<E> & DbEnum> String allowedValues(Class<E> type) {
    return Arrays.stream(type.getEnumConstants())
        .map(DbEnum::dbValue)
        .collect(Collectors.joining(", "));
  }
}
