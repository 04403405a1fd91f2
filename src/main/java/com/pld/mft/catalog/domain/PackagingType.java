package com.pld.mft.catalog.domain;

import com.fasterxml.jackson.annotation.JsonValue;

/** Whether a box or pallet is reusable (returnable) or disposable. */
public enum PackagingType implements DbEnum {
  RETURNABLE("returnable"),
  NON_RETURNABLE("non-returnable");

  public static final String DOMAIN = "packaging_type";

  private final String dbValue;

  PackagingType(String dbValue) {
    this.dbValue = dbValue;
  }

  @Override
  @JsonValue
  public String dbValue() {
    return dbValue;
  }

  /** Leading letter of a generated packaging number: A for disposable, B for returnable. */
  public String numberPrefix() {
    return this == NON_RETURNABLE ? "A" : "B";
  }

  public static PackagingType fromValue(String value) {
    return DbEnums.fromValue(PackagingType.class, DOMAIN, value);
  }

  public static PackagingType fromValue(String value, String table, String column) {
    return DbEnums.fromValue(PackagingType.class, DOMAIN, table, column, value);
  }
}
