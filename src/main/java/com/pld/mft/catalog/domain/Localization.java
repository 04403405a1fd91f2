package com.pld.mft.catalog.domain;

import com.fasterxml.jackson.annotation.JsonValue;

/** Whether a supplier (and so its parts) is locally sourced. */
public enum Localization implements DbEnum {
  YES("yes"),
  NO("no");

  public static final String DOMAIN = "localization";

  private final String dbValue;

  Localization(String dbValue) {
    this.dbValue = dbValue;
  }

  @Override
  @JsonValue
  public String dbValue() {
    return dbValue;
  }

  public static Localization fromValue(String value) {
    return DbEnums.fromValue(Localization.class, DOMAIN, value);
  }

  public static Localization fromValue(String value, String table, String column) {
    return DbEnums.fromValue(Localization.class, DOMAIN, table, column, value);
  }
}
