package com.pld.mft.catalog.domain;

import com.fasterxml.jackson.annotation.JsonValue;

public enum WorkshopCode implements DbEnum {
  AS("AS"),
  COMP("COMP"),
  PAINT("PAINT"),
  WELD("WELD"),
  STAMP("STAMP"),
  EN("EN");

  public static final String DOMAIN = "workshop_codes";

  private final String dbValue;

  WorkshopCode(String dbValue) {
    this.dbValue = dbValue;
  }

  @Override
  @JsonValue
  public String dbValue() {
    return dbValue;
  }

  public static WorkshopCode fromValue(String value) {
    return DbEnums.fromValue(WorkshopCode.class, DOMAIN, value);
  }

  public static WorkshopCode fromValue(String value, String table, String column) {
    return DbEnums.fromValue(WorkshopCode.class, DOMAIN, table, column, value);
  }
}
