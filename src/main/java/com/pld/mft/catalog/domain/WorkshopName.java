package com.pld.mft.catalog.domain;

import com.fasterxml.jackson.annotation.JsonValue;

public enum WorkshopName implements DbEnum {
  ASSEMBLY("Assembly"),
  COMPONENT("Component"),
  PAINTING("Painting"),
  WELDING("Welding"),
  STAMPING("Stamping"),
  ENGINE("Engine");

  public static final String DOMAIN = "workshop_names";

  private final String dbValue;

  WorkshopName(String dbValue) {
    this.dbValue = dbValue;
  }

  @Override
  @JsonValue
  public String dbValue() {
    return dbValue;
  }

  public static WorkshopName fromValue(String value) {
    return DbEnums.fromValue(WorkshopName.class, DOMAIN, value);
  }

  public static WorkshopName fromValue(String value, String table, String column) {
    return DbEnums.fromValue(WorkshopName.class, DOMAIN, table, column, value);
  }
}
