package com.pld.mft.catalog.domain;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ModelName implements DbEnum {
  JOLION("Jolion"),
  H3("H3"),
  F7("F7"),
  F7X("F7x"),
  DARGO("Dargo"),
  H7("H7");

  public static final String DOMAIN = "model_names";

  private final String dbValue;

  ModelName(String dbValue) {
    this.dbValue = dbValue;
  }

  @Override
  @JsonValue
  public String dbValue() {
    return dbValue;
  }

  public static ModelName fromValue(String value) {
    return DbEnums.fromValue(ModelName.class, DOMAIN, value);
  }

  public static ModelName fromValue(String value, String table, String column) {
    return DbEnums.fromValue(ModelName.class, DOMAIN, table, column, value);
  }
}
