package com.pld.mft.catalog.domain;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ModelCode implements DbEnum {
  A01("A01"),
  A08("A08"),
  B02("B02"),
  B04("B04"),
  B06("B06"),
  B16("B16");

  public static final String DOMAIN = "model_codes";

  private final String dbValue;

  ModelCode(String dbValue) {
    this.dbValue = dbValue;
  }

  @Override
  @JsonValue
  public String dbValue() {
    return dbValue;
  }

  public static ModelCode fromValue(String value) {
    return DbEnums.fromValue(ModelCode.class, DOMAIN, value);
  }

  public static ModelCode fromValue(String value, String table, String column) {
    return DbEnums.fromValue(ModelCode.class, DOMAIN, table, column, value);
  }
}
