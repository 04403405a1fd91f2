package com.pld.mft.catalog.exception;

import lombok.Getter;

@Getter
public class RowNotFoundException extends RuntimeException {

  private final String table;
  private final String key;

  public RowNotFoundException(String table, String key) {
    super("%s has no row with key '%s'".formatted(table, key));
    this.table = table;
    this.key = key;
  }
}
