package com.pld.mft.catalog.domain;

/** An enumerated column value whose stored representation differs from the Java constant name. */
public interface DbEnum {

  /** Exact value as stored in the database enum type. */
  String dbValue();
}
