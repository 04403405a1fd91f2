package com.pld.mft.catalog.entity.converter;

import com.pld.mft.catalog.domain.DbEnum;
import com.pld.mft.catalog.domain.DbEnums;
import jakarta.persistence.AttributeConverter;

/**
 * Stores a {@link DbEnum} by its exact database value ("non-returnable", "F7x") rather than the
 * constant name.
 */
public abstract class DbEnumConverter<E extends Enum<E> & DbEnum>
    implements AttributeConverter<E, String> {

  private final Class<E> type;
  private final String domain;

  protected DbEnumConverter(Class<E> type, String domain) {
    this.type = type;
    this.domain = domain;
  }

  @Override
  public String convertToDatabaseColumn(E attribute) {
    return attribute == null ? null : attribute.dbValue();
  }

  @Override
  public E convertToEntityAttribute(String dbData) {
    return DbEnums.fromValue(type, domain, dbData);
  }
}
