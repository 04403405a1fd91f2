package com.pld.mft.catalog.entity.converter;

import com.pld.mft.catalog.domain.Localization;
import jakarta.persistence.Converter;

@Converter
public class LocalizationConverter extends DbEnumConverter<Localization> {

  public LocalizationConverter() {
    super(Localization.class, Localization.DOMAIN);
  }
}
