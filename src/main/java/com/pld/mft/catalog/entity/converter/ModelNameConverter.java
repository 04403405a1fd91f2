package com.pld.mft.catalog.entity.converter;

import com.pld.mft.catalog.domain.ModelName;
import jakarta.persistence.Converter;

@Converter
public class ModelNameConverter extends DbEnumConverter<ModelName> {

  public ModelNameConverter() {
    super(ModelName.class, ModelName.DOMAIN);
  }
}
