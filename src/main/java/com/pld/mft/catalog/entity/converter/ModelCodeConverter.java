package com.pld.mft.catalog.entity.converter;

import com.pld.mft.catalog.domain.ModelCode;
import jakarta.persistence.Converter;

@Converter
public class ModelCodeConverter extends DbEnumConverter<ModelCode> {

  public ModelCodeConverter() {
    super(ModelCode.class, ModelCode.DOMAIN);
  }
}
