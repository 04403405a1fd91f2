package com.pld.mft.catalog.entity.converter;

import com.pld.mft.catalog.domain.PackagingType;
import jakarta.persistence.Converter;

@Converter
public class PackagingTypeConverter extends DbEnumConverter<PackagingType> {

  public PackagingTypeConverter() {
    super(PackagingType.class, PackagingType.DOMAIN);
  }
}
