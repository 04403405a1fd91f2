package com.pld.mft.catalog.entity.converter;

import com.pld.mft.catalog.domain.WorkshopName;
import jakarta.persistence.Converter;

@Converter
public class WorkshopNameConverter extends DbEnumConverter<WorkshopName> {

  public WorkshopNameConverter() {
    super(WorkshopName.class, WorkshopName.DOMAIN);
  }
}
