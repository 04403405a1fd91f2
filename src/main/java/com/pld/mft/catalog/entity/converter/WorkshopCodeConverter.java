package com.pld.mft.catalog.entity.converter;

import com.pld.mft.catalog.domain.WorkshopCode;
import jakarta.persistence.Converter;

@Converter
public class WorkshopCodeConverter extends DbEnumConverter<WorkshopCode> {

  public WorkshopCodeConverter() {
    super(WorkshopCode.class, WorkshopCode.DOMAIN);
  }
}
