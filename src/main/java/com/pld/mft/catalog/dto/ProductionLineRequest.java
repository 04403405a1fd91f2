package com.pld.mft.catalog.dto;

import lombok.Data;

@Data
public class ProductionLineRequest {

  private String lineId;
  private String lineCode;
  private String lineName;
  private String workshopId;
}
