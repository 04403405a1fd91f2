package com.pld.mft.catalog.dto;

import lombok.Data;

@Data
public class VehicleModelRequest {

  private String modelId;
  private String modelCode;
  private String modelName;
}
