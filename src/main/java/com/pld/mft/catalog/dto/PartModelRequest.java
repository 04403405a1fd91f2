package com.pld.mft.catalog.dto;

import lombok.Data;

@Data
public class PartModelRequest {

  private String modelId;
  private String configuration;
  private Integer partPerVehicle;
}
