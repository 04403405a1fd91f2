package com.pld.mft.catalog.dto;

import lombok.Data;

@Data
public class WorkshopRequest {

  private String workshopId;
  private String workshopCode;
  private String workshopName;
}
