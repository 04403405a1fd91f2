package com.pld.mft.catalog.dto;

import lombok.Data;

@Data
public class PartLineRequest {

  private String lineId;
}
