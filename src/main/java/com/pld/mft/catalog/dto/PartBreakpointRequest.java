package com.pld.mft.catalog.dto;

import lombok.Data;

@Data
public class PartBreakpointRequest {

  private String breakpointId;
  private String partNumberBeforeChange;
  private String supplierNameBeforeChange;
  private String localizationBeforeChange;
  private String lineNameBeforeChange;
}
