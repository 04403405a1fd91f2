package com.pld.mft.catalog.dto;

import java.math.BigDecimal;
import lombok.Data;

@Data
public class PartRequest {

  private String partId;
  private String partNumber;
  private String partName;
  private BigDecimal partWeightKg;
  private String supplierId;
}
