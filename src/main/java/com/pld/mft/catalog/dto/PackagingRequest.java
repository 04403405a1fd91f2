package com.pld.mft.catalog.dto;

import java.math.BigDecimal;
import lombok.Data;

/** Request body for both boxes and pallets; the two tables share one shape. */
@Data
public class PackagingRequest {

  private String id;
  private String number;
  private String type;
  private BigDecimal weightKg;
  private Integer lengthMm;
  private Integer widthMm;
  private Integer heightMm;
  private BigDecimal volM3;
  private BigDecimal areaM2;
  private Integer stacking;
}
