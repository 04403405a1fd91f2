package com.pld.mft.catalog.dto;

import java.time.OffsetDateTime;
import lombok.Data;

@Data
public class BreakpointRequest {

  private String breakpointId;
  private OffsetDateTime inputDate;
  private String breakpointNumber;
  private OffsetDateTime breakpointDate;
}
