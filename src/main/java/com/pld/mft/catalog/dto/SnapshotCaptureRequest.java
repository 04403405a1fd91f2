package com.pld.mft.catalog.dto;

import lombok.Data;

/** Part whose current attributes should be recorded, and optionally the line to record. */
@Data
public class SnapshotCaptureRequest {

  private String partId;
  private String lineId;
}
