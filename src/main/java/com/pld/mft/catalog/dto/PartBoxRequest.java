package com.pld.mft.catalog.dto;

import lombok.Data;

@Data
public class PartBoxRequest {

  private String boxId;
  private Integer partPerBox;
}
