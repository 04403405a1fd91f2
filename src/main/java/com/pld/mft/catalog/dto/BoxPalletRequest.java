package com.pld.mft.catalog.dto;

import lombok.Data;

@Data
public class BoxPalletRequest {

  private String palletId;
  private Integer boxPerPallet;
}
