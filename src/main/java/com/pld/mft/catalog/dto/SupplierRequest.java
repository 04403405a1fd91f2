package com.pld.mft.catalog.dto;

import lombok.Data;

@Data
public class SupplierRequest {

  private String supplierId;
  private String supplierName;
  private String location;
  private String city;
  private String street;
  private String building;
  private String localization;
}
