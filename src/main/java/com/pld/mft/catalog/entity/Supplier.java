package com.pld.mft.catalog.entity;

import com.pld.mft.catalog.domain.Localization;
import com.pld.mft.catalog.entity.converter.LocalizationConverter;
import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Entity
@Table(name = Supplier.TABLE)
public class Supplier {

  public static final String TABLE = "supplier_data";

  @Id
  @Size(max = 12)
  @Column(name = "supplier_id", nullable = false, length = 12)
  private String supplierId;

  @Size(max = 200)
  @Column(name = "supplier_name", length = 200)
  private String supplierName;

  @Size(max = 50)
  @Column(name = "location", length = 50)
  private String location;

  @Size(max = 50)
  @Column(name = "city", length = 50)
  private String city;

  @Size(max = 100)
  @Column(name = "street", length = 100)
  private String street;

  @Size(max = 10)
  @Column(name = "building", length = 10)
  private String building;

  @Convert(converter = LocalizationConverter.class)
  @Column(name = "localization", length = 3)
  private Localization localization;
}
