package com.pld.mft.catalog.entity;

import com.pld.mft.catalog.domain.PackagingType;
import com.pld.mft.catalog.entity.converter.PackagingTypeConverter;
import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.validation.constraints.Size;
import java.math.BigDecimal;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.hibernate.annotations.Check;

@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Entity
@Table(name = Pallet.TABLE)
@Check(constraints = "pallet_vol_m3 >= 0 AND pallet_area_m2 >= 0")
public class Pallet implements PackagingUnit {

  public static final String TABLE = "pallet_data";

  @Id
  @Size(max = 12)
  @Column(name = "pallet_id", nullable = false, length = 12)
  private String palletId;

  @Size(max = 50)
  @Column(name = "pallet_number", length = 50)
  private String palletNumber;

  @Convert(converter = PackagingTypeConverter.class)
  @Column(name = "pallet_type", length = 14)
  private PackagingType palletType;

  @Column(name = "pallet_weight_kg", precision = 5, scale = 2)
  private BigDecimal palletWeightKg;

  @Column(name = "pallet_length_mm")
  private Short palletLengthMm;

  @Column(name = "pallet_width_mm")
  private Short palletWidthMm;

  @Column(name = "pallet_height_mm")
  private Short palletHeightMm;

  @Column(name = "pallet_vol_m3", precision = 5, scale = 2)
  private BigDecimal palletVolM3;

  @Column(name = "pallet_area_m2", precision = 5, scale = 2)
  private BigDecimal palletAreaM2;

  @Column(name = "pallet_stacking")
  private Short palletStacking;

  @Override
  public String columnPrefix() {
    return "pallet_";
  }

  @Override
  public String number() {
    return palletNumber;
  }

  @Override
  public void assignNumber(String number) {
    this.palletNumber = number;
  }

  @Override
  public PackagingType packagingType() {
    return palletType;
  }

  @Override
  public Short lengthMm() {
    return palletLengthMm;
  }

  @Override
  public Short widthMm() {
    return palletWidthMm;
  }

  @Override
  public Short heightMm() {
    return palletHeightMm;
  }

  @Override
  public BigDecimal weightKg() {
    return palletWeightKg;
  }

  @Override
  public BigDecimal volM3() {
    return palletVolM3;
  }

  @Override
  public BigDecimal areaM2() {
    return palletAreaM2;
  }

  @Override
  public void assignMeasures(BigDecimal weightKg, BigDecimal volM3, BigDecimal areaM2) {
    this.palletWeightKg = weightKg;
    this.palletVolM3 = volM3;
    this.palletAreaM2 = areaM2;
  }
}
