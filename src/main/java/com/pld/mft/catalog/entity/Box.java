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
@Table(name = Box.TABLE)
@Check(constraints = "box_vol_m3 >= 0 AND box_area_m2 >= 0")
public class Box implements PackagingUnit {

  public static final String TABLE = "box_data";

  @Id
  @Size(max = 12)
  @Column(name = "box_id", nullable = false, length = 12)
  private String boxId;

  @Size(max = 50)
  @Column(name = "box_number", length = 50)
  private String boxNumber;

  @Convert(converter = PackagingTypeConverter.class)
  @Column(name = "box_type", length = 14)
  private PackagingType boxType;

  @Column(name = "box_weight_kg", precision = 5, scale = 2)
  private BigDecimal boxWeightKg;

  @Column(name = "box_length_mm")
  private Short boxLengthMm;

  @Column(name = "box_width_mm")
  private Short boxWidthMm;

  @Column(name = "box_height_mm")
  private Short boxHeightMm;

  @Column(name = "box_vol_m3", precision = 5, scale = 2)
  private BigDecimal boxVolM3;

  @Column(name = "box_area_m2", precision = 5, scale = 2)
  private BigDecimal boxAreaM2;

  @Column(name = "box_stacking")
  private Short boxStacking;

  @Override
  public String columnPrefix() {
    return "box_";
  }

  @Override
  public String number() {
    return boxNumber;
  }

  @Override
  public void assignNumber(String number) {
    this.boxNumber = number;
  }

  @Override
  public PackagingType packagingType() {
    return boxType;
  }

  @Override
  public Short lengthMm() {
    return boxLengthMm;
  }

  @Override
  public Short widthMm() {
    return boxWidthMm;
  }

  @Override
  public Short heightMm() {
    return boxHeightMm;
  }

  @Override
  public BigDecimal weightKg() {
    return boxWeightKg;
  }

  @Override
  public BigDecimal volM3() {
    return boxVolM3;
  }

  @Override
  public BigDecimal areaM2() {
    return boxAreaM2;
  }

  @Override
  public void assignMeasures(BigDecimal weightKg, BigDecimal volM3, BigDecimal areaM2) {
    this.boxWeightKg = weightKg;
    this.boxVolM3 = volM3;
    this.boxAreaM2 = areaM2;
  }
}
