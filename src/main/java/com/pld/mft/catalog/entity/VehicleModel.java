package com.pld.mft.catalog.entity;

import com.pld.mft.catalog.domain.ModelCode;
import com.pld.mft.catalog.domain.ModelName;
import com.pld.mft.catalog.entity.converter.ModelCodeConverter;
import com.pld.mft.catalog.entity.converter.ModelNameConverter;
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

/** A vehicle model produced at the plant (model_data). */
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Entity
@Table(name = VehicleModel.TABLE)
public class VehicleModel {

  public static final String TABLE = "model_data";

  @Id
  @Size(max = 12)
  @Column(name = "model_id", nullable = false, length = 12)
  private String modelId;

  @Convert(converter = ModelCodeConverter.class)
  @Column(name = "model_code", length = 3)
  private ModelCode modelCode;

  @Convert(converter = ModelNameConverter.class)
  @Column(name = "model_name", length = 6)
  private ModelName modelName;
}
