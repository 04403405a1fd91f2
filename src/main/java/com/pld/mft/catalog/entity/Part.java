package com.pld.mft.catalog.entity;

import com.fasterxml.jackson.annotation.JsonIgnore;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;
import jakarta.validation.constraints.Size;
import java.math.BigDecimal;
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
@Table(name = Part.TABLE)
public class Part {

  public static final String TABLE = "part_data";

  @Id
  @Size(max = 12)
  @Column(name = "part_id", nullable = false, length = 12)
  private String partId;

  @Size(max = 50)
  @Column(name = "part_number", length = 50)
  private String partNumber;

  @Size(max = 100)
  @Column(name = "part_name", length = 100)
  private String partName;

  @Column(name = "part_weight_kg", precision = 5, scale = 2)
  private BigDecimal partWeightKg;

  @Size(max = 12)
  @Column(name = "supplier_id", length = 12)
  private String supplierId;

  // Read-only view of supplier_id; writes go through the id column above.
  @JsonIgnore
  @ManyToOne(fetch = FetchType.LAZY)
  @JoinColumn(name = "supplier_id", insertable = false, updatable = false)
  private Supplier supplier;
}
