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
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/** A production line inside a workshop (line_data). */
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Entity
@Table(name = ProductionLine.TABLE)
public class ProductionLine {

  public static final String TABLE = "line_data";

  @Id
  @Size(max = 12)
  @Column(name = "line_id", nullable = false, length = 12)
  private String lineId;

  @Size(max = 10)
  @Column(name = "line_code", length = 10)
  private String lineCode;

  @Size(max = 50)
  @Column(name = "line_name", length = 50)
  private String lineName;

  @Size(max = 12)
  @Column(name = "workshop_id", length = 12)
  private String workshopId;

  @JsonIgnore
  @ManyToOne(fetch = FetchType.LAZY)
  @JoinColumn(name = "workshop_id", insertable = false, updatable = false)
  private Workshop workshop;
}
