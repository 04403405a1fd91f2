package com.pld.mft.catalog.entity;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.pld.mft.catalog.domain.Localization;
import com.pld.mft.catalog.entity.converter.LocalizationConverter;
import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.EmbeddedId;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/** Attributes a part had before the change recorded by a {@link Breakpoint}. */
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Entity
@Table(name = PartToBreakpoint.TABLE)
public class PartToBreakpoint {

  public static final String TABLE = "part_to_breakpoint";

  @EmbeddedId private PartToBreakpointId id;

  @Size(max = 50)
  @Column(name = "part_number_before_change", length = 50)
  private String partNumberBeforeChange;

  @Size(max = 200)
  @Column(name = "supplier_name_before_change", length = 200)
  private String supplierNameBeforeChange;

  @Convert(converter = LocalizationConverter.class)
  @Column(name = "localization_before_change", length = 3)
  private Localization localizationBeforeChange;

  @Size(max = 50)
  @Column(name = "line_name_before_change", length = 50)
  private String lineNameBeforeChange;

  @JsonIgnore
  @ManyToOne(fetch = FetchType.LAZY)
  @JoinColumn(name = "part_id", insertable = false, updatable = false)
  private Part part;

  @JsonIgnore
  @ManyToOne(fetch = FetchType.LAZY)
  @JoinColumn(name = "breakpoint_id", insertable = false, updatable = false)
  private Breakpoint breakpoint;
}
