package com.pld.mft.catalog.entity;

import com.fasterxml.jackson.annotation.JsonIgnore;
import jakarta.persistence.Column;
import jakarta.persistence.EmbeddedId;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;
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
@Table(name = BoxToPallet.TABLE)
public class BoxToPallet {

  public static final String TABLE = "box_to_pallet";

  @EmbeddedId private BoxToPalletId id;

  @Column(name = "box_per_pallet")
  private Short boxPerPallet;

  @JsonIgnore
  @ManyToOne(fetch = FetchType.LAZY)
  @JoinColumn(name = "box_id", insertable = false, updatable = false)
  private Box box;

  @JsonIgnore
  @ManyToOne(fetch = FetchType.LAZY)
  @JoinColumn(name = "pallet_id", insertable = false, updatable = false)
  private Pallet pallet;
}
