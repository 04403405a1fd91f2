package com.pld.mft.catalog.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.io.Serializable;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@EqualsAndHashCode
@Embeddable
public class PartToBoxId implements Serializable {

  @NotNull
  @Size(max = 12)
  @Column(name = "part_id", nullable = false, length = 12)
  private String partId;

  @NotNull
  @Size(max = 12)
  @Column(name = "box_id", nullable = false, length = 12)
  private String boxId;

  @Override
  public String toString() {
    return partId + "/" + boxId;
  }
}
