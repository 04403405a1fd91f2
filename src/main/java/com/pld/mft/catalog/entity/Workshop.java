package com.pld.mft.catalog.entity;

import com.pld.mft.catalog.domain.WorkshopCode;
import com.pld.mft.catalog.domain.WorkshopName;
import com.pld.mft.catalog.entity.converter.WorkshopCodeConverter;
import com.pld.mft.catalog.entity.converter.WorkshopNameConverter;
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
@Table(name = Workshop.TABLE)
public class Workshop {

  public static final String TABLE = "workshop_data";

  @Id
  @Size(max = 12)
  @Column(name = "workshop_id", nullable = false, length = 12)
  private String workshopId;

  @Convert(converter = WorkshopCodeConverter.class)
  @Column(name = "workshop_code", length = 5)
  private WorkshopCode workshopCode;

  @Convert(converter = WorkshopNameConverter.class)
  @Column(name = "workshop_name", length = 9)
  private WorkshopName workshopName;
}
