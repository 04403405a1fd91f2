package com.pld.mft.catalog.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import jakarta.validation.constraints.Size;
import java.time.OffsetDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * A dated change event for one or more parts. The attributes the parts had before the change are
 * kept on {@link PartToBreakpoint}.
 */
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Entity
@Table(name = Breakpoint.TABLE)
public class Breakpoint {

  public static final String TABLE = "breakpoint_data";

  @Id
  @Size(max = 12)
  @Column(name = "breakpoint_id", nullable = false, length = 12)
  private String breakpointId;

  @Column(name = "input_date")
  private OffsetDateTime inputDate;

  @Size(max = 10)
  @Column(name = "breakpoint_number", nullable = false, length = 10)
  private String breakpointNumber;

  @Column(name = "breakpoint_date")
  private OffsetDateTime breakpointDate;

  @PrePersist
  void defaultInputDate() {
    if (inputDate == null) {
      inputDate = OffsetDateTime.now();
    }
  }
}
