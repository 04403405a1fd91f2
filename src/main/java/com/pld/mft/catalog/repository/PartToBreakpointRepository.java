package com.pld.mft.catalog.repository;

import com.pld.mft.catalog.entity.PartToBreakpoint;
import com.pld.mft.catalog.entity.PartToBreakpointId;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;

public interface PartToBreakpointRepository
    extends JpaRepository<PartToBreakpoint, PartToBreakpointId> {

  boolean existsByIdPartId(String partId);

  boolean existsByIdBreakpointId(String breakpointId);

  List<PartToBreakpoint> findByIdPartId(String partId);
}
