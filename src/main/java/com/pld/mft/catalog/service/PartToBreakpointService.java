package com.pld.mft.catalog.service;

import static com.pld.mft.catalog.service.SchemaConstraints.requireKey;
import static com.pld.mft.catalog.service.SchemaConstraints.requireLength;
import static com.pld.mft.catalog.service.SchemaConstraints.requireReference;

import com.pld.mft.catalog.entity.Breakpoint;
import com.pld.mft.catalog.entity.Part;
import com.pld.mft.catalog.entity.PartToBreakpoint;
import com.pld.mft.catalog.entity.PartToBreakpointId;
import com.pld.mft.catalog.repository.BreakpointRepository;
import com.pld.mft.catalog.repository.PartRepository;
import com.pld.mft.catalog.repository.PartToBreakpointRepository;
import java.util.List;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class PartToBreakpointService
    extends ConstrainedTableService<PartToBreakpoint, PartToBreakpointId> {

  private final PartToBreakpointRepository partToBreakpointRepository;
  private final PartRepository partRepository;
  private final BreakpointRepository breakpointRepository;

  public PartToBreakpointService(
      PartToBreakpointRepository partToBreakpointRepository,
      PartRepository partRepository,
      BreakpointRepository breakpointRepository) {
    super(partToBreakpointRepository, PartToBreakpoint.TABLE);
    this.partToBreakpointRepository = partToBreakpointRepository;
    this.partRepository = partRepository;
    this.breakpointRepository = breakpointRepository;
  }

  @Transactional(readOnly = true)
  public List<PartToBreakpoint> findByPart(String partId) {
    return partToBreakpointRepository.findByIdPartId(partId);
  }

  @Override
  protected PartToBreakpointId idOf(PartToBreakpoint row) {
    return row.getId();
  }

  @Override
  protected void checkKey(PartToBreakpointId id) {
    requireKey(PartToBreakpoint.TABLE, "part_id", id == null ? null : id.getPartId());
    requireKey(PartToBreakpoint.TABLE, "breakpoint_id", id.getBreakpointId());
  }

  @Override
  protected void enforceConstraints(PartToBreakpoint row) {
    String table = PartToBreakpoint.TABLE;
    requireLength(table, "part_number_before_change", row.getPartNumberBeforeChange(), 50);
    requireLength(table, "supplier_name_before_change", row.getSupplierNameBeforeChange(), 200);
    requireLength(table, "line_name_before_change", row.getLineNameBeforeChange(), 50);
    requireReference(partRepository, row.getId().getPartId(), table, "part_id", Part.TABLE);
    requireReference(
        breakpointRepository,
        row.getId().getBreakpointId(),
        table,
        "breakpoint_id",
        Breakpoint.TABLE);
  }
}
