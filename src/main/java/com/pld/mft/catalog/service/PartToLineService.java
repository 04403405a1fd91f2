package com.pld.mft.catalog.service;

import static com.pld.mft.catalog.service.SchemaConstraints.requireKey;
import static com.pld.mft.catalog.service.SchemaConstraints.requireReference;

import com.pld.mft.catalog.entity.Part;
import com.pld.mft.catalog.entity.PartToLine;
import com.pld.mft.catalog.entity.PartToLineId;
import com.pld.mft.catalog.entity.ProductionLine;
import com.pld.mft.catalog.repository.PartRepository;
import com.pld.mft.catalog.repository.PartToLineRepository;
import com.pld.mft.catalog.repository.ProductionLineRepository;
import java.util.List;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class PartToLineService extends ConstrainedTableService<PartToLine, PartToLineId> {

  private final PartToLineRepository partToLineRepository;
  private final PartRepository partRepository;
  private final ProductionLineRepository lineRepository;

  public PartToLineService(
      PartToLineRepository partToLineRepository,
      PartRepository partRepository,
      ProductionLineRepository lineRepository) {
    super(partToLineRepository, PartToLine.TABLE);
    this.partToLineRepository = partToLineRepository;
    this.partRepository = partRepository;
    this.lineRepository = lineRepository;
  }

  @Transactional(readOnly = true)
  public List<PartToLine> findByPart(String partId) {
    return partToLineRepository.findByIdPartId(partId);
  }

  @Override
  protected PartToLineId idOf(PartToLine row) {
    return row.getId();
  }

  @Override
  protected void checkKey(PartToLineId id) {
    requireKey(PartToLine.TABLE, "part_id", id == null ? null : id.getPartId());
    requireKey(PartToLine.TABLE, "line_id", id.getLineId());
  }

  @Override
  protected void enforceConstraints(PartToLine row) {
    requireReference(
        partRepository, row.getId().getPartId(), PartToLine.TABLE, "part_id", Part.TABLE);
    requireReference(
        lineRepository,
        row.getId().getLineId(),
        PartToLine.TABLE,
        "line_id",
        ProductionLine.TABLE);
  }
}
