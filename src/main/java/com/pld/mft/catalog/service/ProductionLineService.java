package com.pld.mft.catalog.service;

import static com.pld.mft.catalog.service.SchemaConstraints.requireKey;
import static com.pld.mft.catalog.service.SchemaConstraints.requireLength;
import static com.pld.mft.catalog.service.SchemaConstraints.requireReference;

import com.pld.mft.catalog.entity.PartToLine;
import com.pld.mft.catalog.entity.ProductionLine;
import com.pld.mft.catalog.entity.Workshop;
import com.pld.mft.catalog.repository.PartToLineRepository;
import com.pld.mft.catalog.repository.ProductionLineRepository;
import com.pld.mft.catalog.repository.WorkshopRepository;
import java.util.List;
import java.util.Optional;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class ProductionLineService extends ConstrainedTableService<ProductionLine, String> {

  private final ProductionLineRepository lineRepository;
  private final WorkshopRepository workshopRepository;
  private final PartToLineRepository partToLineRepository;
  private final IdGenerator idGenerator;

  public ProductionLineService(
      ProductionLineRepository lineRepository,
      WorkshopRepository workshopRepository,
      PartToLineRepository partToLineRepository,
      IdGenerator idGenerator) {
    super(lineRepository, ProductionLine.TABLE);
    this.lineRepository = lineRepository;
    this.workshopRepository = workshopRepository;
    this.partToLineRepository = partToLineRepository;
    this.idGenerator = idGenerator;
  }

  @Transactional(readOnly = true)
  public Optional<ProductionLine> findByCode(String lineCode, String workshopId) {
    return lineRepository.findFirstByLineCodeAndWorkshopId(lineCode, workshopId);
  }

  @Override
  protected void applyDefaults(ProductionLine row) {
    if (row.getLineId() == null) {
      row.setLineId(idGenerator.newUniqueId(IdGenerator.LINE, lineRepository::existsById));
    }
  }

  @Override
  protected String idOf(ProductionLine row) {
    return row.getLineId();
  }

  @Override
  protected void checkKey(String id) {
    requireKey(ProductionLine.TABLE, "line_id", id);
  }

  @Override
  protected void enforceConstraints(ProductionLine row) {
    requireLength(ProductionLine.TABLE, "line_code", row.getLineCode(), 10);
    requireLength(ProductionLine.TABLE, "line_name", row.getLineName(), 50);
    requireReference(
        workshopRepository,
        row.getWorkshopId(),
        ProductionLine.TABLE,
        "workshop_id",
        Workshop.TABLE);
  }

  @Override
  protected List<String> referencingTables(String id) {
    return partToLineRepository.existsByIdLineId(id) ? List.of(PartToLine.TABLE) : List.of();
  }
}
