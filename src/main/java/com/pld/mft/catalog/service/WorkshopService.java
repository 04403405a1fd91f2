package com.pld.mft.catalog.service;

import static com.pld.mft.catalog.service.SchemaConstraints.requireKey;

import com.pld.mft.catalog.domain.WorkshopCode;
import com.pld.mft.catalog.entity.ProductionLine;
import com.pld.mft.catalog.entity.Workshop;
import com.pld.mft.catalog.repository.ProductionLineRepository;
import com.pld.mft.catalog.repository.WorkshopRepository;
import java.util.List;
import java.util.Optional;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class WorkshopService extends ConstrainedTableService<Workshop, String> {

  private final WorkshopRepository workshopRepository;
  private final ProductionLineRepository lineRepository;
  private final IdGenerator idGenerator;

  public WorkshopService(
      WorkshopRepository workshopRepository,
      ProductionLineRepository lineRepository,
      IdGenerator idGenerator) {
    super(workshopRepository, Workshop.TABLE);
    this.workshopRepository = workshopRepository;
    this.lineRepository = lineRepository;
    this.idGenerator = idGenerator;
  }

  @Transactional(readOnly = true)
  public Optional<Workshop> findByCode(WorkshopCode code) {
    return workshopRepository.findFirstByWorkshopCode(code);
  }

  @Override
  protected void applyDefaults(Workshop row) {
    if (row.getWorkshopId() == null) {
      row.setWorkshopId(
          idGenerator.newUniqueId(IdGenerator.WORKSHOP, workshopRepository::existsById));
    }
  }

  @Override
  protected String idOf(Workshop row) {
    return row.getWorkshopId();
  }

  @Override
  protected void checkKey(String id) {
    requireKey(Workshop.TABLE, "workshop_id", id);
  }

  @Override
  protected void enforceConstraints(Workshop row) {}

  @Override
  protected List<String> referencingTables(String id) {
    return lineRepository.existsByWorkshopId(id) ? List.of(ProductionLine.TABLE) : List.of();
  }
}
