package com.pld.mft.catalog.service;

import static com.pld.mft.catalog.service.SchemaConstraints.decimal;
import static com.pld.mft.catalog.service.SchemaConstraints.requireKey;
import static com.pld.mft.catalog.service.SchemaConstraints.requireLength;
import static com.pld.mft.catalog.service.SchemaConstraints.requireReference;

import com.pld.mft.catalog.entity.Part;
import com.pld.mft.catalog.entity.PartToBox;
import com.pld.mft.catalog.entity.PartToBreakpoint;
import com.pld.mft.catalog.entity.PartToLine;
import com.pld.mft.catalog.entity.PartToModel;
import com.pld.mft.catalog.entity.Supplier;
import com.pld.mft.catalog.repository.PartRepository;
import com.pld.mft.catalog.repository.PartToBoxRepository;
import com.pld.mft.catalog.repository.PartToBreakpointRepository;
import com.pld.mft.catalog.repository.PartToLineRepository;
import com.pld.mft.catalog.repository.PartToModelRepository;
import com.pld.mft.catalog.repository.SupplierRepository;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class PartService extends ConstrainedTableService<Part, String> {

  private final PartRepository partRepository;
  private final SupplierRepository supplierRepository;
  private final PartToBoxRepository partToBoxRepository;
  private final PartToModelRepository partToModelRepository;
  private final PartToLineRepository partToLineRepository;
  private final PartToBreakpointRepository partToBreakpointRepository;
  private final IdGenerator idGenerator;

  public PartService(
      PartRepository partRepository,
      SupplierRepository supplierRepository,
      PartToBoxRepository partToBoxRepository,
      PartToModelRepository partToModelRepository,
      PartToLineRepository partToLineRepository,
      PartToBreakpointRepository partToBreakpointRepository,
      IdGenerator idGenerator) {
    super(partRepository, Part.TABLE);
    this.partRepository = partRepository;
    this.supplierRepository = supplierRepository;
    this.partToBoxRepository = partToBoxRepository;
    this.partToModelRepository = partToModelRepository;
    this.partToLineRepository = partToLineRepository;
    this.partToBreakpointRepository = partToBreakpointRepository;
    this.idGenerator = idGenerator;
  }

  @Transactional(readOnly = true)
  public Optional<Part> findByNumber(String partNumber) {
    return partRepository.findFirstByPartNumber(partNumber);
  }

  @Override
  protected void applyDefaults(Part row) {
    if (row.getPartId() == null) {
      row.setPartId(idGenerator.newUniqueId(IdGenerator.PART, partRepository::existsById));
    }
  }

  @Override
  protected String idOf(Part row) {
    return row.getPartId();
  }

  @Override
  protected void checkKey(String id) {
    requireKey(Part.TABLE, "part_id", id);
  }

  @Override
  protected void enforceConstraints(Part row) {
    requireLength(Part.TABLE, "part_number", row.getPartNumber(), 50);
    requireLength(Part.TABLE, "part_name", row.getPartName(), 100);
    row.setPartWeightKg(decimal(Part.TABLE, "part_weight_kg", row.getPartWeightKg(), 5, 2));
    requireReference(
        supplierRepository, row.getSupplierId(), Part.TABLE, "supplier_id", Supplier.TABLE);
  }

  @Override
  protected List<String> referencingTables(String id) {
    List<String> tables = new ArrayList<>();
    if (partToBoxRepository.existsByIdPartId(id)) {
      tables.add(PartToBox.TABLE);
    }
    if (partToModelRepository.existsByIdPartId(id)) {
      tables.add(PartToModel.TABLE);
    }
    if (partToLineRepository.existsByIdPartId(id)) {
      tables.add(PartToLine.TABLE);
    }
    if (partToBreakpointRepository.existsByIdPartId(id)) {
      tables.add(PartToBreakpoint.TABLE);
    }
    return tables;
  }
}
