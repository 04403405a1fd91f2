package com.pld.mft.catalog.service;

import static com.pld.mft.catalog.service.SchemaConstraints.requireKey;
import static com.pld.mft.catalog.service.SchemaConstraints.requireLength;
import static com.pld.mft.catalog.service.SchemaConstraints.requireNotNull;

import com.pld.mft.catalog.entity.Breakpoint;
import com.pld.mft.catalog.entity.Part;
import com.pld.mft.catalog.entity.PartToBreakpoint;
import com.pld.mft.catalog.entity.PartToBreakpointId;
import com.pld.mft.catalog.entity.PartToLine;
import com.pld.mft.catalog.entity.ProductionLine;
import com.pld.mft.catalog.entity.Supplier;
import com.pld.mft.catalog.exception.ReferentialIntegrityViolationException;
import com.pld.mft.catalog.repository.BreakpointRepository;
import com.pld.mft.catalog.repository.PartRepository;
import com.pld.mft.catalog.repository.PartToBreakpointRepository;
import com.pld.mft.catalog.repository.PartToLineRepository;
import com.pld.mft.catalog.repository.ProductionLineRepository;
import com.pld.mft.catalog.repository.SupplierRepository;
import java.util.List;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Breakpoints and the part snapshots attached to them.
 *
 * <p>{@code input_date} defaults to the moment the row is first persisted (see {@link
 * Breakpoint}); a caller-supplied value is kept.
 */
@Slf4j
@Service
public class BreakpointService extends ConstrainedTableService<Breakpoint, String> {

  private final BreakpointRepository breakpointRepository;
  private final PartToBreakpointRepository partToBreakpointRepository;
  private final PartRepository partRepository;
  private final SupplierRepository supplierRepository;
  private final PartToLineRepository partToLineRepository;
  private final ProductionLineRepository lineRepository;
  private final PartToBreakpointService partToBreakpointService;
  private final IdGenerator idGenerator;

  public BreakpointService(
      BreakpointRepository breakpointRepository,
      PartToBreakpointRepository partToBreakpointRepository,
      PartRepository partRepository,
      SupplierRepository supplierRepository,
      PartToLineRepository partToLineRepository,
      ProductionLineRepository lineRepository,
      PartToBreakpointService partToBreakpointService,
      IdGenerator idGenerator) {
    super(breakpointRepository, Breakpoint.TABLE);
    this.breakpointRepository = breakpointRepository;
    this.partToBreakpointRepository = partToBreakpointRepository;
    this.partRepository = partRepository;
    this.supplierRepository = supplierRepository;
    this.partToLineRepository = partToLineRepository;
    this.lineRepository = lineRepository;
    this.partToBreakpointService = partToBreakpointService;
    this.idGenerator = idGenerator;
  }

  @Transactional(readOnly = true)
  public Optional<Breakpoint> findLatestByNumber(String breakpointNumber) {
    return breakpointRepository.findFirstByBreakpointNumberOrderByInputDateDesc(breakpointNumber);
  }

  /**
   * Records what {@code partId} looks like right now under {@code breakpointId}: its number, its
   * supplier's name and localization, and a line name.
   *
   * <p>The line is {@code lineId} when given. Otherwise it is the part's only line, or none when
   * the part is on several lines or none.
   *
   * @throws ReferentialIntegrityViolationException if the part, breakpoint or line is missing
   */
  @Transactional
  public PartToBreakpoint capture(String breakpointId, String partId, String lineId) {
    Part part =
        partRepository
            .findById(partId)
            .orElseThrow(
                () ->
                    ReferentialIntegrityViolationException.missingReference(
                        PartToBreakpoint.TABLE, "part_id", partId, Part.TABLE));

    Optional<Supplier> supplier =
        part.getSupplierId() == null
            ? Optional.empty()
            : supplierRepository.findById(part.getSupplierId());

    PartToBreakpoint snapshot =
        PartToBreakpoint.builder()
            .id(new PartToBreakpointId(partId, breakpointId))
            .partNumberBeforeChange(part.getPartNumber())
            .supplierNameBeforeChange(supplier.map(Supplier::getSupplierName).orElse(null))
            .localizationBeforeChange(supplier.map(Supplier::getLocalization).orElse(null))
            .lineNameBeforeChange(resolveLineName(partId, lineId))
            .build();

    PartToBreakpoint saved = partToBreakpointService.create(snapshot);
    log.info("Captured snapshot of part {} under breakpoint {}", partId, breakpointId);
    return saved;
  }

  private String resolveLineName(String partId, String lineId) {
    if (lineId != null) {
      return lineRepository
          .findById(lineId)
          .map(ProductionLine::getLineName)
          .orElseThrow(
              () ->
                  ReferentialIntegrityViolationException.missingReference(
                      PartToBreakpoint.TABLE, "line_id", lineId, ProductionLine.TABLE));
    }
    List<PartToLine> lines = partToLineRepository.findByIdPartId(partId);
    if (lines.size() != 1) {
      return null;
    }
    return lineRepository
        .findById(lines.get(0).getId().getLineId())
        .map(ProductionLine::getLineName)
        .orElse(null);
  }

  /** An update without {@code input_date} keeps the stored one. */
  @Override
  @Transactional
  public Breakpoint update(Breakpoint row) {
    if (row.getInputDate() == null && row.getBreakpointId() != null) {
      breakpointRepository
          .findById(row.getBreakpointId())
          .ifPresent(stored -> row.setInputDate(stored.getInputDate()));
    }
    return super.update(row);
  }

  @Override
  protected void applyDefaults(Breakpoint row) {
    if (row.getBreakpointId() == null) {
      row.setBreakpointId(
          idGenerator.newUniqueId(IdGenerator.BREAKPOINT, breakpointRepository::existsById));
    }
  }

  @Override
  protected String idOf(Breakpoint row) {
    return row.getBreakpointId();
  }

  @Override
  protected void checkKey(String id) {
    requireKey(Breakpoint.TABLE, "breakpoint_id", id);
  }

  @Override
  protected void enforceConstraints(Breakpoint row) {
    requireNotNull(Breakpoint.TABLE, "breakpoint_number", row.getBreakpointNumber());
    requireLength(Breakpoint.TABLE, "breakpoint_number", row.getBreakpointNumber(), 10);
  }

  @Override
  protected List<String> referencingTables(String id) {
    return partToBreakpointRepository.existsByIdBreakpointId(id)
        ? List.of(PartToBreakpoint.TABLE)
        : List.of();
  }
}
