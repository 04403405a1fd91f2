package com.pld.mft.catalog.service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/** Row counts for every table, entity tables first and link tables after. */
@Service
@RequiredArgsConstructor
public class CatalogStatisticsService {

  private final SupplierService supplierService;
  private final PartService partService;
  private final BoxService boxService;
  private final PalletService palletService;
  private final VehicleModelService modelService;
  private final WorkshopService workshopService;
  private final ProductionLineService lineService;
  private final BreakpointService breakpointService;
  private final PartToBoxService partToBoxService;
  private final BoxToPalletService boxToPalletService;
  private final PartToModelService partToModelService;
  private final PartToLineService partToLineService;
  private final PartToBreakpointService partToBreakpointService;

  @Transactional(readOnly = true)
  public Map<String, Long> counts() {
    List<ConstrainedTableService<?, ?>> services =
        List.of(
            supplierService,
            partService,
            boxService,
            palletService,
            modelService,
            workshopService,
            lineService,
            breakpointService,
            partToBoxService,
            boxToPalletService,
            partToModelService,
            partToLineService,
            partToBreakpointService);
    Map<String, Long> counts = new LinkedHashMap<>();
    for (ConstrainedTableService<?, ?> service : services) {
      counts.put(service.table(), service.count());
    }
    return counts;
  }
}
