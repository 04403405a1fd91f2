package com.pld.mft.templates.masterdata.service;

import static org.assertj.core.api.Assertions.assertThat;

import com.pld.mft.MftLogisticsApplication;
import com.pld.mft.catalog.domain.Localization;
import com.pld.mft.catalog.entity.Box;
import com.pld.mft.catalog.entity.Breakpoint;
import com.pld.mft.catalog.entity.Part;
import com.pld.mft.catalog.entity.PartToBreakpoint;
import com.pld.mft.catalog.entity.PartToBreakpointId;
import com.pld.mft.catalog.service.BoxService;
import com.pld.mft.catalog.service.BreakpointService;
import com.pld.mft.catalog.service.CatalogStatisticsService;
import com.pld.mft.catalog.service.PartService;
import com.pld.mft.catalog.service.PartToBreakpointService;
import com.pld.mft.catalog.service.SupplierService;
import com.pld.mft.service.contract.PersistenceHandler.SaveResult;
import com.pld.mft.templates.masterdata.dto.MasterDataCommonData;
import com.pld.mft.templates.masterdata.dto.MasterDataRowDto;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.annotation.DirtiesContext;
import org.springframework.test.context.ActiveProfiles;

@SpringBootTest(classes = MftLogisticsApplication.class)
@ActiveProfiles("test")
@DirtiesContext(classMode = DirtiesContext.ClassMode.AFTER_EACH_TEST_METHOD)
class MasterDataImportServiceTest {

  @Autowired private MasterDataImportService importService;
  @Autowired private CatalogStatisticsService statisticsService;
  @Autowired private PartService partService;
  @Autowired private SupplierService supplierService;
  @Autowired private BoxService boxService;
  @Autowired private BreakpointService breakpointService;
  @Autowired private PartToBreakpointService partToBreakpointService;

  @Test
  void saveAll_newParts_createsEveryTableOnce() {
    SaveResult result = save(row("P-1", "Acme Steel Works"), row("P-2", "Acme Steel Works"));

    assertThat(result.created()).isEqualTo(2);
    assertThat(result.updated()).isZero();

    Map<String, Long> counts = statisticsService.counts();
    assertThat(counts.get("supplier_data")).isEqualTo(1);
    assertThat(counts.get("part_data")).isEqualTo(2);
    assertThat(counts.get("box_data")).isEqualTo(1);
    assertThat(counts.get("model_data")).isEqualTo(1);
    assertThat(counts.get("workshop_data")).isEqualTo(1);
    assertThat(counts.get("line_data")).isEqualTo(1);
    assertThat(counts.get("part_to_box")).isEqualTo(2);
    assertThat(counts.get("part_to_model")).isEqualTo(2);
    assertThat(counts.get("part_to_line")).isEqualTo(2);
    assertThat(counts.get("pallet_data")).isZero();
    assertThat(counts.get("breakpoint_data")).isZero();
  }

  @Test
  void saveAll_boxWithoutNumber_getsDerivedNumber() {
    save(row("P-1", "Acme Steel Works"));

    assertThat(boxService.findByNumber("B 600-400-300"))
        .map(Box::getBoxStacking)
        .contains((short) 4);
  }

  @Test
  void saveAll_samePartAgain_updatesInPlace() {
    save(row("P-1", "Acme Steel Works"));
    MasterDataRowDto again = row("P-1", "Acme Steel Works");
    again.setPartName("Bracket Left");
    again.setPartWeightKg(null);

    SaveResult result = save(again);

    assertThat(result.created()).isZero();
    assertThat(result.updated()).isEqualTo(1);
    Part part = partService.findByNumber("P-1").orElseThrow();
    assertThat(part.getPartName()).isEqualTo("Bracket Left");
    assertThat(part.getPartWeightKg()).isEqualByComparingTo("1.25");
    assertThat(statisticsService.counts().get("part_to_line")).isEqualTo(1);
  }

  @Test
  void saveAll_breakpointOnKnownPart_snapshotsStateBeforeTheRow() {
    save(row("P-1", "Acme Steel Works"));
    MasterDataRowDto change = row("P-1", "Beta Forge");
    change.setLocalization("yes");
    change.setBreakpointNumber("BP-7");
    change.setBreakpointDate(LocalDateTime.of(2024, 5, 1, 6, 0));

    save(change);

    Part part = partService.findByNumber("P-1").orElseThrow();
    Breakpoint breakpoint = breakpointService.findLatestByNumber("BP-7").orElseThrow();
    assertThat(breakpoint.getInputDate()).isNotNull();
    PartToBreakpoint snapshot =
        partToBreakpointService
            .find(new PartToBreakpointId(part.getPartId(), breakpoint.getBreakpointId()))
            .orElseThrow();
    assertThat(snapshot.getPartNumberBeforeChange()).isEqualTo("P-1");
    assertThat(snapshot.getSupplierNameBeforeChange()).isEqualTo("Acme Steel Works");
    assertThat(snapshot.getLocalizationBeforeChange()).isEqualTo(Localization.NO);
    assertThat(snapshot.getLineNameBeforeChange()).isEqualTo("Main line");
    assertThat(supplierService.get(part.getSupplierId()).getSupplierName())
        .isEqualTo("Beta Forge");
  }

  @Test
  void saveAll_breakpointRepeated_keepsFirstSnapshot() {
    save(row("P-1", "Acme Steel Works"));
    MasterDataRowDto first = row("P-1", "Beta Forge");
    first.setBreakpointNumber("BP-7");
    save(first);
    MasterDataRowDto second = row("P-1", "Gamma Cast");
    second.setBreakpointNumber("BP-7");

    save(second);

    assertThat(statisticsService.counts().get("part_to_breakpoint")).isEqualTo(1);
    assertThat(statisticsService.counts().get("breakpoint_data")).isEqualTo(1);
    assertThat(partToBreakpointService.findAll())
        .extracting(PartToBreakpoint::getSupplierNameBeforeChange)
        .containsExactly("Acme Steel Works");
  }

  @Test
  void saveAll_breakpointOnNewPart_recordsNothing() {
    MasterDataRowDto row = row("P-9", "Acme Steel Works");
    row.setBreakpointNumber("BP-1");

    save(row);

    assertThat(statisticsService.counts().get("breakpoint_data")).isZero();
  }

  private SaveResult save(MasterDataRowDto... rows) {
    MasterDataCommonData commonData = new MasterDataCommonData();
    commonData.setCustomId("PLANT-01");
    List<Integer> rowNumbers = new ArrayList<>();
    for (int i = 0; i < rows.length; i++) {
      rowNumbers.add(i + 2);
    }
    return importService.saveAll(List.of(rows), rowNumbers, commonData);
  }

  private MasterDataRowDto row(String partNumber, String supplierName) {
    MasterDataRowDto row = new MasterDataRowDto();
    row.setPartNumber(partNumber);
    row.setPartName("Bracket");
    row.setPartWeightKg(new BigDecimal("1.25"));
    row.setSupplierName(supplierName);
    row.setLocalization("no");
    row.setBoxType("returnable");
    row.setBoxLengthMm(600);
    row.setBoxWidthMm(400);
    row.setBoxHeightMm(300);
    row.setBoxStacking(4);
    row.setPartPerBox(20);
    row.setModelCode("A01");
    row.setModelName("Jolion");
    row.setConfiguration("base");
    row.setPartPerVehicle(2);
    row.setWorkshopCode("AS");
    row.setWorkshopName("Assembly");
    row.setLineCode("L1");
    row.setLineName("Main line");
    return row;
  }
}
