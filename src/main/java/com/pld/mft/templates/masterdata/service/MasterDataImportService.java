package com.pld.mft.templates.masterdata.service;

import static com.pld.mft.catalog.service.SchemaConstraints.smallint;

import com.pld.mft.catalog.domain.Localization;
import com.pld.mft.catalog.domain.ModelCode;
import com.pld.mft.catalog.domain.ModelName;
import com.pld.mft.catalog.domain.PackagingType;
import com.pld.mft.catalog.domain.WorkshopCode;
import com.pld.mft.catalog.domain.WorkshopName;
import com.pld.mft.catalog.entity.Box;
import com.pld.mft.catalog.entity.BoxToPallet;
import com.pld.mft.catalog.entity.BoxToPalletId;
import com.pld.mft.catalog.entity.Breakpoint;
import com.pld.mft.catalog.entity.Pallet;
import com.pld.mft.catalog.entity.Part;
import com.pld.mft.catalog.entity.PartToBox;
import com.pld.mft.catalog.entity.PartToBoxId;
import com.pld.mft.catalog.entity.PartToBreakpointId;
import com.pld.mft.catalog.entity.PartToLine;
import com.pld.mft.catalog.entity.PartToLineId;
import com.pld.mft.catalog.entity.PartToModel;
import com.pld.mft.catalog.entity.PartToModelId;
import com.pld.mft.catalog.entity.ProductionLine;
import com.pld.mft.catalog.entity.Supplier;
import com.pld.mft.catalog.entity.VehicleModel;
import com.pld.mft.catalog.entity.Workshop;
import com.pld.mft.catalog.service.BoxService;
import com.pld.mft.catalog.service.BoxToPalletService;
import com.pld.mft.catalog.service.BreakpointService;
import com.pld.mft.catalog.service.PackagingService;
import com.pld.mft.catalog.service.PalletService;
import com.pld.mft.catalog.service.PartService;
import com.pld.mft.catalog.service.PartToBoxService;
import com.pld.mft.catalog.service.PartToBreakpointService;
import com.pld.mft.catalog.service.PartToLineService;
import com.pld.mft.catalog.service.PartToModelService;
import com.pld.mft.catalog.service.ProductionLineService;
import com.pld.mft.catalog.service.SupplierService;
import com.pld.mft.catalog.service.VehicleModelService;
import com.pld.mft.catalog.service.WorkshopService;
import com.pld.mft.service.contract.PersistenceHandler;
import com.pld.mft.templates.masterdata.dto.MasterDataCommonData;
import com.pld.mft.templates.masterdata.dto.MasterDataRowDto;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Writes validated master data rows through the catalog services, so every schema rule applies to
 * imported data exactly as it does to API writes.
 *
 * <p>Entities are matched by natural key (supplier name, part number, box and pallet number, model
 * and workshop code, line code within its workshop). A matched row is updated with the non-empty
 * cells of the sheet row; an unmatched one is inserted with a generated id. Association rows are
 * inserted or updated the same way. All rows share one transaction: a rejected row rolls back the
 * whole upload.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MasterDataImportService
    implements PersistenceHandler<MasterDataRowDto, MasterDataCommonData> {

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

  /** Counts a row as created when its part number was new, updated otherwise. */
  @Override
  @Transactional
  public SaveResult saveAll(
      List<MasterDataRowDto> rows,
      List<Integer> sourceRowNumbers,
      MasterDataCommonData commonData) {
    int created = 0;
    int updated = 0;
    for (int i = 0; i < rows.size(); i++) {
      if (saveRow(rows.get(i))) {
        created++;
      } else {
        updated++;
      }
      log.debug("Saved row {} for {}", sourceRowNumbers.get(i), commonData.getCustomId());
    }
    return new SaveResult(created, updated);
  }

  private boolean saveRow(MasterDataRowDto row) {
    Optional<Part> existingPart = partService.findByNumber(row.getPartNumber());
    // The snapshot has to see the part before this row changes it or its supplier.
    if (existingPart.isPresent() && row.getBreakpointNumber() != null) {
      captureBreakpoint(row, existingPart.get());
    }

    Supplier supplier = upsertSupplier(row);
    Part part = upsertPart(row, existingPart, supplier);
    Box box = upsertBox(row);
    Pallet pallet = upsertPallet(row);
    VehicleModel model = upsertModel(row);
    Workshop workshop = upsertWorkshop(row);
    ProductionLine line = upsertLine(row, workshop);

    if (box != null) {
      linkPartToBox(part, box, row.getPartPerBox());
    }
    if (box != null && pallet != null) {
      linkBoxToPallet(box, pallet, row.getBoxPerPallet());
    }
    if (model != null) {
      linkPartToModel(part, model, row);
    }
    if (line != null) {
      PartToLineId id = new PartToLineId(part.getPartId(), line.getLineId());
      if (!partToLineService.exists(id)) {
        partToLineService.create(PartToLine.builder().id(id).build());
      }
    }
    return existingPart.isEmpty();
  }

  private void captureBreakpoint(MasterDataRowDto row, Part part) {
    Breakpoint breakpoint =
        breakpointService
            .findLatestByNumber(row.getBreakpointNumber())
            .orElseGet(
                () ->
                    breakpointService.create(
                        Breakpoint.builder()
                            .breakpointNumber(row.getBreakpointNumber())
                            .breakpointDate(toOffset(row.getBreakpointDate()))
                            .build()));
    if (partToBreakpointService.exists(
        new PartToBreakpointId(part.getPartId(), breakpoint.getBreakpointId()))) {
      log.debug(
          "Part {} already has a snapshot under breakpoint {}",
          part.getPartNumber(),
          row.getBreakpointNumber());
      return;
    }
    breakpointService.capture(breakpoint.getBreakpointId(), part.getPartId(), null);
  }

  private Supplier upsertSupplier(MasterDataRowDto row) {
    if (row.getSupplierName() == null) {
      return null;
    }
    Optional<Supplier> existing = supplierService.findByName(row.getSupplierName());
    Supplier supplier =
        existing.orElseGet(() -> Supplier.builder().supplierName(row.getSupplierName()).build());
    setIfPresent(row.getLocation(), supplier::setLocation);
    setIfPresent(row.getCity(), supplier::setCity);
    setIfPresent(row.getStreet(), supplier::setStreet);
    setIfPresent(row.getBuilding(), supplier::setBuilding);
    setIfPresent(
        Localization.fromValue(row.getLocalization(), Supplier.TABLE, "localization"),
        supplier::setLocalization);
    return existing.isPresent()
        ? supplierService.update(supplier)
        : supplierService.create(supplier);
  }

  private Part upsertPart(MasterDataRowDto row, Optional<Part> existing, Supplier supplier) {
    Part part = existing.orElseGet(() -> Part.builder().partNumber(row.getPartNumber()).build());
    setIfPresent(row.getPartName(), part::setPartName);
    setIfPresent(row.getPartWeightKg(), part::setPartWeightKg);
    if (supplier != null) {
      part.setSupplierId(supplier.getSupplierId());
    }
    return existing.isPresent() ? partService.update(part) : partService.create(part);
  }

  private Box upsertBox(MasterDataRowDto row) {
    PackagingType type = PackagingType.fromValue(row.getBoxType(), Box.TABLE, "box_type");
    String number =
        row.getBoxNumber() != null
            ? row.getBoxNumber()
            : PackagingService.defaultNumber(
                type, row.getBoxLengthMm(), row.getBoxWidthMm(), row.getBoxHeightMm());
    if (number == null) {
      return null;
    }
    Optional<Box> existing = boxService.findByNumber(number);
    Box box = existing.orElseGet(() -> Box.builder().boxNumber(number).build());
    setIfPresent(type, box::setBoxType);
    setIfPresent(row.getBoxWeightKg(), box::setBoxWeightKg);
    setIfPresent(smallint(Box.TABLE, "box_length_mm", row.getBoxLengthMm()), box::setBoxLengthMm);
    setIfPresent(smallint(Box.TABLE, "box_width_mm", row.getBoxWidthMm()), box::setBoxWidthMm);
    setIfPresent(smallint(Box.TABLE, "box_height_mm", row.getBoxHeightMm()), box::setBoxHeightMm);
    setIfPresent(row.getBoxVolM3(), box::setBoxVolM3);
    setIfPresent(row.getBoxAreaM2(), box::setBoxAreaM2);
    setIfPresent(smallint(Box.TABLE, "box_stacking", row.getBoxStacking()), box::setBoxStacking);
    return existing.isPresent() ? boxService.update(box) : boxService.create(box);
  }

  private Pallet upsertPallet(MasterDataRowDto row) {
    PackagingType type =
        PackagingType.fromValue(row.getPalletType(), Pallet.TABLE, "pallet_type");
    String number =
        row.getPalletNumber() != null
            ? row.getPalletNumber()
            : PackagingService.defaultNumber(
                type, row.getPalletLengthMm(), row.getPalletWidthMm(), row.getPalletHeightMm());
    if (number == null) {
      return null;
    }
    Optional<Pallet> existing = palletService.findByNumber(number);
    Pallet pallet = existing.orElseGet(() -> Pallet.builder().palletNumber(number).build());
    setIfPresent(type, pallet::setPalletType);
    setIfPresent(row.getPalletWeightKg(), pallet::setPalletWeightKg);
    setIfPresent(
        smallint(Pallet.TABLE, "pallet_length_mm", row.getPalletLengthMm()),
        pallet::setPalletLengthMm);
    setIfPresent(
        smallint(Pallet.TABLE, "pallet_width_mm", row.getPalletWidthMm()),
        pallet::setPalletWidthMm);
    setIfPresent(
        smallint(Pallet.TABLE, "pallet_height_mm", row.getPalletHeightMm()),
        pallet::setPalletHeightMm);
    setIfPresent(row.getPalletVolM3(), pallet::setPalletVolM3);
    setIfPresent(row.getPalletAreaM2(), pallet::setPalletAreaM2);
    setIfPresent(
        smallint(Pallet.TABLE, "pallet_stacking", row.getPalletStacking()),
        pallet::setPalletStacking);
    return existing.isPresent() ? palletService.update(pallet) : palletService.create(pallet);
  }

  private VehicleModel upsertModel(MasterDataRowDto row) {
    ModelCode code = ModelCode.fromValue(row.getModelCode(), VehicleModel.TABLE, "model_code");
    if (code == null) {
      return null;
    }
    Optional<VehicleModel> existing = modelService.findByCode(code);
    VehicleModel model = existing.orElseGet(() -> VehicleModel.builder().modelCode(code).build());
    setIfPresent(
        ModelName.fromValue(row.getModelName(), VehicleModel.TABLE, "model_name"),
        model::setModelName);
    return existing.isPresent() ? modelService.update(model) : modelService.create(model);
  }

  private Workshop upsertWorkshop(MasterDataRowDto row) {
    WorkshopCode code =
        WorkshopCode.fromValue(row.getWorkshopCode(), Workshop.TABLE, "workshop_code");
    if (code == null) {
      return null;
    }
    Optional<Workshop> existing = workshopService.findByCode(code);
    Workshop workshop = existing.orElseGet(() -> Workshop.builder().workshopCode(code).build());
    setIfPresent(
        WorkshopName.fromValue(row.getWorkshopName(), Workshop.TABLE, "workshop_name"),
        workshop::setWorkshopName);
    return existing.isPresent()
        ? workshopService.update(workshop)
        : workshopService.create(workshop);
  }

  private ProductionLine upsertLine(MasterDataRowDto row, Workshop workshop) {
    if (row.getLineCode() == null) {
      return null;
    }
    String workshopId = workshop != null ? workshop.getWorkshopId() : null;
    Optional<ProductionLine> existing = lineService.findByCode(row.getLineCode(), workshopId);
    ProductionLine line =
        existing.orElseGet(
            () ->
                ProductionLine.builder()
                    .lineCode(row.getLineCode())
                    .workshopId(workshopId)
                    .build());
    setIfPresent(row.getLineName(), line::setLineName);
    return existing.isPresent() ? lineService.update(line) : lineService.create(line);
  }

  private void linkPartToBox(Part part, Box box, Integer partPerBox) {
    PartToBoxId id = new PartToBoxId(part.getPartId(), box.getBoxId());
    Optional<PartToBox> existing = partToBoxService.find(id);
    PartToBox link = existing.orElseGet(() -> PartToBox.builder().id(id).build());
    setIfPresent(partPerBox, link::setPartPerBox);
    if (existing.isPresent()) {
      partToBoxService.update(link);
    } else {
      partToBoxService.create(link);
    }
  }

  private void linkBoxToPallet(Box box, Pallet pallet, Integer boxPerPallet) {
    BoxToPalletId id = new BoxToPalletId(box.getBoxId(), pallet.getPalletId());
    Optional<BoxToPallet> existing = boxToPalletService.find(id);
    BoxToPallet link = existing.orElseGet(() -> BoxToPallet.builder().id(id).build());
    setIfPresent(
        smallint(BoxToPallet.TABLE, "box_per_pallet", boxPerPallet), link::setBoxPerPallet);
    if (existing.isPresent()) {
      boxToPalletService.update(link);
    } else {
      boxToPalletService.create(link);
    }
  }

  private void linkPartToModel(Part part, VehicleModel model, MasterDataRowDto row) {
    PartToModelId id = new PartToModelId(part.getPartId(), model.getModelId());
    Optional<PartToModel> existing = partToModelService.find(id);
    PartToModel link = existing.orElseGet(() -> PartToModel.builder().id(id).build());
    setIfPresent(row.getConfiguration(), link::setConfiguration);
    setIfPresent(
        smallint(PartToModel.TABLE, "part_per_vehicle", row.getPartPerVehicle()),
        link::setPartPerVehicle);
    if (existing.isPresent()) {
      partToModelService.update(link);
    } else {
      partToModelService.create(link);
    }
  }

  private static OffsetDateTime toOffset(LocalDateTime value) {
    return value == null ? null : value.atZone(ZoneId.systemDefault()).toOffsetDateTime();
  }

  private static <V> void setIfPresent(V value, Consumer<V> setter) {
    if (value != null) {
      setter.accept(value);
    }
  }
}
