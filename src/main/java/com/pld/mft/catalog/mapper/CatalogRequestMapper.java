package com.pld.mft.catalog.mapper;

import static com.pld.mft.catalog.service.SchemaConstraints.smallint;

import com.pld.mft.catalog.domain.Localization;
import com.pld.mft.catalog.domain.ModelCode;
import com.pld.mft.catalog.domain.ModelName;
import com.pld.mft.catalog.domain.PackagingType;
import com.pld.mft.catalog.domain.WorkshopCode;
import com.pld.mft.catalog.domain.WorkshopName;
import com.pld.mft.catalog.dto.BoxPalletRequest;
import com.pld.mft.catalog.dto.BreakpointRequest;
import com.pld.mft.catalog.dto.PackagingRequest;
import com.pld.mft.catalog.dto.PartBoxRequest;
import com.pld.mft.catalog.dto.PartBreakpointRequest;
import com.pld.mft.catalog.dto.PartModelRequest;
import com.pld.mft.catalog.dto.PartRequest;
import com.pld.mft.catalog.dto.ProductionLineRequest;
import com.pld.mft.catalog.dto.SupplierRequest;
import com.pld.mft.catalog.dto.VehicleModelRequest;
import com.pld.mft.catalog.dto.WorkshopRequest;
import com.pld.mft.catalog.entity.Box;
import com.pld.mft.catalog.entity.BoxToPallet;
import com.pld.mft.catalog.entity.BoxToPalletId;
import com.pld.mft.catalog.entity.Breakpoint;
import com.pld.mft.catalog.entity.Pallet;
import com.pld.mft.catalog.entity.Part;
import com.pld.mft.catalog.entity.PartToBox;
import com.pld.mft.catalog.entity.PartToBoxId;
import com.pld.mft.catalog.entity.PartToBreakpoint;
import com.pld.mft.catalog.entity.PartToBreakpointId;
import com.pld.mft.catalog.entity.PartToLine;
import com.pld.mft.catalog.entity.PartToLineId;
import com.pld.mft.catalog.entity.PartToModel;
import com.pld.mft.catalog.entity.PartToModelId;
import com.pld.mft.catalog.entity.ProductionLine;
import com.pld.mft.catalog.entity.Supplier;
import com.pld.mft.catalog.entity.VehicleModel;
import com.pld.mft.catalog.entity.Workshop;
import org.springframework.stereotype.Component;

/**
 * Turns API request bodies into entities. Enumerated columns arrive as their stored strings and
 * are parsed here, so an unknown value fails with a domain violation before any write. A key in
 * the request path takes precedence over one in the body.
 */
@Component
public class CatalogRequestMapper {

  public Supplier toSupplier(SupplierRequest request, String pathId) {
    return Supplier.builder()
        .supplierId(keyOf(pathId, request.getSupplierId()))
        .supplierName(blankToNull(request.getSupplierName()))
        .location(blankToNull(request.getLocation()))
        .city(blankToNull(request.getCity()))
        .street(blankToNull(request.getStreet()))
        .building(blankToNull(request.getBuilding()))
        .localization(
            Localization.fromValue(
                blankToNull(request.getLocalization()), Supplier.TABLE, "localization"))
        .build();
  }

  public Part toPart(PartRequest request, String pathId) {
    return Part.builder()
        .partId(keyOf(pathId, request.getPartId()))
        .partNumber(blankToNull(request.getPartNumber()))
        .partName(blankToNull(request.getPartName()))
        .partWeightKg(request.getPartWeightKg())
        .supplierId(blankToNull(request.getSupplierId()))
        .build();
  }

  public Box toBox(PackagingRequest request, String pathId) {
    String table = Box.TABLE;
    return Box.builder()
        .boxId(keyOf(pathId, request.getId()))
        .boxNumber(blankToNull(request.getNumber()))
        .boxType(PackagingType.fromValue(blankToNull(request.getType()), table, "box_type"))
        .boxWeightKg(request.getWeightKg())
        .boxLengthMm(smallint(table, "box_length_mm", request.getLengthMm()))
        .boxWidthMm(smallint(table, "box_width_mm", request.getWidthMm()))
        .boxHeightMm(smallint(table, "box_height_mm", request.getHeightMm()))
        .boxVolM3(request.getVolM3())
        .boxAreaM2(request.getAreaM2())
        .boxStacking(smallint(table, "box_stacking", request.getStacking()))
        .build();
  }

  public Pallet toPallet(PackagingRequest request, String pathId) {
    String table = Pallet.TABLE;
    return Pallet.builder()
        .palletId(keyOf(pathId, request.getId()))
        .palletNumber(blankToNull(request.getNumber()))
        .palletType(PackagingType.fromValue(blankToNull(request.getType()), table, "pallet_type"))
        .palletWeightKg(request.getWeightKg())
        .palletLengthMm(smallint(table, "pallet_length_mm", request.getLengthMm()))
        .palletWidthMm(smallint(table, "pallet_width_mm", request.getWidthMm()))
        .palletHeightMm(smallint(table, "pallet_height_mm", request.getHeightMm()))
        .palletVolM3(request.getVolM3())
        .palletAreaM2(request.getAreaM2())
        .palletStacking(smallint(table, "pallet_stacking", request.getStacking()))
        .build();
  }

  public VehicleModel toModel(VehicleModelRequest request, String pathId) {
    return VehicleModel.builder()
        .modelId(keyOf(pathId, request.getModelId()))
        .modelCode(
            ModelCode.fromValue(
                blankToNull(request.getModelCode()), VehicleModel.TABLE, "model_code"))
        .modelName(
            ModelName.fromValue(
                blankToNull(request.getModelName()), VehicleModel.TABLE, "model_name"))
        .build();
  }

  public Workshop toWorkshop(WorkshopRequest request, String pathId) {
    return Workshop.builder()
        .workshopId(keyOf(pathId, request.getWorkshopId()))
        .workshopCode(
            WorkshopCode.fromValue(
                blankToNull(request.getWorkshopCode()), Workshop.TABLE, "workshop_code"))
        .workshopName(
            WorkshopName.fromValue(
                blankToNull(request.getWorkshopName()), Workshop.TABLE, "workshop_name"))
        .build();
  }

  public ProductionLine toLine(ProductionLineRequest request, String pathId) {
    return ProductionLine.builder()
        .lineId(keyOf(pathId, request.getLineId()))
        .lineCode(blankToNull(request.getLineCode()))
        .lineName(blankToNull(request.getLineName()))
        .workshopId(blankToNull(request.getWorkshopId()))
        .build();
  }

  public Breakpoint toBreakpoint(BreakpointRequest request, String pathId) {
    return Breakpoint.builder()
        .breakpointId(keyOf(pathId, request.getBreakpointId()))
        .inputDate(request.getInputDate())
        .breakpointNumber(blankToNull(request.getBreakpointNumber()))
        .breakpointDate(request.getBreakpointDate())
        .build();
  }

  public PartToBox toPartToBox(String partId, String pathBoxId, PartBoxRequest request) {
    return PartToBox.builder()
        .id(new PartToBoxId(partId, keyOf(pathBoxId, request.getBoxId())))
        .partPerBox(request.getPartPerBox())
        .build();
  }

  public BoxToPallet toBoxToPallet(String boxId, String pathPalletId, BoxPalletRequest request) {
    return BoxToPallet.builder()
        .id(new BoxToPalletId(boxId, keyOf(pathPalletId, request.getPalletId())))
        .boxPerPallet(smallint(BoxToPallet.TABLE, "box_per_pallet", request.getBoxPerPallet()))
        .build();
  }

  public PartToModel toPartToModel(String partId, String pathModelId, PartModelRequest request) {
    return PartToModel.builder()
        .id(new PartToModelId(partId, keyOf(pathModelId, request.getModelId())))
        .configuration(blankToNull(request.getConfiguration()))
        .partPerVehicle(
            smallint(PartToModel.TABLE, "part_per_vehicle", request.getPartPerVehicle()))
        .build();
  }

  public PartToLine toPartToLine(String partId, String lineId) {
    return PartToLine.builder().id(new PartToLineId(partId, lineId)).build();
  }

  public PartToBreakpoint toPartToBreakpoint(
      String partId, String pathBreakpointId, PartBreakpointRequest request) {
    return PartToBreakpoint.builder()
        .id(new PartToBreakpointId(partId, keyOf(pathBreakpointId, request.getBreakpointId())))
        .partNumberBeforeChange(blankToNull(request.getPartNumberBeforeChange()))
        .supplierNameBeforeChange(blankToNull(request.getSupplierNameBeforeChange()))
        .localizationBeforeChange(
            Localization.fromValue(
                blankToNull(request.getLocalizationBeforeChange()),
                PartToBreakpoint.TABLE,
                "localization_before_change"))
        .lineNameBeforeChange(blankToNull(request.getLineNameBeforeChange()))
        .build();
  }

  private String keyOf(String pathId, String bodyId) {
    return pathId != null ? pathId : blankToNull(bodyId);
  }

  private String blankToNull(String value) {
    if (value == null || value.isBlank()) {
      return null;
    }
    return value.trim();
  }
}
