package com.pld.mft.templates.masterdata.service;

import com.pld.mft.catalog.domain.DbEnums;
import com.pld.mft.catalog.domain.ModelCode;
import com.pld.mft.catalog.domain.ModelName;
import com.pld.mft.catalog.domain.PackagingType;
import com.pld.mft.catalog.domain.WorkshopCode;
import com.pld.mft.catalog.domain.WorkshopName;
import com.pld.mft.catalog.entity.VehicleModel;
import com.pld.mft.catalog.entity.Workshop;
import com.pld.mft.catalog.service.PackagingService;
import com.pld.mft.catalog.service.VehicleModelService;
import com.pld.mft.catalog.service.WorkshopService;
import com.pld.mft.service.contract.DatabaseUniquenessChecker;
import com.pld.mft.templates.masterdata.dto.MasterDataCommonData;
import com.pld.mft.templates.masterdata.dto.MasterDataRowDto;
import com.pld.mft.validation.CellError;
import com.pld.mft.validation.RowError;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Stream;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

/**
 * Rejects rows whose natural keys contradict stored data or earlier rows of the same file.
 *
 * <ul>
 *   <li>A model code already named differently, in the database or earlier in the file.
 *   <li>The same for a workshop code and its name.
 *   <li>A line code that an earlier row placed in a different workshop. Stored lines are keyed by
 *       code and workshop together, so the database is not consulted here.
 *   <li>Box or pallet attributes with no number and not enough data to derive one.
 * </ul>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class MasterDataKeyConsistencyChecker
    implements DatabaseUniquenessChecker<MasterDataRowDto, MasterDataCommonData> {

  private final VehicleModelService modelService;
  private final WorkshopService workshopService;

  @Override
  @Transactional(readOnly = true)
  public List<RowError> check(
      List<MasterDataRowDto> rows,
      Class<MasterDataRowDto> dtoClass,
      List<Integer> sourceRowNumbers,
      MasterDataCommonData commonData) {
    List<RowError> errors = new ArrayList<>();
    Map<String, String> modelNames = new HashMap<>();
    Map<String, String> workshopNames = new HashMap<>();
    Map<String, String> lineWorkshops = new HashMap<>();
    Map<String, Optional<String>> storedModelNames = new HashMap<>();
    Map<String, Optional<String>> storedWorkshopNames = new HashMap<>();

    for (int i = 0; i < rows.size(); i++) {
      MasterDataRowDto row = rows.get(i);
      int rowNumber = sourceRowNumbers.get(i);

      if (row.getModelCode() != null && row.getModelName() != null) {
        String known =
            modelNames.computeIfAbsent(
                row.getModelCode(),
                code ->
                    storedModelNames
                        .computeIfAbsent(code, this::storedModelName)
                        .orElse(row.getModelName()));
        if (!known.equals(row.getModelName())) {
          RowError.addTo(
              errors,
              rowNumber,
              error(
                  "modelName",
                  "MODEL_NAME",
                  row.getModelName(),
                  "MODEL_CODE " + row.getModelCode() + " is already named " + known));
        }
      }

      if (row.getWorkshopCode() != null && row.getWorkshopName() != null) {
        String known =
            workshopNames.computeIfAbsent(
                row.getWorkshopCode(),
                code ->
                    storedWorkshopNames
                        .computeIfAbsent(code, this::storedWorkshopName)
                        .orElse(row.getWorkshopName()));
        if (!known.equals(row.getWorkshopName())) {
          RowError.addTo(
              errors,
              rowNumber,
              error(
                  "workshopName",
                  "WORKSHOP_NAME",
                  row.getWorkshopName(),
                  "WORKSHOP_CODE " + row.getWorkshopCode() + " is already named " + known));
        }
      }

      if (row.getLineCode() != null && row.getWorkshopCode() != null) {
        String known = lineWorkshops.putIfAbsent(row.getLineCode(), row.getWorkshopCode());
        if (known != null && !known.equals(row.getWorkshopCode())) {
          RowError.addTo(
              errors,
              rowNumber,
              error(
                  "lineCode",
                  "LINE_CODE",
                  row.getLineCode(),
                  "LINE_CODE " + row.getLineCode() + " belongs to workshop " + known));
        }
      }

      if (missingPackagingNumber(
          row.getBoxNumber(),
          row.getBoxType(),
          row.getBoxLengthMm(),
          row.getBoxWidthMm(),
          row.getBoxHeightMm(),
          row.getBoxWeightKg(),
          row.getBoxVolM3(),
          row.getBoxAreaM2(),
          row.getBoxStacking(),
          row.getPartPerBox())) {
        RowError.addTo(errors, rowNumber, numberRequired("boxNumber", "BOX_NUMBER", "BOX"));
      }
      if (missingPackagingNumber(
          row.getPalletNumber(),
          row.getPalletType(),
          row.getPalletLengthMm(),
          row.getPalletWidthMm(),
          row.getPalletHeightMm(),
          row.getPalletWeightKg(),
          row.getPalletVolM3(),
          row.getPalletAreaM2(),
          row.getPalletStacking(),
          row.getBoxPerPallet())) {
        RowError.addTo(
            errors, rowNumber, numberRequired("palletNumber", "PALLET_NUMBER", "PALLET"));
      }
    }

    if (!errors.isEmpty()) {
      log.debug("Key consistency check rejected {} rows", errors.size());
    }
    return errors;
  }

  private Optional<String> storedModelName(String code) {
    return DbEnums.find(ModelCode.class, code)
        .flatMap(modelService::findByCode)
        .map(VehicleModel::getModelName)
        .map(ModelName::dbValue);
  }

  private Optional<String> storedWorkshopName(String code) {
    return DbEnums.find(WorkshopCode.class, code)
        .flatMap(workshopService::findByCode)
        .map(Workshop::getWorkshopName)
        .map(WorkshopName::dbValue);
  }

  private boolean missingPackagingNumber(
      String number, String type, Integer length, Integer width, Integer height, Object... rest) {
    if (number != null) {
      return false;
    }
    boolean anyValue =
        type != null
            || length != null
            || width != null
            || height != null
            || Stream.of(rest).anyMatch(Objects::nonNull);
    if (!anyValue) {
      return false;
    }
    Optional<PackagingType> packagingType = DbEnums.find(PackagingType.class, type);
    return packagingType.isEmpty()
        || PackagingService.defaultNumber(packagingType.get(), length, width, height) == null;
  }

  private CellError numberRequired(String field, String header, String prefix) {
    return error(
        field,
        header,
        null,
        header + " is required unless " + prefix + "_TYPE and all three dimensions are given");
  }

  private CellError error(String field, String header, Object value, String message) {
    return CellError.builder()
        .columnIndex(-1)
        .columnLetter("?")
        .fieldName(field)
        .headerName(header)
        .rejectedValue(value)
        .message(message)
        .build();
  }
}
