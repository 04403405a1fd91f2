package com.pld.mft.templates.masterdata.dto;

import com.pld.mft.annotation.ExcelColumn;
import com.pld.mft.annotation.ExcelCompositeUnique;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import lombok.Data;

/**
 * One row of the master data workbook. Headers are the database column names; columns are found by
 * header, in any order.
 */
@Data
@ExcelCompositeUnique(
    fields = {"partNumber", "modelCode", "configuration", "lineCode"},
    message = "PART_NUMBER + MODEL_CODE + CONFIGURATION + LINE_CODE repeats an earlier row")
public class MasterDataRowDto {

  private static final String SMALLINT_MAX = "must be at most 32767";
  private static final String DECIMAL_5_2 = "must have at most 3 integer and 2 fraction digits";

  // supplier_data
  @ExcelColumn(header = "SUPPLIER_NAME")
  @Size(max = 200)
  private String supplierName;

  @ExcelColumn(header = "LOCATION")
  @Size(max = 50)
  private String location;

  @ExcelColumn(header = "CITY")
  @Size(max = 50)
  private String city;

  @ExcelColumn(header = "STREET")
  @Size(max = 100)
  private String street;

  @ExcelColumn(header = "BUILDING")
  @Size(max = 10)
  private String building;

  @ExcelColumn(header = "LOCALIZATION")
  @Pattern(regexp = "yes|no", message = "must be yes or no")
  private String localization;

  // part_data
  @ExcelColumn(header = "PART_NUMBER", required = true)
  @NotBlank(message = "PART_NUMBER is required")
  @Size(max = 50)
  private String partNumber;

  @ExcelColumn(header = "PART_NAME")
  @Size(max = 100)
  private String partName;

  @ExcelColumn(header = "PART_WEIGHT_KG")
  @Digits(integer = 3, fraction = 2, message = DECIMAL_5_2)
  private BigDecimal partWeightKg;

  // box_data
  @ExcelColumn(header = "BOX_NUMBER")
  @Size(max = 50)
  private String boxNumber;

  @ExcelColumn(header = "BOX_TYPE")
  @Pattern(regexp = "returnable|non-returnable", message = "must be returnable or non-returnable")
  private String boxType;

  @ExcelColumn(header = "BOX_WEIGHT_KG")
  @Digits(integer = 3, fraction = 2, message = DECIMAL_5_2)
  private BigDecimal boxWeightKg;

  @ExcelColumn(header = "BOX_LENGTH_MM")
  @Min(0)
  @Max(value = Short.MAX_VALUE, message = SMALLINT_MAX)
  private Integer boxLengthMm;

  @ExcelColumn(header = "BOX_WIDTH_MM")
  @Min(0)
  @Max(value = Short.MAX_VALUE, message = SMALLINT_MAX)
  private Integer boxWidthMm;

  @ExcelColumn(header = "BOX_HEIGHT_MM")
  @Min(0)
  @Max(value = Short.MAX_VALUE, message = SMALLINT_MAX)
  private Integer boxHeightMm;

  @ExcelColumn(header = "BOX_VOL_M3")
  @DecimalMin("0")
  @Digits(integer = 3, fraction = 2, message = DECIMAL_5_2)
  private BigDecimal boxVolM3;

  @ExcelColumn(header = "BOX_AREA_M2")
  @DecimalMin("0")
  @Digits(integer = 3, fraction = 2, message = DECIMAL_5_2)
  private BigDecimal boxAreaM2;

  @ExcelColumn(header = "BOX_STACKING")
  @Min(0)
  @Max(value = Short.MAX_VALUE, message = SMALLINT_MAX)
  private Integer boxStacking;

  // pallet_data
  @ExcelColumn(header = "PALLET_NUMBER")
  @Size(max = 50)
  private String palletNumber;

  @ExcelColumn(header = "PALLET_TYPE")
  @Pattern(regexp = "returnable|non-returnable", message = "must be returnable or non-returnable")
  private String palletType;

  @ExcelColumn(header = "PALLET_WEIGHT_KG")
  @Digits(integer = 3, fraction = 2, message = DECIMAL_5_2)
  private BigDecimal palletWeightKg;

  @ExcelColumn(header = "PALLET_LENGTH_MM")
  @Min(0)
  @Max(value = Short.MAX_VALUE, message = SMALLINT_MAX)
  private Integer palletLengthMm;

  @ExcelColumn(header = "PALLET_WIDTH_MM")
  @Min(0)
  @Max(value = Short.MAX_VALUE, message = SMALLINT_MAX)
  private Integer palletWidthMm;

  @ExcelColumn(header = "PALLET_HEIGHT_MM")
  @Min(0)
  @Max(value = Short.MAX_VALUE, message = SMALLINT_MAX)
  private Integer palletHeightMm;

  @ExcelColumn(header = "PALLET_VOL_M3")
  @DecimalMin("0")
  @Digits(integer = 3, fraction = 2, message = DECIMAL_5_2)
  private BigDecimal palletVolM3;

  @ExcelColumn(header = "PALLET_AREA_M2")
  @DecimalMin("0")
  @Digits(integer = 3, fraction = 2, message = DECIMAL_5_2)
  private BigDecimal palletAreaM2;

  @ExcelColumn(header = "PALLET_STACKING")
  @Min(0)
  @Max(value = Short.MAX_VALUE, message = SMALLINT_MAX)
  private Integer palletStacking;

  // model_data, workshop_data, line_data
  @ExcelColumn(header = "MODEL_CODE")
  @Pattern(regexp = "A01|A08|B02|B04|B06|B16", message = "is not a known model code")
  private String modelCode;

  @ExcelColumn(header = "MODEL_NAME")
  @Pattern(regexp = "Jolion|H3|F7|F7x|Dargo|H7", message = "is not a known model name")
  private String modelName;

  @ExcelColumn(header = "WORKSHOP_CODE")
  @Pattern(regexp = "AS|COMP|PAINT|WELD|STAMP|EN", message = "is not a known workshop code")
  private String workshopCode;

  @ExcelColumn(header = "WORKSHOP_NAME")
  @Pattern(
      regexp = "Assembly|Component|Painting|Welding|Stamping|Engine",
      message = "is not a known workshop name")
  private String workshopName;

  @ExcelColumn(header = "LINE_CODE")
  @Size(max = 10)
  private String lineCode;

  @ExcelColumn(header = "LINE_NAME")
  @Size(max = 50)
  private String lineName;

  // association tables
  @ExcelColumn(header = "PART_PER_BOX")
  @Min(0)
  private Integer partPerBox;

  @ExcelColumn(header = "BOX_PER_PALLET")
  @Min(0)
  @Max(value = Short.MAX_VALUE, message = SMALLINT_MAX)
  private Integer boxPerPallet;

  @ExcelColumn(header = "PART_PER_VEHICLE")
  @Min(0)
  @Max(value = Short.MAX_VALUE, message = SMALLINT_MAX)
  private Integer partPerVehicle;

  @ExcelColumn(header = "CONFIGURATION")
  @Size(max = 20)
  private String configuration;

  // breakpoint_data
  @ExcelColumn(header = "BREAKPOINT_NUMBER")
  @Size(max = 10)
  private String breakpointNumber;

  @ExcelColumn(header = "BREAKPOINT_DATE")
  private LocalDateTime breakpointDate;
}
