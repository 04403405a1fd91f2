package com.pld.mft.catalog.entity;

import com.pld.mft.catalog.domain.PackagingType;
import java.math.BigDecimal;

/**
 * Shape shared by {@link Box} and {@link Pallet}. The two tables carry the same columns under a
 * different prefix, so constraint checks and number generation are written once against this view.
 */
public interface PackagingUnit {

  /** Column name prefix, "box_" or "pallet_". */
  String columnPrefix();

  String number();

  void assignNumber(String number);

  PackagingType packagingType();

  Short lengthMm();

  Short widthMm();

  Short heightMm();

  BigDecimal weightKg();

  BigDecimal volM3();

  BigDecimal areaM2();

  void assignMeasures(BigDecimal weightKg, BigDecimal volM3, BigDecimal areaM2);
}
