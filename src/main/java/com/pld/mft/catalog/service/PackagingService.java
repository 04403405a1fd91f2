package com.pld.mft.catalog.service;

import static com.pld.mft.catalog.service.SchemaConstraints.decimal;
import static com.pld.mft.catalog.service.SchemaConstraints.requireKey;
import static com.pld.mft.catalog.service.SchemaConstraints.requireLength;
import static com.pld.mft.catalog.service.SchemaConstraints.requireNonNegative;

import com.pld.mft.catalog.domain.PackagingType;
import com.pld.mft.catalog.entity.PackagingUnit;
import java.util.function.Function;
import org.springframework.data.jpa.repository.JpaRepository;

/**
 * Rules shared by box_data and pallet_data: volume and area are non-negative, measures are
 * decimal(5,2), and a missing number is derived from packaging type and dimensions.
 */
public abstract class PackagingService<E extends PackagingUnit>
    extends ConstrainedTableService<E, String> {

  private final Function<E, String> idAccessor;

  protected PackagingService(
      JpaRepository<E, String> repository, String table, Function<E, String> idAccessor) {
    super(repository, table);
    this.idAccessor = idAccessor;
  }

  /**
   * "A 1200-800-150" for a disposable unit, "B ..." for a returnable one. Null unless the type and
   * all three dimensions are known.
   */
  public static String defaultNumber(
      PackagingType type, Number lengthMm, Number widthMm, Number heightMm) {
    if (type == null || lengthMm == null || widthMm == null || heightMm == null) {
      return null;
    }
    return "%s %d-%d-%d"
        .formatted(
            type.numberPrefix(), lengthMm.intValue(), widthMm.intValue(), heightMm.intValue());
  }

  @Override
  protected void applyDefaults(E row) {
    if (row.number() == null) {
      row.assignNumber(
          defaultNumber(row.packagingType(), row.lengthMm(), row.widthMm(), row.heightMm()));
    }
  }

  @Override
  protected String idOf(E row) {
    return idAccessor.apply(row);
  }

  @Override
  protected void checkKey(String id) {
    requireKey(table(), idColumn(), id);
  }

  @Override
  protected void enforceConstraints(E row) {
    String prefix = row.columnPrefix();
    String checkName = "chk_positive_" + prefix + "volume_area";
    requireLength(table(), prefix + "number", row.number(), 50);
    requireNonNegative(table(), prefix + "vol_m3", row.volM3(), checkName);
    requireNonNegative(table(), prefix + "area_m2", row.areaM2(), checkName);
    row.assignMeasures(
        decimal(table(), prefix + "weight_kg", row.weightKg(), 5, 2),
        decimal(table(), prefix + "vol_m3", row.volM3(), 5, 2),
        decimal(table(), prefix + "area_m2", row.areaM2(), 5, 2));
  }

  protected abstract String idColumn();
}
