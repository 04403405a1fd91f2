package com.pld.mft.catalog.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.pld.mft.catalog.domain.PackagingType;
import com.pld.mft.catalog.exception.DomainViolationException;
import java.math.BigDecimal;
import org.junit.jupiter.api.Test;

class SchemaConstraintsTest {

  @Test
  void requireKey_rejectsBlankAndOverlong() {
    assertThatThrownBy(() -> SchemaConstraints.requireKey("part_data", "part_id", " "))
        .isInstanceOf(DomainViolationException.class);
    assertThatThrownBy(() -> SchemaConstraints.requireKey("part_data", "part_id", "PRT_123456789"))
        .isInstanceOf(DomainViolationException.class)
        .hasMessageContaining("varchar(12)");
    assertThatCode(() -> SchemaConstraints.requireKey("part_data", "part_id", "PRT_12345678"))
        .doesNotThrowAnyException();
  }

  @Test
  void decimal_roundsHalfUpToScale() {
    assertThat(SchemaConstraints.decimal("t", "c", new BigDecimal("1.005"), 5, 2))
        .isEqualByComparingTo("1.01");
    assertThat(SchemaConstraints.decimal("t", "c", new BigDecimal("999.994"), 5, 2))
        .isEqualByComparingTo("999.99");
  }

  @Test
  void decimal_overflowAfterRounding_isDomainViolation() {
    assertThatThrownBy(
            () -> SchemaConstraints.decimal("box_data", "vol", new BigDecimal("999.995"), 5, 2))
        .isInstanceOf(DomainViolationException.class)
        .hasMessageContaining("decimal(5,2)");
    assertThatThrownBy(
            () -> SchemaConstraints.decimal("box_data", "vol", new BigDecimal("1000"), 5, 2))
        .isInstanceOf(DomainViolationException.class);
  }

  @Test
  void smallint_range() {
    assertThat(SchemaConstraints.smallint("t", "c", 32767)).isEqualTo((short) 32767);
    assertThat(SchemaConstraints.smallint("t", "c", null)).isNull();
    assertThatThrownBy(() -> SchemaConstraints.smallint("t", "c", 32768))
        .isInstanceOf(DomainViolationException.class)
        .hasMessageContaining("smallint");
  }

  @Test
  void requireNonNegative_rejectsNegativeOnly() {
    assertThatCode(
            () -> SchemaConstraints.requireNonNegative("t", "c", BigDecimal.ZERO, "chk"))
        .doesNotThrowAnyException();
    assertThatThrownBy(
            () -> SchemaConstraints.requireNonNegative("t", "c", new BigDecimal("-0.01"), "chk"))
        .isInstanceOf(DomainViolationException.class)
        .hasMessageContaining("chk");
  }

  @Test
  void defaultNumber_needsTypeAndAllDimensions() {
    assertThat(PackagingService.defaultNumber(PackagingType.NON_RETURNABLE, 1200, 800, 150))
        .isEqualTo("A 1200-800-150");
    assertThat(PackagingService.defaultNumber(PackagingType.RETURNABLE, 600, 400, 300))
        .isEqualTo("B 600-400-300");
    assertThat(PackagingService.defaultNumber(PackagingType.RETURNABLE, 600, null, 300)).isNull();
    assertThat(PackagingService.defaultNumber(null, 600, 400, 300)).isNull();
  }
}
