package com.pld.mft.catalog.domain;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

import com.pld.mft.catalog.exception.DomainViolationException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class DbEnumsTest {

  @ParameterizedTest
  @CsvSource({"Jolion, JOLION", "F7x, F7X", "Dargo, DARGO"})
  void fromValue_matchesStoredValue(String value, ModelName expected) {
    assertThat(ModelName.fromValue(value)).isEqualTo(expected);
  }

  @Test
  void fromValue_hyphenatedValue() {
    assertThat(PackagingType.fromValue("non-returnable")).isEqualTo(PackagingType.NON_RETURNABLE);
  }

  @Test
  void fromValue_null_staysNull() {
    assertThat(ModelCode.fromValue(null)).isNull();
  }

  @Test
  void fromValue_isCaseSensitive() {
    assertThatThrownBy(() -> ModelName.fromValue("F7X"))
        .isInstanceOf(DomainViolationException.class)
        .hasMessageContaining("model_names")
        .hasMessageContaining("F7x");
  }

  @Test
  void fromValue_unknownCode_listsAllowedValues() {
    assertThatThrownBy(() -> ModelCode.fromValue("Z99"))
        .isInstanceOf(DomainViolationException.class)
        .hasMessageContaining("Z99")
        .hasMessageContaining("A01, A08, B02, B04, B06, B16");
  }

  @Test
  void fromValue_withColumn_reportsTableAndColumn() {
    DomainViolationException e =
        catchThrowableOfType(
            () -> WorkshopName.fromValue("Paint shop", "workshop_data", "workshop_name"),
            DomainViolationException.class);

    assertThat(e.getTable()).isEqualTo("workshop_data");
    assertThat(e.getColumn()).isEqualTo("workshop_name");
    assertThat(e.getRejectedValue()).isEqualTo("Paint shop");
    assertThat(e.getMessage()).contains("workshop_names");
  }

  @Test
  void find_unknownValue_isEmpty() {
    assertThat(DbEnums.find(WorkshopCode.class, "PAINT")).contains(WorkshopCode.PAINT);
    assertThat(DbEnums.find(WorkshopCode.class, "paint")).isEmpty();
    assertThat(DbEnums.find(WorkshopCode.class, null)).isEmpty();
  }

  @Test
  void numberPrefix_byPackagingType() {
    assertThat(PackagingType.NON_RETURNABLE.numberPrefix()).isEqualTo("A");
    assertThat(PackagingType.RETURNABLE.numberPrefix()).isEqualTo("B");
  }
}
