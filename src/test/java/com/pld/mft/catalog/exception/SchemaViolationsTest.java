package com.pld.mft.catalog.exception;

import static org.assertj.core.api.Assertions.assertThat;

import java.sql.SQLException;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataIntegrityViolationException;

class SchemaViolationsTest {

  @Test
  void translate_bySqlState() {
    assertThat(SchemaViolations.translate("part_data", violation("23505")))
        .isInstanceOf(UniquenessViolationException.class);
    assertThat(SchemaViolations.translate("part_data", violation("23503")))
        .isInstanceOf(ReferentialIntegrityViolationException.class);
    assertThat(SchemaViolations.translate("box_data", violation("23514")))
        .isInstanceOf(DomainViolationException.class);
  }

  @Test
  void translate_withoutSqlState_isDomainViolation() {
    DataIntegrityViolationException ex =
        new DataIntegrityViolationException("rejected", new IllegalStateException("no state"));

    SchemaViolationException result = SchemaViolations.translate("box_data", ex);

    assertThat(result).isInstanceOf(DomainViolationException.class);
    assertThat(result.getTable()).isEqualTo("box_data");
  }

  @Test
  void findSqlState_walksCauseChain() {
    Throwable nested = new RuntimeException(new RuntimeException(new SQLException("x", "23502")));

    assertThat(SchemaViolations.findSqlState(nested)).isEqualTo("23502");
  }

  private DataIntegrityViolationException violation(String sqlState) {
    return new DataIntegrityViolationException(
        "rejected", new SQLException("constraint violated", sqlState));
  }
}
