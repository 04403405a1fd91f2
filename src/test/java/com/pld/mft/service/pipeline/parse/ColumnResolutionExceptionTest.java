package com.pld.mft.service.pipeline.parse;

import static org.assertj.core.api.Assertions.assertThat;

import com.pld.mft.annotation.HeaderMatchMode;
import java.util.List;
import org.junit.jupiter.api.Test;

class ColumnResolutionExceptionTest {

  @Test
  void toUserMessage_headerMismatch_namesBothHeaders() {
    var ex =
        new ColumnResolutionException(
            "partNumber", "PART_NUMBER", "PART_NO", "B", HeaderMatchMode.EXACT);

    assertThat(ex.toUserMessage())
        .isEqualTo("Column B has header 'PART_NO', expected 'PART_NUMBER'");
    assertThat(ex.getMessage()).contains("partNumber");
  }

  @Test
  void toUserMessage_emptyHeader() {
    var ex =
        new ColumnResolutionException("partNumber", "PART_NUMBER", " ", "B", HeaderMatchMode.EXACT);

    assertThat(ex.toUserMessage()).isEqualTo("Column B has no header, expected 'PART_NUMBER'");
  }

  @Test
  void toUserMessage_notFound_leavesOutFieldName() {
    var ex =
        new ColumnResolutionException(
            "partNumber", "PART_NUMBER", null, null, HeaderMatchMode.EXACT);

    assertThat(ex.toUserMessage())
        .isEqualTo("Required column 'PART_NUMBER' not found")
        .doesNotContain("partNumber");
  }

  @Test
  void batchException_oneLinePerColumn() {
    var ex1 = new ColumnResolutionException("a", "PART_NUMBER", null, null, HeaderMatchMode.EXACT);
    var ex2 = new ColumnResolutionException("b", "MODEL_CODE", "MODEL", "C", HeaderMatchMode.EXACT);

    var batch = new ColumnResolutionBatchException(List.of(ex1, ex2));

    assertThat(batch.toUserMessage().split("\n"))
        .containsExactly(
            "Required column 'PART_NUMBER' not found",
            "Column C has header 'MODEL', expected 'MODEL_CODE'");
    assertThat(batch.getMessage()).contains("2 field(s)");
    assertThat(batch.getExceptions()).isUnmodifiable();
  }
}
