package com.pld.mft.templates.masterdata.service;

import static org.assertj.core.api.Assertions.assertThat;

import com.pld.mft.templates.masterdata.dto.MasterDataRowDto;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class MasterDataTextCleanerTest {

  @ParameterizedTest
  @CsvSource(
      delimiter = '|',
      value = {
        "ACME-steelWorks/2 | Acme Steel Works 2",
        "  bolt   M8x40 | Bolt M 8 X 40",
        "front_bumper.v2 | Front Bumper V 2",
        "Rear bracket | Rear Bracket",
        "Ölfilter | Ölfilter"
      })
  void clean(String raw, String expected) {
    assertThat(MasterDataTextCleaner.clean(raw)).isEqualTo(expected);
  }

  @Test
  void clean_nothingLeft_givesNull() {
    assertThat(MasterDataTextCleaner.clean(null)).isNull();
    assertThat(MasterDataTextCleaner.clean("   ")).isNull();
    assertThat(MasterDataTextCleaner.clean("--/--")).isNull();
  }

  @Test
  void normalize_touchesOnlySupplierAndPartNames() {
    MasterDataRowDto row = new MasterDataRowDto();
    row.setSupplierName("acme  STEEL");
    row.setPartName("hinge_left");
    row.setPartNumber("p-100");
    row.setLineName("line one");

    new MasterDataTextCleaner().normalize(row);

    assertThat(row.getSupplierName()).isEqualTo("Acme Steel");
    assertThat(row.getPartName()).isEqualTo("Hinge Left");
    assertThat(row.getPartNumber()).isEqualTo("p-100");
    assertThat(row.getLineName()).isEqualTo("line one");
  }
}
