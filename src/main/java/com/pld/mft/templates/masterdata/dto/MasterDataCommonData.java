package com.pld.mft.templates.masterdata.dto;

import com.pld.mft.service.contract.CommonData;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Getter
@Setter
@NoArgsConstructor
public class MasterDataCommonData implements CommonData {

  @NotBlank(message = "customId is required")
  @Size(max = 35, message = "customId must be at most 35 characters")
  private String customId;
}
