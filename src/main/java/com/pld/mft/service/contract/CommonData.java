package com.pld.mft.service.contract;

/** Upload-wide values sent next to the workbook as the {@code commonData} part. */
public interface CommonData {

  /**
   * Uploader or batch reference. Logged with the import and used to name its temp directory, so
   * implementations must reject blank values.
   */
  String getCustomId();
}
