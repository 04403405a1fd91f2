package com.pld.mft.service.contract;

import java.util.List;

/** Writes rows that passed every check. Implementations run in one transaction. */
public interface PersistenceHandler<T, C extends CommonData> {

  SaveResult saveAll(List<T> rows, List<Integer> sourceRowNumbers, C commonData);

  record SaveResult(int created, int updated) {}
}
