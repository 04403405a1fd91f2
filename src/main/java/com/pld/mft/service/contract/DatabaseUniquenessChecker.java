package com.pld.mft.service.contract;

import com.pld.mft.validation.RowError;
import java.util.List;

/** Row checks that need stored data. Runs after Bean Validation, before anything is written. */
public interface DatabaseUniquenessChecker<T, C extends CommonData> {

  List<RowError> check(
      List<T> rows, Class<T> dtoClass, List<Integer> sourceRowNumbers, C commonData);
}
