package com.pld.mft.service.contract;

/** Rewrites a parsed row in place before it is validated. */
@FunctionalInterface
public interface RowNormalizer<T> {

  void normalize(T row);
}
