package com.pld.mft.service.pipeline.parse;

import java.util.List;
import java.util.stream.Collectors;
import lombok.Getter;

/** Every column that failed to resolve for one upload, reported together. */
@Getter
public class ColumnResolutionBatchException extends RuntimeException {

  private final List<ColumnResolutionException> exceptions;

  public ColumnResolutionBatchException(List<ColumnResolutionException> exceptions) {
    super("Column resolution failed for %d field(s)".formatted(exceptions.size()));
    this.exceptions = List.copyOf(exceptions);
  }

  /** One line per failed column. */
  public String toUserMessage() {
    return exceptions.stream()
        .map(ColumnResolutionException::toUserMessage)
        .collect(Collectors.joining("\n"));
  }
}
