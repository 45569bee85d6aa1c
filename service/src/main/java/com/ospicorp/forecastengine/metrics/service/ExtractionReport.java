package com.ospicorp.forecastengine.metrics.service;

import java.nio.file.Path;
import java.util.Optional;

public record ExtractionReport(
    int fetchedRows,
    int normalizedRows,
    int resampledPoints,
    int seriesRecords,
    Optional<Path> output
) {

  public static ExtractionReport empty() {
    return new ExtractionReport(0, 0, 0, 0, Optional.empty());
  }

  public boolean written() {
    return output.isPresent();
  }
}
