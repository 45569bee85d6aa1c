package com.ospicorp.forecastengine.metrics.model;

import java.util.List;

public record NormalizationResult(
    List<Observation> observations,
    int inputRows,
    int droppedInvalidTimestamp,
    int droppedInvalidEntity,
    int droppedInvalidMetric
) {

  public NormalizationResult {
    observations = List.copyOf(observations);
  }

  public int droppedRows() {
    return droppedInvalidTimestamp + droppedInvalidEntity + droppedInvalidMetric;
  }
}
