package com.ospicorp.forecastengine.metrics.model;

import java.time.LocalDateTime;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

// Cleaned row: timestamp parsed, every tracked metric present and finite, metrics in tracked order.
public record Observation(LocalDateTime timestamp, String entity, Map<String, Double> metrics) {

  public Observation {
    metrics = Collections.unmodifiableMap(new LinkedHashMap<>(metrics));
  }
}
