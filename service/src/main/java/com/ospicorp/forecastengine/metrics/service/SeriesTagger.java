package com.ospicorp.forecastengine.metrics.service;

import com.ospicorp.forecastengine.metrics.model.MetricDefinition;
import com.ospicorp.forecastengine.metrics.model.ResampledPoint;
import com.ospicorp.forecastengine.metrics.model.SeriesRecord;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.springframework.util.StringUtils;

/**
 * Flattens resampled points into the long-form series table, one block per tracked metric in
 * configured order. Rows with an undefined value are dropped.
 */
public class SeriesTagger {

  public static final char SEPARATOR = '_';

  private final List<MetricDefinition> metrics;

  public SeriesTagger(List<MetricDefinition> metrics) {
    if (metrics == null || metrics.isEmpty()) {
      throw new IllegalArgumentException("at least one metric must be tracked");
    }
    Set<String> suffixes = new HashSet<>();
    for (MetricDefinition metric : metrics) {
      if (!StringUtils.hasText(metric.suffix()) || metric.suffix().indexOf(SEPARATOR) >= 0) {
        throw new IllegalArgumentException(
            "metric suffix must be non-blank and free of '" + SEPARATOR + "': " + metric.suffix());
      }
      if (!suffixes.add(metric.suffix())) {
        throw new IllegalArgumentException("duplicate metric suffix: " + metric.suffix());
      }
    }
    this.metrics = List.copyOf(metrics);
  }

  public static String itemId(String entity, String suffix) {
    return entity + SEPARATOR + suffix;
  }

  public List<SeriesRecord> tag(List<ResampledPoint> points) {
    List<SeriesRecord> out = new ArrayList<>(points.size());
    for (MetricDefinition metric : metrics) {
      for (ResampledPoint p : points) {
        if (!metric.column().equals(p.metric()) || Double.isNaN(p.value())) {
          continue;
        }
        out.add(new SeriesRecord(p.intervalStart(), itemId(p.entity(), metric.suffix()), p.value()));
      }
    }
    return out;
  }
}
