package com.ospicorp.forecastengine.metrics.service;

import com.ospicorp.forecastengine.metrics.model.Observation;
import com.ospicorp.forecastengine.metrics.model.ResampledPoint;
import java.time.Duration;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Buckets observations into fixed-width, half-open intervals {@code [start, start + width)}
 * aligned to the epoch and averages every metric per (entity, interval). Empty intervals emit
 * nothing. Output is ordered by entity, then interval, then metric in tracked order.
 */
public final class Resampler {

  public static final Duration DEFAULT_INTERVAL = Duration.ofMinutes(5);

  private static final long MILLIS_PER_DAY = Duration.ofDays(1).toMillis();

  private Resampler() {
  }

  public static List<ResampledPoint> resample(List<Observation> in, Duration interval) {
    long width = validateInterval(interval);
    if (in.isEmpty()) {
      return List.of();
    }

    Map<String, TreeMap<LocalDateTime, Map<String, Mean>>> buckets = new TreeMap<>();
    for (Observation o : in) {
      LocalDateTime start = bucketStart(o.timestamp(), width);
      Map<String, Mean> means = buckets
          .computeIfAbsent(o.entity(), k -> new TreeMap<>())
          .computeIfAbsent(start, k -> new LinkedHashMap<>());
      o.metrics().forEach((metric, value) ->
          means.computeIfAbsent(metric, k -> new Mean()).add(value));
    }

    List<ResampledPoint> out = new ArrayList<>();
    buckets.forEach((entity, intervals) ->
        intervals.forEach((start, means) ->
            means.forEach((metric, mean) ->
                out.add(new ResampledPoint(start, entity, metric, mean.value())))));
    return out;
  }

  public static LocalDateTime bucketStart(LocalDateTime timestamp, Duration interval) {
    return bucketStart(timestamp, validateInterval(interval));
  }

  private static LocalDateTime bucketStart(LocalDateTime timestamp, long widthMillis) {
    long epochMillis = timestamp.toInstant(ZoneOffset.UTC).toEpochMilli();
    long floored = Math.floorDiv(epochMillis, widthMillis) * widthMillis;
    return LocalDateTime.ofEpochSecond(Math.floorDiv(floored, 1000L),
        (int) Math.floorMod(floored, 1000L) * 1_000_000, ZoneOffset.UTC);
  }

  // Widths must tile a day so every day's buckets start on the same wall-clock boundaries.
  private static long validateInterval(Duration interval) {
    if (interval == null || interval.isNegative() || interval.isZero()) {
      throw new IllegalArgumentException("resampling interval must be positive");
    }
    long width = interval.toMillis();
    if (width == 0 || MILLIS_PER_DAY % width != 0) {
      throw new IllegalArgumentException(
          "resampling interval must divide one day evenly: " + interval);
    }
    return width;
  }

  private static final class Mean {
    private double sum;
    private long count;

    void add(double value) {
      sum += value;
      count++;
    }

    double value() {
      return sum / count;
    }
  }
}
