package com.ospicorp.forecastengine.forecast.service;

import com.ospicorp.forecastengine.metrics.model.SeriesRecord;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Service;

/**
 * Hands history to the loaded predictor. Items keep their first-appearance order and each
 * series is sorted by timestamp. Any failure fails the whole batch; nothing is retried.
 */
@Service
@Profile("!extract")
public class ForecastAdapter {

  private static final Logger log = LoggerFactory.getLogger(ForecastAdapter.class);

  private final ForecastServiceContext context;

  public ForecastAdapter(ForecastServiceContext context) {
    this.context = context;
  }

  public PredictionResult predict(List<SeriesRecord> history) {
    return predict(history, context.modelName());
  }

  public PredictionResult predict(List<SeriesRecord> history, String modelName) {
    Map<String, List<SeriesRecord>> grouped = group(history);
    try {
      var forecast = context.model().predict(grouped, modelName);
      log.debug("Model {} forecast {} rows for {} series", modelName, forecast.rows().size(),
          grouped.size());
      return PredictionResult.success(forecast);
    } catch (PredictionException ex) {
      return PredictionResult.failure(ex);
    } catch (RuntimeException ex) {
      return PredictionResult.failure(
          new PredictionException("Predictor fault: " + describe(ex), ex));
    }
  }

  static Map<String, List<SeriesRecord>> group(List<SeriesRecord> history) {
    Map<String, List<SeriesRecord>> grouped = new LinkedHashMap<>();
    for (SeriesRecord record : history) {
      grouped.computeIfAbsent(record.itemId(), k -> new ArrayList<>()).add(record);
    }
    grouped.values().forEach(series -> series.sort(Comparator.comparing(SeriesRecord::timestamp)));
    return grouped;
  }

  private static String describe(Exception ex) {
    String message = ex.getMessage();
    return message == null || message.isBlank() ? ex.getClass().getName() : message;
  }
}
