package com.ospicorp.forecastengine.forecast.service;

import com.ospicorp.forecastengine.forecast.model.ForecastRequestRecord;
import com.ospicorp.forecastengine.forecast.model.ForecastResultRow;
import com.ospicorp.forecastengine.metrics.model.SeriesRecord;
import com.ospicorp.forecastengine.metrics.service.TimestampParser;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Service;

@Service
@Profile("!extract")
public class ForecastService {

  private static final Map<String, String> JSON_NAMES = Map.of("itemId", "item_id");

  private final ForecastAdapter adapter;
  private final ResponseShaper shaper;
  private final Validator validator;

  public ForecastService(ForecastAdapter adapter, ResponseShaper shaper, Validator validator) {
    this.adapter = adapter;
    this.shaper = shaper;
    this.validator = validator;
  }

  /**
   * Validates the submitted history, forecasts it and shapes the result.
   *
   * @throws RequestValidationException if a record is missing a field or has a bad timestamp
   * @throws PredictionException if the predictor fails
   * @throws QuantileConfigurationException if the forecast lacks the bound columns
   */
  public List<ForecastResultRow> forecast(List<ForecastRequestRecord> records) {
    List<SeriesRecord> history = toHistory(records);
    return adapter.predict(history).fold(shaper::shape, error -> {
      throw error;
    });
  }

  List<SeriesRecord> toHistory(List<ForecastRequestRecord> records) {
    if (records == null || records.isEmpty()) {
      throw new RequestValidationException("Request must contain at least one record.",
          RequestValidationException.EMPTY_PAYLOAD);
    }
    List<SeriesRecord> history = new ArrayList<>(records.size());
    for (int i = 0; i < records.size(); i++) {
      ForecastRequestRecord record = records.get(i);
      if (record == null) {
        throw new RequestValidationException("records[" + i + "] must not be null.",
            RequestValidationException.MISSING_FIELD);
      }
      Set<ConstraintViolation<ForecastRequestRecord>> violations = validator.validate(record);
      if (!violations.isEmpty()) {
        ConstraintViolation<ForecastRequestRecord> first = violations.stream()
            .min(Comparator.comparing(v -> v.getPropertyPath().toString()))
            .orElseThrow();
        String field = first.getPropertyPath().toString();
        throw new RequestValidationException(
            "records[" + i + "]." + JSON_NAMES.getOrDefault(field, field) + " "
                + first.getMessage() + ".",
            RequestValidationException.MISSING_FIELD);
      }
      Optional<LocalDateTime> timestamp = TimestampParser.parse(record.timestamp());
      if (timestamp.isEmpty()) {
        throw new RequestValidationException("records[" + i + "].timestamp is not a valid datetime: '"
            + record.timestamp() + "'.", RequestValidationException.INVALID_TIMESTAMP);
      }
      history.add(new SeriesRecord(timestamp.get(), record.itemId(), record.value()));
    }
    return history;
  }
}
