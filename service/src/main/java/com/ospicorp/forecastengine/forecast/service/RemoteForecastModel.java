package com.ospicorp.forecastengine.forecast.service;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.ospicorp.forecastengine.forecast.model.ForecastRequestRecord;
import com.ospicorp.forecastengine.forecast.model.QuantileForecast;
import com.ospicorp.forecastengine.metrics.model.SeriesRecord;
import com.ospicorp.forecastengine.metrics.service.TimestampParser;
import java.net.URI;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

/**
 * Predictor served by an external inference process. The history is posted in the request
 * record shape; the endpoint answers with one row per (item, step) carrying the mean and a
 * map of quantile level to value.
 */
public class RemoteForecastModel implements ForecastModel {

  private static final Logger log = LoggerFactory.getLogger(RemoteForecastModel.class);

  private final RestTemplate restTemplate;
  private final URI endpoint;
  private final int predictionLength;
  private final List<Double> quantileLevels;

  public RemoteForecastModel(RestTemplate restTemplate, URI endpoint, int predictionLength,
      List<Double> quantileLevels) {
    this.restTemplate = restTemplate;
    this.endpoint = endpoint;
    this.predictionLength = predictionLength;
    this.quantileLevels = List.copyOf(quantileLevels);
  }

  @Override
  public QuantileForecast predict(Map<String, List<SeriesRecord>> history, String modelName) {
    List<ForecastRequestRecord> data = new ArrayList<>();
    history.values().forEach(series -> series.forEach(r -> data.add(
        new ForecastRequestRecord(TimestampParser.format(r.timestamp()), r.value(), r.itemId()))));
    PredictRequest request = new PredictRequest(modelName, predictionLength, quantileLevels, data);

    RemoteRow[] response;
    try {
      response = restTemplate.postForObject(endpoint, request, RemoteRow[].class);
    } catch (RestClientException ex) {
      throw new PredictionException(
          "Inference endpoint " + endpoint + " failed: " + ex.getMessage(), ex);
    }
    if (response == null) {
      throw new PredictionException("Inference endpoint " + endpoint + " returned no body");
    }
    log.debug("Inference endpoint returned {} rows for {} series", response.length, history.size());
    return toForecast(response);
  }

  private QuantileForecast toForecast(RemoteRow[] response) {
    Set<String> columns = new LinkedHashSet<>();
    columns.add(QuantileForecast.MEAN);
    quantileLevels.forEach(level -> columns.add(QuantileForecast.quantileColumn(level)));

    List<QuantileForecast.Row> rows = new ArrayList<>(response.length);
    for (RemoteRow row : response) {
      if (row == null || row.itemId() == null || row.mean() == null) {
        throw new PredictionException("Inference endpoint returned an incomplete row: " + row);
      }
      LocalDateTime timestamp = TimestampParser.parse(row.timestamp())
          .orElseThrow(() -> new PredictionException(
              "Inference endpoint returned an unparseable timestamp: " + row.timestamp()));
      Map<String, Double> values = new LinkedHashMap<>();
      values.put(QuantileForecast.MEAN, row.mean());
      if (row.quantiles() != null) {
        row.quantiles().forEach((level, value) -> {
          columns.add(level);
          values.put(level, value);
        });
      }
      rows.add(new QuantileForecast.Row(row.itemId(), timestamp, values));
    }
    return new QuantileForecast(columns, rows);
  }

  record PredictRequest(
      String model,
      int predictionLength,
      List<Double> quantileLevels,
      List<ForecastRequestRecord> data
  ) {}

  @JsonIgnoreProperties(ignoreUnknown = true)
  record RemoteRow(
      @JsonProperty("item_id") String itemId,
      String timestamp,
      Double mean,
      Map<String, Double> quantiles
  ) {}
}
