package com.ospicorp.forecastengine.forecast.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

@JsonPropertyOrder({"item_id", "timestamp", "prediction", "lowerBound", "upperBound"})
public record ForecastResultRow(
    @JsonProperty("item_id") String itemId,
    String timestamp,
    double prediction,
    double lowerBound,
    double upperBound
) {}
