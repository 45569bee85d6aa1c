package com.ospicorp.forecastengine.forecast.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

@JsonPropertyOrder({"timestamp", "value", "item_id"})
public record ForecastRequestRecord(
    @NotBlank
    @Schema(description = "Observation time", example = "2024-01-01T00:05:00")
    String timestamp,

    @NotNull
    @JsonAlias("Value")
    @Schema(description = "Observed value", example = "42.5")
    Double value,

    @NotBlank
    @JsonProperty("item_id")
    @Schema(description = "Series identifier (entity_metric)", example = "nodeA_cpu")
    String itemId
) {}
