package com.ospicorp.forecastengine.forecast.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.ospicorp.forecastengine.forecast.model.ForecastResultRow;
import com.ospicorp.forecastengine.forecast.model.QuantileForecast;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ResponseShaperTest {

  private static final LocalDateTime T1 = LocalDateTime.of(2024, 1, 1, 10, 5);

  private final ResponseShaper shaper = new ResponseShaper();

  @Test
  void mapsMeanAndOuterQuantilesToContract() {
    QuantileForecast forecast = forecast(List.of("mean", "0.025", "0.1", "0.975"),
        Map.of("mean", 15.0, "0.025", 10.0, "0.1", 12.0, "0.975", 20.0));

    List<ForecastResultRow> rows = shaper.shape(forecast);

    assertThat(rows).containsExactly(
        new ForecastResultRow("nodeA_cpu", "2024-01-01T10:05:00", 15.0, 10.0, 20.0));
  }

  @Test
  void missingBoundColumnIsConfigurationError() {
    QuantileForecast forecast = forecast(List.of("mean", "0.1", "0.9"),
        Map.of("mean", 15.0, "0.1", 12.0, "0.9", 18.0));

    assertThatThrownBy(() -> shaper.shape(forecast))
        .isInstanceOf(QuantileConfigurationException.class)
        .hasMessageContaining("0.025")
        .hasMessageContaining("0.975");
  }

  @Test
  void undefinedValueIsConfigurationError() {
    QuantileForecast forecast = forecast(List.of("mean", "0.025", "0.975"),
        Map.of("mean", 15.0, "0.025", Double.NaN, "0.975", 20.0));

    assertThatThrownBy(() -> shaper.shape(forecast))
        .isInstanceOf(QuantileConfigurationException.class);
  }

  @Test
  void emptyForecastShapesToEmptyList() {
    QuantileForecast forecast = new QuantileForecast(
        new LinkedHashSet<>(List.of("mean", "0.025", "0.975")), List.of());

    assertThat(shaper.shape(forecast)).isEmpty();
  }

  @Test
  void requiredColumnsUseCanonicalLevelNames() {
    assertThat(ResponseShaper.LOWER_COLUMN).isEqualTo("0.025");
    assertThat(ResponseShaper.UPPER_COLUMN).isEqualTo("0.975");
  }

  private static QuantileForecast forecast(List<String> columns, Map<String, Double> values) {
    return new QuantileForecast(new LinkedHashSet<>(columns), List.of(
        new QuantileForecast.Row("nodeA_cpu", T1, new LinkedHashMap<>(values))));
  }
}
