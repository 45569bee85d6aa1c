package com.ospicorp.forecastengine.forecast.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

import com.ospicorp.forecastengine.forecast.model.QuantileForecast;
import java.net.URI;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

class RemoteForecastModelTest {

  private static final URI ENDPOINT = URI.create("http://inference:9000/predict");

  private MockRestServiceServer server;
  private RemoteForecastModel model;

  @BeforeEach
  void setUp() {
    RestTemplate restTemplate = new RestTemplate();
    server = MockRestServiceServer.bindTo(restTemplate).build();
    model = new RemoteForecastModel(restTemplate, ENDPOINT, 1, List.of(0.025, 0.975));
  }

  @Test
  void postsHistoryAndReadsQuantileRows() {
    server.expect(requestTo(ENDPOINT))
        .andExpect(method(HttpMethod.POST))
        .andExpect(jsonPath("$.model").value("AutoETS"))
        .andExpect(jsonPath("$.predictionLength").value(1))
        .andExpect(jsonPath("$.data[0].item_id").value("nodeA_cpu"))
        .andExpect(jsonPath("$.data[1].timestamp").value("2024-01-01T10:05:00"))
        .andRespond(withSuccess("""
            [{"item_id": "nodeA_cpu", "timestamp": "2024-01-01T10:10:00", "mean": 15.0,
              "quantiles": {"0.025": 10.0, "0.975": 20.0}, "model_version": "7"}]
            """, MediaType.APPLICATION_JSON));

    QuantileForecast forecast = model.predict(
        Map.of("nodeA_cpu", LocalForecastModelTest.series("nodeA_cpu", 14, 16)), "AutoETS");

    server.verify();
    assertThat(forecast.columns()).containsExactly("mean", "0.025", "0.975");
    assertThat(forecast.rows()).singleElement().satisfies(row -> {
      assertThat(row.itemId()).isEqualTo("nodeA_cpu");
      assertThat(row.value("0.975")).isEqualTo(20.0);
    });
  }

  @Test
  void serverErrorIsPredictionFailure() {
    server.expect(requestTo(ENDPOINT)).andRespond(withServerError());

    assertThatThrownBy(() -> model.predict(
        Map.of("nodeA_cpu", LocalForecastModelTest.series("nodeA_cpu", 1, 2)), "AutoETS"))
        .isInstanceOf(PredictionException.class)
        .hasMessageContaining(ENDPOINT.toString());
  }

  @Test
  void incompleteRowIsPredictionFailure() {
    server.expect(requestTo(ENDPOINT))
        .andRespond(withSuccess("[{\"item_id\": \"nodeA_cpu\", \"timestamp\": \"2024-01-01T10:10:00\"}]",
            MediaType.APPLICATION_JSON));

    assertThatThrownBy(() -> model.predict(
        Map.of("nodeA_cpu", LocalForecastModelTest.series("nodeA_cpu", 1, 2)), "AutoETS"))
        .isInstanceOf(PredictionException.class)
        .hasMessageContaining("incomplete");
  }
}
