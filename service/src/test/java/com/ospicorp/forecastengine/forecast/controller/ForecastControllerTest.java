package com.ospicorp.forecastengine.forecast.controller;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
class ForecastControllerTest {

  private static final String HISTORY = """
      [
        {"timestamp": "2024-01-01T10:00:00", "value": 10.0, "item_id": "nodeA_cpu"},
        {"timestamp": "2024-01-01T10:05:00", "value": 12.0, "item_id": "nodeA_cpu"},
        {"timestamp": "2024-01-01T10:10:00", "value": 11.0, "item_id": "nodeA_cpu"},
        {"timestamp": "2024-01-01 10:00:00", "Value": 40.0, "item_id": "nodeA_memory"},
        {"timestamp": "2024-01-01 10:05:00", "Value": 44.0, "item_id": "nodeA_memory"}
      ]
      """;

  @Autowired
  private TestRestTemplate rest;

  @Test
  void predictReturnsBoundedRowsPerItemAndStep() {
    ResponseEntity<List<Map<String, Object>>> response = rest.exchange("/predict",
        HttpMethod.POST, json(HISTORY), new ParameterizedTypeReference<>() {});

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
    List<Map<String, Object>> rows = response.getBody();
    assertThat(rows).hasSize(6);
    assertThat(rows.get(0)).containsOnlyKeys(
        "item_id", "timestamp", "prediction", "lowerBound", "upperBound");
    assertThat(rows.get(0)).containsEntry("item_id", "nodeA_cpu")
        .containsEntry("timestamp", "2024-01-01T10:15:00");
    assertThat(rows.get(3)).containsEntry("item_id", "nodeA_memory")
        .containsEntry("timestamp", "2024-01-01T10:10:00");
    assertThat(rows).allSatisfy(row -> {
      double prediction = ((Number) row.get("prediction")).doubleValue();
      assertThat(((Number) row.get("lowerBound")).doubleValue()).isLessThanOrEqualTo(prediction);
      assertThat(((Number) row.get("upperBound")).doubleValue()).isGreaterThanOrEqualTo(prediction);
    });
  }

  @Test
  void twoPointHistoryIsEnough() {
    ResponseEntity<List<Map<String, Object>>> response = rest.exchange("/predict",
        HttpMethod.POST, json("""
            [
              {"timestamp": "2024-01-01T00:00", "value": 1.0, "item_id": "nodeA_cpu"},
              {"timestamp": "2024-01-01T00:05", "value": 2.0, "item_id": "nodeA_cpu"}
            ]
            """), new ParameterizedTypeReference<>() {});

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
    assertThat(response.getBody()).isNotEmpty().allSatisfy(row -> {
      assertThat(row).containsEntry("item_id", "nodeA_cpu");
      double prediction = ((Number) row.get("prediction")).doubleValue();
      assertThat(((Number) row.get("lowerBound")).doubleValue()).isLessThanOrEqualTo(prediction);
      assertThat(((Number) row.get("upperBound")).doubleValue()).isGreaterThanOrEqualTo(prediction);
    });
  }

  @Test
  void predictCanAnswerAsCsv() {
    HttpHeaders headers = new HttpHeaders();
    headers.setContentType(MediaType.APPLICATION_JSON);
    headers.setAccept(List.of(MediaType.valueOf("text/csv")));

    ResponseEntity<String> response = rest.exchange("/predict", HttpMethod.POST,
        new HttpEntity<>(HISTORY, headers), String.class);

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
    assertThat(response.getHeaders().getContentType().toString()).startsWith("text/csv");
    assertThat(response.getBody().lines().toList())
        .hasSize(7)
        .first().isEqualTo("item_id,timestamp,prediction,lowerBound,upperBound");
  }

  @Test
  void emptyPayloadIsBadRequest() {
    Map<String, Object> body = expectBadRequest("[]");

    assertThat(body).containsEntry("errorCode", 2004)
        .containsEntry("path", "/predict")
        .containsEntry("moreInfo", "https://docs.forecast-engine.dev/errors/2004");
  }

  @Test
  void missingItemIdIsBadRequest() {
    Map<String, Object> body = expectBadRequest("""
        [{"timestamp": "2024-01-01T10:00:00", "value": 1.0}]
        """);

    assertThat(body).containsEntry("errorCode", 2002);
    assertThat((String) body.get("error")).startsWith("records[0].item_id");
  }

  @Test
  void invalidTimestampIsBadRequest() {
    Map<String, Object> body = expectBadRequest("""
        [{"timestamp": "31/01/2024", "value": 1.0, "item_id": "nodeA_cpu"}]
        """);

    assertThat(body).containsEntry("errorCode", 2003);
  }

  @Test
  void malformedJsonIsBadRequest() {
    Map<String, Object> body = expectBadRequest("[{\"timestamp\": ");

    assertThat(body).containsEntry("errorCode", 2001);
  }

  @Test
  void unknownFieldIsBadRequest() {
    Map<String, Object> body = expectBadRequest("""
        [{"timestamp": "2024-01-01T10:00:00", "value": 1.0, "item_id": "a_cpu", "unit": "%"}]
        """);

    assertThat(body).containsEntry("errorCode", 2001);
    assertThat((String) body.get("error")).contains("'unit'");
  }

  @Test
  void numericStringValueIsBadRequest() {
    Map<String, Object> body = expectBadRequest("""
        [{"timestamp": "2024-01-01T10:00:00", "value": "12", "item_id": "a_cpu"}]
        """);

    assertThat(body).containsEntry("errorCode", 2001);
    assertThat((String) body.get("error")).contains("records[0].value");
  }

  @Test
  void objectInsteadOfArrayIsBadRequest() {
    Map<String, Object> body = expectBadRequest("""
        {"timestamp": "2024-01-01T10:00:00", "value": 1.0, "item_id": "a_cpu"}
        """);

    assertThat(body).containsEntry("errorCode", 2001);
  }

  @Test
  void singlePointHistoryIsGenericServerError() {
    ResponseEntity<Map<String, Object>> response = rest.exchange("/predict", HttpMethod.POST,
        json("[{\"timestamp\": \"2024-01-01T10:00:00\", \"value\": 1.0, \"item_id\": \"a_cpu\"}]"),
        new ParameterizedTypeReference<>() {});

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
    assertThat(response.getBody())
        .containsExactly(Map.entry("error", "Prediction failed due to an internal error."));
  }

  @Test
  void overflowingForecastIsGenericServerError() {
    ResponseEntity<Map<String, Object>> response = rest.exchange("/predict", HttpMethod.POST,
        json("""
            [
              {"timestamp": "2024-01-01T10:00:00", "value": 1e200, "item_id": "a_cpu"},
              {"timestamp": "2024-01-01T10:05:00", "value": -1e200, "item_id": "a_cpu"}
            ]
            """), new ParameterizedTypeReference<>() {});

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
    assertThat(response.getBody())
        .containsExactly(Map.entry("error", "Prediction failed due to an internal error."));
  }

  private Map<String, Object> expectBadRequest(String payload) {
    ResponseEntity<Map<String, Object>> response = rest.exchange("/predict", HttpMethod.POST,
        json(payload), new ParameterizedTypeReference<>() {});
    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
    assertThat(response.getBody()).containsKeys("error", "errorCode", "moreInfo", "path");
    return response.getBody();
  }

  private static HttpEntity<String> json(String payload) {
    HttpHeaders headers = new HttpHeaders();
    headers.setContentType(MediaType.APPLICATION_JSON);
    return new HttpEntity<>(payload, headers);
  }
}
