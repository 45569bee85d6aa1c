package com.ospicorp.forecastengine.web;

import static org.assertj.core.api.Assertions.assertThat;

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
import org.springframework.http.ResponseEntity;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
class RootControllerTest {

  @Autowired
  private TestRestTemplate restTemplate;

  @Test
  void pingRespondsWithPong() {
    ResponseEntity<Map<String, Object>> response = restTemplate.exchange(
        "/v1/ping",
        HttpMethod.GET,
        null,
        new ParameterizedTypeReference<>() {});

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
    assertThat(response.getBody()).containsEntry("pong", true);
    assertThat(response.getHeaders().getFirst("X-Request-Id")).isNotBlank();
  }

  @Test
  void rootDescribesLoadedPredictor() {
    ResponseEntity<Map<String, Object>> response = restTemplate.exchange(
        "/", HttpMethod.GET, null, new ParameterizedTypeReference<>() {});

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
    assertThat(response.getBody())
        .containsEntry("service", "forecast-engine")
        .containsEntry("model", "AutoETS")
        .containsEntry("predictor", "local")
        .containsEntry("frequency", "PT5M")
        .containsEntry("predictionLength", 3);
  }

  @Test
  void requestIdIsEchoed() {
    HttpHeaders headers = new HttpHeaders();
    headers.set("X-Request-Id", "trace-123");

    ResponseEntity<String> response = restTemplate.exchange("/", HttpMethod.GET,
        new HttpEntity<>(headers), String.class);

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
    assertThat(response.getHeaders().getFirst("X-Request-Id")).isEqualTo("trace-123");
  }

  @Test
  void healthIsUp() {
    ResponseEntity<Map<String, Object>> response = restTemplate.exchange(
        "/actuator/health", HttpMethod.GET, null, new ParameterizedTypeReference<>() {});

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
    assertThat(response.getBody()).containsEntry("status", "UP");
  }
}
