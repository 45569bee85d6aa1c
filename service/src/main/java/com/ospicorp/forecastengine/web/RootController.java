package com.ospicorp.forecastengine.web;

import com.ospicorp.forecastengine.forecast.model.PredictorDescriptor;
import com.ospicorp.forecastengine.forecast.service.ForecastServiceContext;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.context.annotation.Profile;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/** Service banner with the predictor that answers {@code /predict}. */
@RestController
@Profile("!extract")
public class RootController {

  private final ForecastServiceContext context;

  public RootController(ForecastServiceContext context) {
    this.context = context;
  }

  @GetMapping("/")
  public Map<String, Object> root() {
    PredictorDescriptor descriptor = context.descriptor();
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("service", "forecast-engine");
    body.put("status", "ok");
    body.put("model", context.modelName());
    body.put("predictor", descriptor.type());
    body.put("frequency", descriptor.frequency().toString());
    body.put("predictionLength", descriptor.predictionLength());
    return body;
  }

  @GetMapping("/v1/ping")
  public ResponseEntity<Map<String, Object>> ping() {
    return ResponseEntity.ok(Map.of("pong", true));
  }
}
