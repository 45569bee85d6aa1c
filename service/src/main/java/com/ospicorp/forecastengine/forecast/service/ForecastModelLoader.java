package com.ospicorp.forecastengine.forecast.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ospicorp.forecastengine.forecast.model.PredictorDescriptor;
import com.ospicorp.forecastengine.forecast.model.QuantileForecast;
import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.URISyntaxException;
import java.util.List;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;
import org.springframework.util.ResourceUtils;
import org.springframework.util.StringUtils;
import org.springframework.web.client.RestTemplate;

/**
 * Reads {@value #DESCRIPTOR_FILE} from the model location and builds the predictor. Locations
 * without a URL prefix are filesystem paths.
 */
@Component
public class ForecastModelLoader {

  public static final String DESCRIPTOR_FILE = "predictor.json";

  private static final Logger log = LoggerFactory.getLogger(ForecastModelLoader.class);

  private final ResourceLoader resourceLoader;
  private final ObjectMapper mapper;
  private final RestTemplate restTemplate;

  public ForecastModelLoader(ResourceLoader resourceLoader, ObjectMapper mapper,
      RestTemplate restTemplate) {
    this.resourceLoader = resourceLoader;
    this.mapper = mapper;
    this.restTemplate = restTemplate;
  }

  public ModelLoadResult load(String location, String modelName) {
    try {
      ForecastServiceContext context = doLoad(location, modelName);
      log.info("Model successfully loaded from path: {} (type={}, model={})",
          location, context.descriptor().type(), modelName);
      return ModelLoadResult.ready(context);
    } catch (ModelLoadException ex) {
      log.error("Failed to load model from path: {}. Error: {}", location, ex.getMessage());
      return ModelLoadResult.failed(ex);
    }
  }

  private ForecastServiceContext doLoad(String location, String modelName) {
    if (!StringUtils.hasText(location)) {
      throw new ModelLoadException("Model path is not configured");
    }
    Resource resource = resourceLoader.getResource(descriptorLocation(location));
    if (!resource.exists()) {
      throw new ModelLoadException("Model resource not found: " + resource.getDescription());
    }

    PredictorDescriptor descriptor;
    try (InputStream in = resource.getInputStream()) {
      descriptor = mapper.readValue(in, PredictorDescriptor.class);
    } catch (IOException ex) {
      throw new ModelLoadException("Unreadable model descriptor " + resource.getDescription()
          + ": " + ex.getMessage(), ex);
    }

    validate(descriptor, modelName);
    ForecastModel model = build(descriptor);
    if (!model.threadSafe() || !descriptor.allowsConcurrentPredict()) {
      log.info("Predictor does not support concurrent calls; predictions will be serialized");
      model = new SerializingForecastModel(model);
    }
    return new ForecastServiceContext(model, modelName, location, descriptor);
  }

  static String descriptorLocation(String location) {
    String base = ResourceUtils.isUrl(location) ? location : ResourceUtils.FILE_URL_PREFIX + location;
    return base.endsWith("/") ? base + DESCRIPTOR_FILE : base + "/" + DESCRIPTOR_FILE;
  }

  private static void validate(PredictorDescriptor descriptor, String modelName) {
    String type = descriptor.type() == null ? null : descriptor.type().toLowerCase(Locale.ROOT);
    if (!PredictorDescriptor.LOCAL.equals(type) && !PredictorDescriptor.REMOTE.equals(type)) {
      throw new ModelLoadException("Invalid predictor type. Supported values: local,remote.");
    }
    if (descriptor.frequency() == null || descriptor.frequency().isNegative()
        || descriptor.frequency().isZero()) {
      throw new ModelLoadException("Predictor frequency must be a positive duration");
    }
    if (descriptor.predictionLength() == null || descriptor.predictionLength() < 1) {
      throw new ModelLoadException("Predictor predictionLength must be at least 1");
    }
    List<Double> levels = descriptor.quantileLevels();
    if (levels == null || levels.isEmpty()) {
      throw new ModelLoadException("Predictor declares no quantile levels");
    }
    for (Double level : levels) {
      if (level == null || !(level > 0d && level < 1d)) {
        throw new ModelLoadException("Quantile levels must lie strictly between 0 and 1: " + level);
      }
    }
    List<String> missing = ResponseShaper.REQUIRED_QUANTILE_LEVELS.stream()
        .filter(required -> levels.stream().noneMatch(level -> level.doubleValue() == required))
        .map(QuantileForecast::quantileColumn)
        .toList();
    if (!missing.isEmpty()) {
      throw new ModelLoadException("Predictor does not produce required quantile levels " + missing);
    }
    if (descriptor.models() == null || descriptor.models().isEmpty()) {
      throw new ModelLoadException("Predictor declares no models");
    }
    if (!descriptor.models().contains(modelName)) {
      throw new ModelLoadException("Configured model " + modelName
          + " is not one of the predictor's models " + descriptor.models());
    }
  }

  private ForecastModel build(PredictorDescriptor descriptor) {
    if (PredictorDescriptor.REMOTE.equalsIgnoreCase(descriptor.type())) {
      if (!StringUtils.hasText(descriptor.endpoint())) {
        throw new ModelLoadException("Remote predictor requires an endpoint");
      }
      URI endpoint;
      try {
        endpoint = new URI(descriptor.endpoint());
      } catch (URISyntaxException ex) {
        throw new ModelLoadException("Invalid predictor endpoint: " + descriptor.endpoint(), ex);
      }
      if (!endpoint.isAbsolute()) {
        throw new ModelLoadException("Predictor endpoint must be absolute: " + endpoint);
      }
      return new RemoteForecastModel(restTemplate, endpoint, descriptor.predictionLength(),
          descriptor.quantileLevels());
    }
    try {
      return new LocalForecastModel(descriptor.models(), descriptor.frequency(),
          descriptor.predictionLength(), descriptor.quantileLevels());
    } catch (IllegalArgumentException ex) {
      throw new ModelLoadException(ex.getMessage(), ex);
    }
  }
}
