package com.ospicorp.forecastengine.config;

import com.ospicorp.forecastengine.forecast.service.ForecastModelLoader;
import com.ospicorp.forecastengine.forecast.service.ForecastServiceContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Profile;

/**
 * Loads the predictor while the context starts. A load failure propagates out of the bean
 * factory, so the application never starts serving without a model.
 */
@Configuration
@Profile("!extract")
public class ForecastModelConfig {

  @Bean
  ForecastServiceContext forecastServiceContext(ForecastModelLoader loader,
      ForecastingProperties properties) {
    return loader.load(properties.model().path(), properties.model().name()).orElseThrow();
  }
}
