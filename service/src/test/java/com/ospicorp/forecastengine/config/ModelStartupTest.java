package com.ospicorp.forecastengine.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.ospicorp.forecastengine.ForecastEngineApplication;
import com.ospicorp.forecastengine.forecast.service.ForecastServiceContext;
import com.ospicorp.forecastengine.forecast.service.ModelLoadException;
import org.junit.jupiter.api.Test;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.builder.SpringApplicationBuilder;
import org.springframework.context.ConfigurableApplicationContext;

class ModelStartupTest {

  @Test
  void missingModelAbortsStartup() {
    SpringApplicationBuilder builder = new SpringApplicationBuilder(ForecastEngineApplication.class)
        .web(WebApplicationType.SERVLET);

    assertThatThrownBy(() -> builder.run(
        "--server.port=0", "--forecasting.model.path=file:/nonexistent/forecast-model"))
        .hasRootCauseInstanceOf(ModelLoadException.class)
        .rootCause().hasMessageContaining("not found");
  }

  @Test
  void configuredModelIsLoadedAtStartup() {
    try (ConfigurableApplicationContext context =
        new SpringApplicationBuilder(ForecastEngineApplication.class)
            .web(WebApplicationType.SERVLET)
            .run("--server.port=0", "--forecasting.model.name=Naive")) {
      ForecastServiceContext loaded = context.getBean(ForecastServiceContext.class);

      assertThat(loaded.modelName()).isEqualTo("Naive");
      assertThat(loaded.location()).isEqualTo("classpath:TrainedModel");
      assertThat(loaded.descriptor().predictionLength()).isEqualTo(3);
    }
  }
}
