package com.ospicorp.forecastengine.config;

import com.ospicorp.forecastengine.metrics.model.MetricDefinition;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "forecasting")
public record ForecastingProperties(
    @Valid @NotNull @DefaultValue Model model,
    @Valid @NotNull @DefaultValue Resampling resampling,
    @Valid @NotNull Metrics metrics,
    @Valid @NotNull Extraction extraction
) {

  public record Model(
      @NotBlank @DefaultValue("file:TrainedModel") String path,
      @NotBlank @DefaultValue("AutoETS") String name
  ) {}

  public record Resampling(@NotNull @DefaultValue("PT5M") Duration interval) {}

  public record Metrics(
      @NotBlank @DefaultValue("Timestamp") String timestampColumn,
      @NotBlank @DefaultValue("NodeName") String entityColumn,
      @NotEmpty List<@Valid MetricDefinition> definitions
  ) {}

  public enum SourceType { COMMAND, JDBC }

  public record Extraction(
      @NotNull @DefaultValue("command") SourceType source,
      @NotBlank String query,
      List<String> command,
      @NotNull @DefaultValue("PT5M") Duration commandTimeout,
      @Valid Jdbc jdbc,
      @NotNull @DefaultValue("ClusterData.csv") Path output
  ) {}

  public record Jdbc(String url, String username, String password) {}
}
