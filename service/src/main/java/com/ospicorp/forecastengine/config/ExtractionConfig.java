package com.ospicorp.forecastengine.config;

import com.ospicorp.forecastengine.metrics.model.MetricsQuery;
import com.ospicorp.forecastengine.metrics.service.DatasetExtractionJob;
import com.ospicorp.forecastengine.metrics.service.SampleNormalizer;
import com.ospicorp.forecastengine.metrics.service.SeriesTagger;
import com.ospicorp.forecastengine.metrics.service.TrainingDatasetWriter;
import com.ospicorp.forecastengine.metrics.source.CommandLineMetricsSourceConnector;
import com.ospicorp.forecastengine.metrics.source.JdbcMetricsSourceConnector;
import com.ospicorp.forecastengine.metrics.source.MetricsSourceConnector;
import javax.sql.DataSource;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.jdbc.DataSourceBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Profile;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.util.StringUtils;

/** Beans for the one-shot {@code extract} run. The serving profile never creates these. */
@Configuration
@Profile("extract")
public class ExtractionConfig {

  @Bean
  @ConditionalOnProperty(name = "forecasting.extraction.source", havingValue = "command",
      matchIfMissing = true)
  MetricsSourceConnector commandLineMetricsSource(ForecastingProperties properties) {
    ForecastingProperties.Extraction extraction = properties.extraction();
    if (extraction.command() == null || extraction.command().isEmpty()) {
      throw new IllegalStateException("forecasting.extraction.command must be set for source=command");
    }
    return new CommandLineMetricsSourceConnector(extraction.command(), extraction.commandTimeout());
  }

  @Bean
  @ConditionalOnProperty(name = "forecasting.extraction.source", havingValue = "jdbc")
  MetricsSourceConnector jdbcMetricsSource(ForecastingProperties properties) {
    ForecastingProperties.Jdbc jdbc = properties.extraction().jdbc();
    if (jdbc == null || !StringUtils.hasText(jdbc.url())) {
      throw new IllegalStateException("forecasting.extraction.jdbc.url must be set for source=jdbc");
    }
    DataSource dataSource = DataSourceBuilder.create()
        .url(jdbc.url())
        .username(jdbc.username())
        .password(jdbc.password())
        .build();
    return new JdbcMetricsSourceConnector(new JdbcTemplate(dataSource));
  }

  @Bean
  DatasetExtractionJob datasetExtractionJob(MetricsSourceConnector connector,
      ForecastingProperties properties) {
    ForecastingProperties.Metrics metrics = properties.metrics();
    return new DatasetExtractionJob(
        connector,
        new MetricsQuery(properties.extraction().query()),
        new SampleNormalizer(metrics.timestampColumn(), metrics.entityColumn(), metrics.definitions()),
        properties.resampling().interval(),
        new SeriesTagger(metrics.definitions()),
        new TrainingDatasetWriter(),
        properties.extraction().output());
  }
}
