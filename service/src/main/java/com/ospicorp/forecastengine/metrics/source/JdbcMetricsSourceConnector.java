package com.ospicorp.forecastengine.metrics.source;

import com.ospicorp.forecastengine.metrics.model.MetricsQuery;
import com.ospicorp.forecastengine.metrics.model.RawObservation;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;

public class JdbcMetricsSourceConnector implements MetricsSourceConnector {

  private static final Logger log = LoggerFactory.getLogger(JdbcMetricsSourceConnector.class);

  private final JdbcTemplate jdbc;

  public JdbcMetricsSourceConnector(JdbcTemplate jdbc) {
    this.jdbc = jdbc;
  }

  @Override
  public List<RawObservation> fetch(MetricsQuery query) throws ExtractionException {
    try {
      List<RawObservation> rows = jdbc.queryForList(query.sql()).stream()
          .map(RawObservation::of)
          .toList();
      log.info("Metrics query returned {} rows", rows.size());
      return rows;
    } catch (DataAccessException ex) {
      throw new ExtractionException("Metrics query failed: " + ex.getMostSpecificCause().getMessage(), ex);
    }
  }
}
