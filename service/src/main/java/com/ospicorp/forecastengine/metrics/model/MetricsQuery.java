package com.ospicorp.forecastengine.metrics.model;

import org.springframework.util.StringUtils;

public record MetricsQuery(String sql) {

  public MetricsQuery {
    if (!StringUtils.hasText(sql)) {
      throw new IllegalArgumentException("query must be provided");
    }
    sql = sql.strip();
  }
}
