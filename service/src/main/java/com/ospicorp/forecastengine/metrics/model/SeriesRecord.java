package com.ospicorp.forecastengine.metrics.model;

import java.time.LocalDateTime;

// One value of the univariate series named by itemId.
public record SeriesRecord(LocalDateTime timestamp, String itemId, double value) {}
