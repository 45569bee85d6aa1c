package com.ospicorp.forecastengine.metrics.model;

import java.time.LocalDateTime;

public record ResampledPoint(LocalDateTime intervalStart, String entity, String metric, double value) {}
