package com.ospicorp.forecastengine.metrics.model;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;

/**
 * A tracked metric: the source column it is read from and the suffix that names its series.
 * The suffix may not contain {@code _} so that {@code entity_suffix} splits at the last
 * underscore.
 */
public record MetricDefinition(
    @NotBlank String column,
    @NotBlank @Pattern(regexp = "^[A-Za-z0-9.-]+$") String suffix
) {}
