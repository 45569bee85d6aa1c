package com.ospicorp.forecastengine.metrics.source;

import com.ospicorp.forecastengine.metrics.model.MetricsQuery;
import com.ospicorp.forecastengine.metrics.model.RawObservation;
import java.util.List;

/**
 * Source of raw metric rows for the batch path. Implementations return rows in the store's
 * order and never filter them; cleaning is the normalizer's job.
 */
public interface MetricsSourceConnector {

  List<RawObservation> fetch(MetricsQuery query) throws ExtractionException;
}
