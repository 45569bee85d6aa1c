package com.ospicorp.forecastengine.forecast.service;

import com.ospicorp.forecastengine.forecast.model.QuantileForecast;
import com.ospicorp.forecastengine.metrics.model.SeriesRecord;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;

/** Admits one {@code predict} call at a time into a predictor that is not thread-safe. */
public class SerializingForecastModel implements ForecastModel {

  private final ForecastModel delegate;
  private final ReentrantLock lock = new ReentrantLock(true);

  public SerializingForecastModel(ForecastModel delegate) {
    this.delegate = delegate;
  }

  @Override
  public QuantileForecast predict(Map<String, List<SeriesRecord>> history, String modelName) {
    lock.lock();
    try {
      return delegate.predict(history, modelName);
    } finally {
      lock.unlock();
    }
  }

  @Override
  public boolean threadSafe() {
    return true;
  }

  ForecastModel delegate() {
    return delegate;
  }
}
