package com.ospicorp.forecastengine.forecast.service;

/** Random walk: repeats the last value, variance grows linearly with the horizon. */
final class NaiveEstimator implements SeriesEstimator {

  static final String NAME = "Naive";

  @Override
  public String name() {
    return NAME;
  }

  @Override
  public int minimumHistory() {
    return 2;
  }

  @Override
  public Fit fit(double[] values) {
    double sse = 0d;
    for (int t = 1; t < values.length; t++) {
      double diff = values[t] - values[t - 1];
      sse += diff * diff;
    }
    double variance = sse / (values.length - 1);
    double last = values[values.length - 1];
    return new Fit() {
      @Override
      public double mean(int step) {
        return last;
      }

      @Override
      public double standardDeviation(int step) {
        return Math.sqrt(variance * step);
      }
    };
  }
}
