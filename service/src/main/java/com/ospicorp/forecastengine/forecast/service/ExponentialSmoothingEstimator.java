package com.ospicorp.forecastengine.forecast.service;

/**
 * Simple exponential smoothing (ETS A,N,N). The smoothing weight is picked from a fixed grid by
 * minimum one-step squared error; ties keep the smaller weight.
 */
final class ExponentialSmoothingEstimator implements SeriesEstimator {

  static final String NAME = "AutoETS";

  private static final int GRID_STEPS = 20;

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
    double bestAlpha = Double.NaN;
    double bestLevel = Double.NaN;
    double bestSse = Double.POSITIVE_INFINITY;
    for (int i = 1; i <= GRID_STEPS; i++) {
      double alpha = (double) i / GRID_STEPS;
      double level = values[0];
      double sse = 0d;
      for (int t = 1; t < values.length; t++) {
        double error = values[t] - level;
        sse += error * error;
        level += alpha * error;
      }
      if (sse < bestSse) {
        bestSse = sse;
        bestAlpha = alpha;
        bestLevel = level;
      }
    }
    double variance = bestSse / (values.length - 1);
    double alpha = bestAlpha;
    double level = bestLevel;
    return new Fit() {
      @Override
      public double mean(int step) {
        return level;
      }

      @Override
      public double standardDeviation(int step) {
        return Math.sqrt(variance * (1d + (step - 1) * alpha * alpha));
      }
    };
  }
}
