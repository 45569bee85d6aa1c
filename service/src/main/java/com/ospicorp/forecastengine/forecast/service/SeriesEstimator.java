package com.ospicorp.forecastengine.forecast.service;

/** A univariate forecasting method with Gaussian prediction intervals. */
interface SeriesEstimator {

  String name();

  int minimumHistory();

  Fit fit(double[] values);

  interface Fit {
    double mean(int step);

    double standardDeviation(int step);
  }
}
