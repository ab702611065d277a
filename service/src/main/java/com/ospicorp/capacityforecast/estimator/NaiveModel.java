package com.ospicorp.capacityforecast.estimator;

import java.util.Arrays;

/** Repeats the last observation. */
public class NaiveModel extends ResidualModel {

  @Override
  public String id() {
    return ModelKind.NAIVE.id();
  }

  @Override
  protected double[] pointForecast(double[] history, int horizon) {
    double[] out = new double[horizon];
    Arrays.fill(out, history[history.length - 1]);
    return out;
  }

  @Override
  protected double[] residuals(double[] history) {
    double[] out = new double[history.length - 1];
    for (int t = 1; t < history.length; t++) {
      out[t - 1] = history[t] - history[t - 1];
    }
    return out;
  }

  @Override
  protected double horizonScale(int h, int historyLength) {
    return Math.sqrt(h);
  }
}
