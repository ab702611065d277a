package com.ospicorp.capacityforecast.estimator;

/** Last observation plus the average change over the history. */
public class RandomWalkDriftModel extends ResidualModel {

  @Override
  public String id() {
    return ModelKind.RANDOM_WALK_DRIFT.id();
  }

  @Override
  protected double[] pointForecast(double[] history, int horizon) {
    double last = history[history.length - 1];
    double slope = slope(history);
    double[] out = new double[horizon];
    for (int i = 0; i < horizon; i++) {
      out[i] = last + (i + 1) * slope;
    }
    return out;
  }

  @Override
  protected double[] residuals(double[] history) {
    double slope = slope(history);
    double[] out = new double[history.length - 1];
    for (int t = 1; t < history.length; t++) {
      out[t - 1] = history[t] - history[t - 1] - slope;
    }
    return out;
  }

  @Override
  protected double horizonScale(int h, int historyLength) {
    return Math.sqrt(h * (1d + (double) h / (historyLength - 1)));
  }

  private static double slope(double[] history) {
    return (history[history.length - 1] - history[0]) / (history.length - 1);
  }
}
