package com.ospicorp.capacityforecast.estimator;

/** Repeats the last full season. */
public class SeasonalNaiveModel extends ResidualModel {
  private final int seasonLength;

  public SeasonalNaiveModel(int seasonLength) {
    if (seasonLength < 1) {
      throw new IllegalArgumentException("seasonLength must be positive");
    }
    this.seasonLength = seasonLength;
  }

  @Override
  public String id() {
    return ModelKind.SEASONAL_NAIVE.id();
  }

  @Override
  protected int minimumHistory() {
    return seasonLength + 1;
  }

  @Override
  protected double[] pointForecast(double[] history, int horizon) {
    int n = history.length;
    double[] out = new double[horizon];
    for (int i = 0; i < horizon; i++) {
      out[i] = history[n - seasonLength + (i % seasonLength)];
    }
    return out;
  }

  @Override
  protected double[] residuals(double[] history) {
    double[] out = new double[history.length - seasonLength];
    for (int t = seasonLength; t < history.length; t++) {
      out[t - seasonLength] = history[t] - history[t - seasonLength];
    }
    return out;
  }

  @Override
  protected double horizonScale(int h, int historyLength) {
    return Math.sqrt((h - 1) / seasonLength + 1d);
  }
}
