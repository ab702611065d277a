package com.ospicorp.capacityforecast.estimator;

import java.util.Arrays;
import org.apache.commons.math3.stat.StatUtils;

/** Mean of the whole history. */
public class HistoricAverageModel extends ResidualModel {

  @Override
  public String id() {
    return ModelKind.HISTORIC_AVERAGE.id();
  }

  @Override
  protected double[] pointForecast(double[] history, int horizon) {
    double[] out = new double[horizon];
    Arrays.fill(out, StatUtils.mean(history));
    return out;
  }

  @Override
  protected double[] residuals(double[] history) {
    double mean = StatUtils.mean(history);
    double[] out = new double[history.length];
    for (int t = 0; t < history.length; t++) {
      out[t] = history[t] - mean;
    }
    return out;
  }

  @Override
  protected double horizonScale(int h, int historyLength) {
    return Math.sqrt(1d + 1d / historyLength);
  }
}
