package com.ospicorp.capacityforecast.estimator;

import com.ospicorp.capacityforecast.error.FitFailureException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.apache.commons.math3.distribution.NormalDistribution;
import org.apache.commons.math3.stat.StatUtils;

/**
 * Base for simple benchmark methods whose prediction intervals come from the in-sample one-step
 * residuals under a Gaussian assumption: bound = point +/- z * sigma * scale(h).
 */
abstract class ResidualModel implements ForecastModel {
  private static final NormalDistribution STANDARD_NORMAL = new NormalDistribution(0d, 1d);

  protected abstract double[] pointForecast(double[] history, int horizon);

  protected abstract double[] residuals(double[] history);

  /** Multiplier applied to the one-step sigma at 1-based step {@code h}. */
  protected abstract double horizonScale(int h, int historyLength);

  protected int minimumHistory() {
    return 2;
  }

  @Override
  public double[] fitPredict(double[] history, int horizon) {
    checkInput(history, horizon);
    double[] point = pointForecast(history, horizon);
    requireFinite(point, "point forecast");
    return point;
  }

  @Override
  public boolean supportsQuantiles() {
    return true;
  }

  @Override
  public QuantileForecast fitPredictQuantiles(double[] history, int horizon, List<Double> levels) {
    double[] point = fitPredict(history, horizon);
    double[] residuals = residuals(history);
    if (residuals.length == 0) {
      throw new FitFailureException(id(), "No residuals to estimate spread from");
    }
    double sigma = Math.sqrt(StatUtils.sumSq(residuals) / residuals.length);
    if (!Double.isFinite(sigma)) {
      throw new FitFailureException(id(), "Residual spread is not finite");
    }

    Map<Double, double[]> lower = new LinkedHashMap<>();
    Map<Double, double[]> upper = new LinkedHashMap<>();
    for (double level : levels) {
      double z = STANDARD_NORMAL.inverseCumulativeProbability(0.5d + level / 200d);
      double[] lo = new double[horizon];
      double[] hi = new double[horizon];
      for (int i = 0; i < horizon; i++) {
        double width = z * sigma * horizonScale(i + 1, history.length);
        lo[i] = point[i] - width;
        hi[i] = point[i] + width;
      }
      lower.put(level, lo);
      upper.put(level, hi);
    }
    return new QuantileForecast(point, lower, upper);
  }

  private void checkInput(double[] history, int horizon) {
    if (horizon < 1) {
      throw new IllegalArgumentException("horizon must be positive");
    }
    if (history == null || history.length < minimumHistory()) {
      throw new FitFailureException(id(), id() + " needs at least " + minimumHistory()
          + " observations, got " + (history == null ? 0 : history.length));
    }
    requireFinite(history, "history");
  }

  private void requireFinite(double[] values, String what) {
    for (double v : values) {
      if (!Double.isFinite(v)) {
        throw new FitFailureException(id(), id() + " " + what + " contains non-finite values");
      }
    }
  }
}
