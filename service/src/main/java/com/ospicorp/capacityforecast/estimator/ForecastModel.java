package com.ospicorp.capacityforecast.estimator;

import com.ospicorp.capacityforecast.error.FitFailureException;
import java.util.List;

/**
 * Capability contract for a forecasting algorithm. Implementations keep no state between calls:
 * every call fits on the history it is given and forecasts {@code horizon} steps past its end.
 */
public interface ForecastModel {

  String id();

  /**
   * @throws FitFailureException when the history is degenerate for this algorithm or the fit
   *     produces non-finite output
   */
  double[] fitPredict(double[] history, int horizon);

  default boolean supportsQuantiles() {
    return false;
  }

  /**
   * Point forecast plus a central prediction interval for each level (percent, in (0,100)).
   *
   * @throws FitFailureException as for {@link #fitPredict}
   */
  default QuantileForecast fitPredictQuantiles(double[] history, int horizon, List<Double> levels) {
    throw new UnsupportedOperationException(id() + " does not produce prediction intervals");
  }
}
