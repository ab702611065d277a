package com.ospicorp.capacityforecast.metrics;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Backtest score of one model. {@code capacityBreachRate} is null when it was not computed
 * (no capacity data, or no tuple with both capacity and an upper bound), which is distinct from a
 * computed rate of zero.
 */
public record ModelScore(
    @JsonProperty("model") String modelId,
    double wape,
    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonProperty("capacity_breach_rate") Double capacityBreachRate,
    @JsonProperty("scored_points") int scoredPoints,
    @JsonProperty("n_series") int seriesCount
) {

  public ModelScore {
    if (!(wape >= 0d) || Double.isInfinite(wape)) {
      throw new IllegalArgumentException("wape must be a finite non-negative number: " + wape);
    }
    if (capacityBreachRate != null && !(capacityBreachRate >= 0d && capacityBreachRate <= 1d)) {
      throw new IllegalArgumentException("capacity_breach_rate must be in [0,1]: "
          + capacityBreachRate);
    }
  }

  public boolean hasBreachRate() {
    return capacityBreachRate != null;
  }
}
