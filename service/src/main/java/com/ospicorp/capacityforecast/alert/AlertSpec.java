package com.ospicorp.capacityforecast.alert;

import com.ospicorp.capacityforecast.estimator.IntervalLevels;
import java.util.Objects;
import java.util.Set;

/**
 * Which forecast band to watch: the upper bound of {@code level} as produced by {@code modelId}.
 * An empty series filter means every series.
 */
public record AlertSpec(String modelId, double level, CapacityThreshold threshold,
    Set<String> seriesFilter) {

  public AlertSpec {
    Objects.requireNonNull(modelId, "modelId");
    Objects.requireNonNull(threshold, "threshold");
    level = IntervalLevels.normalize(level);
    seriesFilter = seriesFilter == null ? Set.of() : Set.copyOf(seriesFilter);
  }

  public boolean covers(String seriesId) {
    return seriesFilter.isEmpty() || seriesFilter.contains(seriesId);
  }
}
