package com.ospicorp.capacityforecast.alert;

import com.ospicorp.capacityforecast.series.model.SeriesDataset;
import java.util.Map;
import java.util.OptionalDouble;

/** Resolves the absolute comparison value for a series before alerts are evaluated. */
public interface CapacityThreshold {

  OptionalDouble resolve(String seriesId, SeriesDataset dataset);

  static CapacityThreshold absolute(double value) {
    return new Absolute(Map.of(), value);
  }

  static CapacityThreshold perSeries(Map<String, Double> values, Double fallback) {
    return new Absolute(values, fallback);
  }

  static CapacityThreshold relative(double multiplier) {
    return new Relative(multiplier);
  }

  /** Fixed capacity per series, with an optional value for series not listed. */
  record Absolute(Map<String, Double> perSeries, Double fallback) implements CapacityThreshold {

    public Absolute {
      perSeries = Map.copyOf(perSeries);
    }

    @Override
    public OptionalDouble resolve(String seriesId, SeriesDataset dataset) {
      Double value = perSeries.getOrDefault(seriesId, fallback);
      return value == null ? OptionalDouble.empty() : OptionalDouble.of(value);
    }
  }

  /** Multiplier of the latest capacity observed for the series. */
  record Relative(double multiplier) implements CapacityThreshold {

    public Relative {
      if (!(multiplier > 0d) || Double.isInfinite(multiplier)) {
        throw new IllegalArgumentException("multiplier must be a positive number");
      }
    }

    @Override
    public OptionalDouble resolve(String seriesId, SeriesDataset dataset) {
      if (!dataset.contains(seriesId)) {
        return OptionalDouble.empty();
      }
      OptionalDouble capacity = dataset.referenceCapacity(seriesId);
      return capacity.isPresent()
          ? OptionalDouble.of(capacity.getAsDouble() * multiplier)
          : OptionalDouble.empty();
    }
  }
}
