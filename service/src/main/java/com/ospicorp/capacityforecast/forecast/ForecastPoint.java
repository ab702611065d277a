package com.ospicorp.capacityforecast.forecast;

import com.ospicorp.capacityforecast.estimator.QuantileBand;
import java.time.Instant;
import java.util.Collections;
import java.util.Comparator;
import java.util.SortedMap;
import java.util.TreeMap;

public record ForecastPoint(
    String seriesId,
    Instant timestamp,
    String modelId,
    double pointValue,
    SortedMap<Double, QuantileBand> bands
) {

  public static final Comparator<ForecastPoint> ORDER = Comparator
      .comparing(ForecastPoint::seriesId)
      .thenComparing(ForecastPoint::modelId)
      .thenComparing(ForecastPoint::timestamp);

  public ForecastPoint {
    bands = Collections.unmodifiableSortedMap(new TreeMap<>(bands));
  }

  public static ForecastPoint pointOnly(String seriesId, Instant timestamp, String modelId,
      double pointValue) {
    return new ForecastPoint(seriesId, timestamp, modelId, pointValue, new TreeMap<>());
  }

  public QuantileBand band(double level) {
    return bands.get(level);
  }
}
