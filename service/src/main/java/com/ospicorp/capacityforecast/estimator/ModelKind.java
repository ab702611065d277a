package com.ospicorp.capacityforecast.estimator;

import java.util.Arrays;
import java.util.Locale;

/** Closed set of model identifiers the engine can backtest and forecast with. */
public enum ModelKind {
  NAIVE("Naive"),
  SEASONAL_NAIVE("SeasonalNaive"),
  RANDOM_WALK_DRIFT("RandomWalkDrift"),
  HISTORIC_AVERAGE("HistoricAverage");

  private final String id;

  ModelKind(String id) {
    this.id = id;
  }

  public String id() {
    return id;
  }

  public static ModelKind fromId(String value) {
    if (value == null) {
      throw new IllegalArgumentException("Model identifier must be provided");
    }
    String normalized = value.trim().toLowerCase(Locale.ROOT).replace("_", "").replace("-", "");
    return Arrays.stream(values())
        .filter(kind -> kind.id.toLowerCase(Locale.ROOT).equals(normalized))
        .findFirst()
        .orElseThrow(() -> new IllegalArgumentException("Unknown model: " + value));
  }
}
