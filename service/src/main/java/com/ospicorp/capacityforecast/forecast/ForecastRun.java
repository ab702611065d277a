package com.ospicorp.capacityforecast.forecast;

import com.ospicorp.capacityforecast.engine.UnitFailure;
import java.util.List;
import java.util.SortedMap;

/** Forecasts keyed by series id, with the per-series failures of the same run. */
public record ForecastRun(
    SortedMap<String, List<ForecastPoint>> bySeries,
    List<UnitFailure> failures,
    boolean incomplete
) {

  public List<ForecastPoint> points() {
    return bySeries.values().stream().flatMap(List::stream).toList();
  }
}
