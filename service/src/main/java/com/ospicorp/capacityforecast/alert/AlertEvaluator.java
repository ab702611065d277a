package com.ospicorp.capacityforecast.alert;

import com.ospicorp.capacityforecast.estimator.IntervalLevels;
import com.ospicorp.capacityforecast.estimator.QuantileBand;
import com.ospicorp.capacityforecast.forecast.ForecastPoint;
import com.ospicorp.capacityforecast.series.model.SeriesDataset;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.OptionalDouble;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Flags every forecast step whose upper bound exceeds the series threshold. Evaluation is a pure
 * function of its inputs: the same forecasts and spec always give the same events, in the same
 * order, with no deduplication across calls.
 */
public final class AlertEvaluator {
  private AlertEvaluator() {
  }

  public static AlertOutcome evaluate(Collection<ForecastPoint> forecasts, SeriesDataset dataset,
      AlertSpec spec) {
    List<ForecastPoint> watched = forecasts.stream()
        .filter(point -> point.modelId().equals(spec.modelId()))
        .filter(point -> spec.covers(point.seriesId()))
        .sorted(ForecastPoint.ORDER)
        .toList();

    SortedMap<String, Double> thresholds = new TreeMap<>();
    TreeSet<String> skipped = new TreeSet<>();
    for (String seriesId : new TreeSet<>(watched.stream().map(ForecastPoint::seriesId).toList())) {
      OptionalDouble threshold = spec.threshold().resolve(seriesId, dataset);
      if (threshold.isPresent()) {
        thresholds.put(seriesId, threshold.getAsDouble());
      } else {
        skipped.add(seriesId);
      }
    }

    String label = IntervalLevels.label(spec.level());
    List<AlertEvent> events = new ArrayList<>();
    for (ForecastPoint point : watched) {
      Double threshold = thresholds.get(point.seriesId());
      if (threshold == null) {
        continue;
      }
      QuantileBand band = point.band(spec.level());
      if (band == null) {
        throw new IllegalArgumentException("Model " + spec.modelId() + " has no " + label
            + "% interval for series " + point.seriesId());
      }
      if (band.upper() > threshold) {
        events.add(new AlertEvent(point.seriesId(), point.timestamp(), band.upper(), threshold,
            String.format(Locale.ROOT, "P%s demand (%.2f) exceeds threshold (%.2f)", label,
                band.upper(), threshold)));
      }
    }
    return new AlertOutcome(List.copyOf(events), Collections.unmodifiableSortedMap(thresholds),
        List.copyOf(skipped));
  }
}
