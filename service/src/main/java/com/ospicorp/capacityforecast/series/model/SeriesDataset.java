package com.ospicorp.capacityforecast.series.model;

import java.time.Instant;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.OptionalDouble;
import java.util.Set;
import java.util.TreeMap;

/**
 * Normalized long-format dataset: every series is sorted by time and has at least the configured
 * minimum number of observations. Instances are immutable.
 */
public final class SeriesDataset {
  private final Map<String, List<Observation>> series;
  private final List<String> droppedSeries;
  private final List<String> warnings;
  private final int minSeriesLength;

  public SeriesDataset(Map<String, List<Observation>> series, List<String> droppedSeries,
      List<String> warnings, int minSeriesLength) {
    Map<String, List<Observation>> copy = new TreeMap<>();
    series.forEach((id, observations) -> copy.put(id, List.copyOf(observations)));
    this.series = Collections.unmodifiableMap(copy);
    this.droppedSeries = droppedSeries.stream().sorted().toList();
    this.warnings = List.copyOf(warnings);
    this.minSeriesLength = minSeriesLength;
  }

  public Set<String> seriesIds() {
    return series.keySet();
  }

  public List<Observation> series(String id) {
    List<Observation> observations = series.get(id);
    if (observations == null) {
      throw new NoSuchElementException("Series not in dataset: " + id);
    }
    return observations;
  }

  public double[] values(String id) {
    List<Observation> observations = series(id);
    double[] values = new double[observations.size()];
    for (int i = 0; i < values.length; i++) {
      values[i] = observations.get(i).value();
    }
    return values;
  }

  public boolean contains(String id) {
    return series.containsKey(id);
  }

  public boolean isEmpty() {
    return series.isEmpty();
  }

  public int seriesCount() {
    return series.size();
  }

  public int observationCount() {
    return series.values().stream().mapToInt(List::size).sum();
  }

  public boolean hasCapacity() {
    return series.values().stream()
        .flatMap(List::stream)
        .anyMatch(Observation::hasCapacity);
  }

  /** Latest capacity observed for the series, if any observation carries one. */
  public OptionalDouble referenceCapacity(String id) {
    List<Observation> observations = series(id);
    for (int i = observations.size() - 1; i >= 0; i--) {
      Double capacity = observations.get(i).capacity();
      if (capacity != null) {
        return OptionalDouble.of(capacity);
      }
    }
    return OptionalDouble.empty();
  }

  public Instant start() {
    return series.values().stream()
        .map(observations -> observations.get(0).timestamp())
        .min(Instant::compareTo)
        .orElse(null);
  }

  public Instant end() {
    return series.values().stream()
        .map(observations -> observations.get(observations.size() - 1).timestamp())
        .max(Instant::compareTo)
        .orElse(null);
  }

  public List<String> droppedSeries() {
    return droppedSeries;
  }

  public List<String> warnings() {
    return warnings;
  }

  public int minSeriesLength() {
    return minSeriesLength;
  }
}
