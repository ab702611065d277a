package com.ospicorp.capacityforecast.estimator;

import java.util.Collections;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;

/** Per-step point forecast with lower/upper bounds keyed by interval level. */
public final class QuantileForecast {
  private final double[] point;
  private final SortedMap<Double, double[]> lower;
  private final SortedMap<Double, double[]> upper;

  public QuantileForecast(double[] point, Map<Double, double[]> lower, Map<Double, double[]> upper) {
    if (!lower.keySet().equals(upper.keySet())) {
      throw new IllegalArgumentException("lower and upper bounds must cover the same levels");
    }
    this.point = point.clone();
    this.lower = Collections.unmodifiableSortedMap(new TreeMap<>(lower));
    this.upper = Collections.unmodifiableSortedMap(new TreeMap<>(upper));
  }

  public int horizon() {
    return point.length;
  }

  public double[] point() {
    return point.clone();
  }

  public double point(int step) {
    return point[step];
  }

  public Set<Double> levels() {
    return lower.keySet();
  }

  public QuantileBand band(double level, int step) {
    double[] lo = lower.get(level);
    double[] hi = upper.get(level);
    if (lo == null || hi == null) {
      throw new NoSuchElementException("No interval for level " + level);
    }
    return new QuantileBand(lo[step], hi[step]);
  }

  public double upper(double level, int step) {
    return band(level, step).upper();
  }
}
