package com.ospicorp.capacityforecast.estimator;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.TreeSet;

/**
 * Interval levels are carried as percentages in (0,100). Input may use either that scale or
 * fractions in (0,1), but one request must use one scale.
 */
public final class IntervalLevels {
  private IntervalLevels() {
  }

  public static List<Double> normalize(Collection<Double> levels) {
    if (levels == null || levels.isEmpty()) {
      throw new IllegalArgumentException("At least one interval level is required");
    }
    boolean fractions = levels.stream().allMatch(l -> l != null && l > 0d && l < 1d);
    TreeSet<Double> out = new TreeSet<>();
    for (Double level : levels) {
      if (level == null || !Double.isFinite(level)) {
        throw new IllegalArgumentException("Interval levels must be finite numbers");
      }
      double percent = fractions ? level * 100d : level;
      if (!fractions && level < 1d) {
        throw new IllegalArgumentException(
            "Interval levels mix fractions and percentages: " + levels);
      }
      if (percent <= 0d || percent >= 100d) {
        throw new IllegalArgumentException("Interval level out of range (0,100): " + level);
      }
      out.add(round(percent));
    }
    return new ArrayList<>(out);
  }

  public static double normalize(double level) {
    return normalize(List.of(level)).get(0);
  }

  /** Short label for a level: 90 for 90.0, 97.5 for 97.5. */
  public static String label(double level) {
    return BigDecimal.valueOf(level).stripTrailingZeros().toPlainString();
  }

  // keeps 0.9 * 100 from becoming 90.00000000000001
  private static double round(double percent) {
    return Math.round(percent * 1e6) / 1e6;
  }
}
