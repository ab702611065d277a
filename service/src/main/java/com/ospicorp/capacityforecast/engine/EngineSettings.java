package com.ospicorp.capacityforecast.engine;

import com.ospicorp.capacityforecast.estimator.IntervalLevels;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Parameters of one engine run. Levels are normalized to percentages and always include the
 * alert level.
 */
public record EngineSettings(
    int horizon,
    List<Double> levels,
    int nFolds,
    int stepSize,
    int minSeriesLength,
    int minTrainLength,
    Duration step,
    double alertLevel,
    boolean strictQuantiles
) {

  public static final int DEFAULT_HORIZON = 14;
  public static final int DEFAULT_N_FOLDS = 3;
  public static final int DEFAULT_STEP_SIZE = 7;
  public static final int DEFAULT_MIN_SERIES_LENGTH = 30;
  public static final int DEFAULT_MIN_TRAIN_LENGTH = 7;

  public EngineSettings {
    requirePositive(horizon, "horizon");
    requirePositive(nFolds, "n_folds");
    requirePositive(stepSize, "step_size");
    requirePositive(minSeriesLength, "min_series_length");
    requirePositive(minTrainLength, "min_train_length");
    if (step == null || step.isZero() || step.isNegative()) {
      throw new IllegalArgumentException("step must be a positive duration");
    }
    alertLevel = IntervalLevels.normalize(alertLevel);
    List<Double> all = new ArrayList<>(levels == null ? List.of() : levels);
    List<Double> normalized = IntervalLevels.normalize(all);
    if (!normalized.contains(alertLevel)) {
      all = new ArrayList<>(normalized);
      all.add(alertLevel);
      normalized = IntervalLevels.normalize(all);
    }
    levels = List.copyOf(normalized);
  }

  public static EngineSettings defaults() {
    return new EngineSettings(DEFAULT_HORIZON, List.of(80d, 90d), DEFAULT_N_FOLDS,
        DEFAULT_STEP_SIZE, DEFAULT_MIN_SERIES_LENGTH, DEFAULT_MIN_TRAIN_LENGTH, Duration.ofDays(1),
        90d, false);
  }

  public EngineSettings withStrictQuantiles(boolean strict) {
    return new EngineSettings(horizon, levels, nFolds, stepSize, minSeriesLength, minTrainLength,
        step, alertLevel, strict);
  }

  private static void requirePositive(int value, String name) {
    if (value < 1) {
      throw new IllegalArgumentException(name + " must be a positive integer");
    }
  }
}
