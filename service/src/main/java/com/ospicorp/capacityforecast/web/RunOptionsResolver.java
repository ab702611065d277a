package com.ospicorp.capacityforecast.web;

import com.ospicorp.capacityforecast.alert.CapacityThreshold;
import com.ospicorp.capacityforecast.engine.EngineSettings;
import com.ospicorp.capacityforecast.estimator.IntervalLevels;
import com.ospicorp.capacityforecast.estimator.ModelKind;
import com.ospicorp.capacityforecast.estimator.ModelRegistry;
import com.ospicorp.capacityforecast.web.dto.RunOptions;
import com.ospicorp.capacityforecast.web.dto.ThresholdRequest;
import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.List;

/** Merges request overrides onto configured defaults, rejecting values with stable codes. */
final class RunOptionsResolver {
  static final int HORIZON = 2001;
  static final int LEVELS = 2002;
  static final int N_FOLDS = 2003;
  static final int STEP_SIZE = 2004;
  static final int MIN_SERIES_LENGTH = 2005;
  static final int MIN_TRAIN_LENGTH = 2006;
  static final int STEP = 2007;
  static final int ALERT_LEVEL = 2008;
  static final int MODELS = 2009;
  static final int THRESHOLD = 2010;
  static final int FORMAT = 2011;

  private RunOptionsResolver() {
  }

  static EngineSettings settings(EngineSettings defaults, RunOptions options) {
    int horizon = positive("horizon", options.horizon(), defaults.horizon(), HORIZON);
    int nFolds = positive("n_folds", options.nFolds(), defaults.nFolds(), N_FOLDS);
    int stepSize = positive("step_size", options.stepSize(), defaults.stepSize(), STEP_SIZE);
    int minSeriesLength = positive("min_series_length", options.minSeriesLength(),
        defaults.minSeriesLength(), MIN_SERIES_LENGTH);
    int minTrainLength = positive("min_train_length", options.minTrainLength(),
        defaults.minTrainLength(), MIN_TRAIN_LENGTH);
    Duration step = options.step() == null ? defaults.step() : step(options.step());

    List<Double> levels = defaults.levels();
    if (options.levels() != null) {
      try {
        levels = IntervalLevels.normalize(options.levels());
      } catch (IllegalArgumentException ex) {
        throw new InvalidParameterException("levels", ex.getMessage(), LEVELS);
      }
    }
    double alertLevel = defaults.alertLevel();
    if (options.alertLevel() != null) {
      try {
        alertLevel = IntervalLevels.normalize(options.alertLevel());
      } catch (IllegalArgumentException ex) {
        throw new InvalidParameterException("alert_level", ex.getMessage(), ALERT_LEVEL);
      }
    }
    return new EngineSettings(horizon, levels, nFolds, stepSize, minSeriesLength, minTrainLength,
        step, alertLevel, defaults.strictQuantiles());
  }

  /** Null when the request names no models, leaving the choice to the caller. */
  static List<ModelKind> models(ModelRegistry registry, List<String> ids) {
    if (ids == null || ids.isEmpty()) {
      return null;
    }
    try {
      return registry.resolveAll(ids);
    } catch (IllegalArgumentException ex) {
      throw new InvalidParameterException("models",
          ex.getMessage() + ". Supported values: " + supported(registry) + ".", MODELS);
    }
  }

  static CapacityThreshold threshold(ThresholdRequest request) {
    if (request == null) {
      throw new InvalidParameterException("threshold", "A capacity threshold is required.",
          THRESHOLD);
    }
    boolean absolute = request.capacity() != null
        || (request.perSeries() != null && !request.perSeries().isEmpty());
    boolean relative = request.relative() != null;
    if (absolute == relative) {
      throw new InvalidParameterException("threshold",
          "Give either capacity/per_series or relative, not both or neither.", THRESHOLD);
    }
    if (relative) {
      return CapacityThreshold.relative(finite("relative", request.relative()));
    }
    if (request.perSeries() == null) {
      return CapacityThreshold.absolute(finite("capacity", request.capacity()));
    }
    request.perSeries().forEach((seriesId, value) -> finite("per_series." + seriesId, value));
    return CapacityThreshold.perSeries(request.perSeries(),
        request.capacity() == null ? null : finite("capacity", request.capacity()));
  }

  private static double finite(String name, Double value) {
    if (value == null || !Double.isFinite(value) || value <= 0d) {
      throw new InvalidParameterException("threshold",
          "Invalid threshold " + name + ". Must be a positive number.", THRESHOLD);
    }
    return value;
  }

  private static int positive(String name, Integer value, int fallback, int code) {
    if (value == null) {
      return fallback;
    }
    if (value < 1) {
      throw new InvalidParameterException(name,
          "Invalid " + name + " parameter. Must be greater than or equal to 1.", code);
    }
    return value;
  }

  private static Duration step(String value) {
    try {
      Duration step = Duration.parse(value);
      if (step.isZero() || step.isNegative()) {
        throw new InvalidParameterException("step", "Invalid step. Must be a positive duration.",
            STEP);
      }
      return step;
    } catch (DateTimeParseException ex) {
      throw new InvalidParameterException("step",
          "Invalid step. Expected an ISO-8601 duration such as P1D or PT1H.", STEP);
    }
  }

  private static String supported(ModelRegistry registry) {
    return String.join(",", registry.registered().stream().map(ModelKind::id).toList());
  }
}
