package com.ospicorp.capacityforecast.error;

import java.time.Instant;
import java.util.Locale;

public class QuantileOrderingViolationException extends ForecastingException {

  public QuantileOrderingViolationException(String seriesId, String modelId, Instant timestamp,
      double level, double lower, double point, double upper) {
    super(String.format(Locale.ROOT,
        "Model %s broke lower <= point <= upper for series %s at %s (level %s): %f, %f, %f",
        modelId, seriesId, timestamp, level, lower, point, upper));
  }
}
