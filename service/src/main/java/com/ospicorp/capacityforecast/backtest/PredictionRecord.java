package com.ospicorp.capacityforecast.backtest;

import java.time.Instant;
import java.util.Comparator;

/**
 * A single backtest prediction against its actual value. {@code predictedUpper} is the upper
 * bound at the alert level and is only present when the dataset carries capacity and the model
 * produces intervals.
 */
public record PredictionRecord(
    String seriesId,
    String modelId,
    Instant cutoff,
    int step,
    Instant timestamp,
    double predicted,
    double actual,
    Double predictedUpper,
    Double capacity
) {

  public static final Comparator<PredictionRecord> ORDER = Comparator
      .comparing(PredictionRecord::modelId)
      .thenComparing(PredictionRecord::seriesId)
      .thenComparing(PredictionRecord::cutoff)
      .thenComparingInt(PredictionRecord::step);
}
