package com.ospicorp.capacityforecast.backtest;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;
import java.util.Arrays;

/**
 * One train/test split of a series. {@code trainLength} points end at {@code cutoff}; the test
 * window is the {@code horizon} points that follow.
 */
public record Fold(
    int index,
    @JsonProperty("train_length") int trainLength,
    int horizon,
    Instant cutoff,
    @JsonProperty("test_start") Instant testStart,
    @JsonProperty("test_end") Instant testEnd
) {

  public double[] train(double[] values) {
    return Arrays.copyOf(values, trainLength);
  }

  public double[] test(double[] values) {
    return Arrays.copyOfRange(values, trainLength, trainLength + horizon);
  }
}
