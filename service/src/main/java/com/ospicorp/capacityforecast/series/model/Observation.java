package com.ospicorp.capacityforecast.series.model;

import java.time.Instant;
import java.util.Objects;

public record Observation(String seriesId, Instant timestamp, double value, Double capacity) {

  public Observation {
    Objects.requireNonNull(seriesId, "seriesId");
    Objects.requireNonNull(timestamp, "timestamp");
  }

  public boolean hasCapacity() {
    return capacity != null;
  }
}
