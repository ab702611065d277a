package com.ospicorp.capacityforecast.series.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

public record ValidationReport(
    @JsonProperty("is_valid") boolean valid,
    List<String> issues,
    @JsonProperty("n_observations") int observationCount,
    @JsonProperty("series_stats") SeriesStats seriesStats,
    @JsonProperty("has_capacity") boolean hasCapacity
) {

  public record SeriesStats(
      @JsonProperty("n_series") int seriesCount,
      @JsonProperty("min_length") int minLength,
      @JsonProperty("max_length") int maxLength,
      @JsonProperty("avg_length") double averageLength,
      @JsonProperty("below_min_length") int belowMinLength
  ) {}
}
