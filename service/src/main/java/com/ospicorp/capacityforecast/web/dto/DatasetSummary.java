package com.ospicorp.capacityforecast.web.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.ospicorp.capacityforecast.series.model.SeriesDataset;
import java.time.Instant;
import java.util.List;

public record DatasetSummary(
    @JsonProperty("n_series") int seriesCount,
    @JsonProperty("n_observations") int observationCount,
    Instant start,
    Instant end,
    @JsonProperty("has_capacity") boolean hasCapacity,
    @JsonProperty("dropped_series") List<String> droppedSeries,
    List<String> warnings
) {

  public static DatasetSummary of(SeriesDataset dataset) {
    return new DatasetSummary(dataset.seriesCount(), dataset.observationCount(), dataset.start(),
        dataset.end(), dataset.hasCapacity(), dataset.droppedSeries(), dataset.warnings());
  }
}
