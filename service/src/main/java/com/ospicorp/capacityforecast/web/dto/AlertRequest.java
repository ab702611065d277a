package com.ospicorp.capacityforecast.web.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.ospicorp.capacityforecast.series.model.RawObservation;
import jakarta.validation.constraints.NotNull;
import java.util.List;

public record AlertRequest(
    @NotNull List<@NotNull RawObservation> rows,
    RunOptions options,
    @NotNull ThresholdRequest threshold,
    @JsonProperty("series_ids") List<String> seriesIds
) {

  public RunOptions optionsOrNone() {
    return options == null ? RunOptions.none() : options;
  }
}
