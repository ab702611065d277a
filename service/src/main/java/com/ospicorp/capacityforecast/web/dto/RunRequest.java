package com.ospicorp.capacityforecast.web.dto;

import com.ospicorp.capacityforecast.series.model.RawObservation;
import jakarta.validation.constraints.NotNull;
import java.util.List;

public record RunRequest(
    @NotNull List<@NotNull RawObservation> rows,
    RunOptions options
) {

  public RunOptions optionsOrNone() {
    return options == null ? RunOptions.none() : options;
  }
}
