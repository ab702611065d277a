package com.ospicorp.capacityforecast.web.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import java.util.List;

/** Per-request overrides of the configured engine defaults. Every field is optional. */
public record RunOptions(
    @Schema(example = "14") Integer horizon,
    @Schema(description = "Central interval levels, percentages or fractions") List<Double> levels,
    @JsonProperty("n_folds") Integer nFolds,
    @JsonProperty("step_size") Integer stepSize,
    @JsonProperty("min_series_length") Integer minSeriesLength,
    @JsonProperty("min_train_length") Integer minTrainLength,
    @Schema(description = "ISO-8601 spacing between observations", example = "P1D") String step,
    @JsonProperty("alert_level") Double alertLevel,
    @Schema(description = "Model ids; empty means the configured candidates") List<String> models
) {

  public static RunOptions none() {
    return new RunOptions(null, null, null, null, null, null, null, null, null);
  }
}
