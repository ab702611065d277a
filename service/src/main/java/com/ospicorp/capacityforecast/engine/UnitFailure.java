package com.ospicorp.capacityforecast.engine;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;
import java.util.Comparator;

/** One entry of the failure manifest returned next to partial results. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record UnitFailure(
    Kind kind,
    @JsonProperty("series_id") String seriesId,
    @JsonProperty("model_id") String modelId,
    Instant cutoff,
    String reason
) {

  public static final Comparator<UnitFailure> ORDER = Comparator
      .comparing(UnitFailure::seriesId, Comparator.nullsFirst(Comparator.naturalOrder()))
      .thenComparing(UnitFailure::modelId, Comparator.nullsFirst(Comparator.naturalOrder()))
      .thenComparing(UnitFailure::cutoff, Comparator.nullsFirst(Comparator.naturalOrder()))
      .thenComparing(UnitFailure::kind);

  public enum Kind {
    INSUFFICIENT_HISTORY,
    FIT_FAILURE,
    QUANTILE_ORDERING,
    CANCELLED
  }

  public static UnitFailure insufficientHistory(String seriesId, Instant cutoff, String reason) {
    return new UnitFailure(Kind.INSUFFICIENT_HISTORY, seriesId, null, cutoff, reason);
  }

  public static UnitFailure fitFailure(String seriesId, String modelId, Instant cutoff,
      String reason) {
    return new UnitFailure(Kind.FIT_FAILURE, seriesId, modelId, cutoff, reason);
  }

  public static UnitFailure cancelled(String seriesId, String modelId) {
    return new UnitFailure(Kind.CANCELLED, seriesId, modelId, null, "Run stopped before this unit");
  }
}
