package com.ospicorp.capacityforecast.series.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

// Untyped ingestion row, as uploaded (JSON or CSV)
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"series_id", "timestamp", "value", "capacity"})
public record RawObservation(
    @JsonProperty("series_id") String seriesId,
    @JsonAlias({"ds", "date"}) String timestamp,
    @JsonAlias("y") Double value,
    Double capacity
) {}
