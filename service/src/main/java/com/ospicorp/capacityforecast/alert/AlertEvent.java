package com.ospicorp.capacityforecast.alert;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;

public record AlertEvent(
    @JsonProperty("series_id") String seriesId,
    @JsonProperty("date") Instant timestamp,
    @JsonProperty("predicted_demand") double predictedValue,
    double threshold,
    String message
) {}
