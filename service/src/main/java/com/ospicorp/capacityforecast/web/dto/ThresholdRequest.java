package com.ospicorp.capacityforecast.web.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Map;

/**
 * Exactly one of {@code capacity}/{@code per_series} (absolute values, {@code capacity} acting
 * as the fallback for unlisted series) or {@code relative} (multiplier of the latest observed
 * capacity) must be given.
 */
public record ThresholdRequest(
    Double capacity,
    @JsonProperty("per_series") Map<String, Double> perSeries,
    Double relative
) {}
