package com.ospicorp.capacityforecast.alert;

import java.util.List;
import java.util.SortedMap;

public record AlertOutcome(
    List<AlertEvent> events,
    SortedMap<String, Double> thresholds,
    List<String> skippedSeries
) {}
