package com.ospicorp.capacityforecast.web.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.ospicorp.capacityforecast.alert.AlertEvent;
import com.ospicorp.capacityforecast.alert.AlertOutcome;
import com.ospicorp.capacityforecast.engine.PipelineOutcome;
import com.ospicorp.capacityforecast.engine.UnitFailure;
import com.ospicorp.capacityforecast.metrics.ModelScore;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

public record AlertResponse(
    DatasetSummary dataset,
    String model,
    double level,
    List<ModelScore> ranking,
    List<AlertEvent> alerts,
    Map<String, Double> thresholds,
    @JsonProperty("skipped_series") List<String> skippedSeries,
    List<UnitFailure> failures,
    boolean incomplete
) {

  public static AlertResponse of(PipelineOutcome outcome, double level) {
    AlertOutcome alerts = outcome.alerts();
    List<UnitFailure> failures = new ArrayList<>(outcome.backtest().failures());
    failures.addAll(outcome.forecast().failures());
    return new AlertResponse(DatasetSummary.of(outcome.backtest().dataset()),
        outcome.backtest().winner().modelId(), level, outcome.backtest().ranking(),
        alerts.events(), alerts.thresholds(), alerts.skippedSeries(), failures,
        outcome.incomplete());
  }
}
