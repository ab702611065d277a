package com.ospicorp.capacityforecast.web.dto;

import com.ospicorp.capacityforecast.backtest.Fold;
import com.ospicorp.capacityforecast.engine.BacktestOutcome;
import com.ospicorp.capacityforecast.engine.UnitFailure;
import com.ospicorp.capacityforecast.metrics.ModelScore;
import java.util.List;
import java.util.Map;

public record BacktestResponse(
    DatasetSummary dataset,
    String winner,
    List<ModelScore> ranking,
    Map<String, List<Fold>> folds,
    List<UnitFailure> failures,
    boolean incomplete
) {

  public static BacktestResponse of(BacktestOutcome outcome) {
    return new BacktestResponse(DatasetSummary.of(outcome.dataset()),
        outcome.winner().modelId(), outcome.ranking(), outcome.folds(), outcome.failures(),
        outcome.incomplete());
  }
}
