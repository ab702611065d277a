package com.ospicorp.capacityforecast.engine;

import com.ospicorp.capacityforecast.backtest.Fold;
import com.ospicorp.capacityforecast.metrics.ModelScore;
import com.ospicorp.capacityforecast.series.model.SeriesDataset;
import java.util.List;
import java.util.Map;

public record BacktestOutcome(
    SeriesDataset dataset,
    ModelScore winner,
    List<ModelScore> ranking,
    Map<String, List<Fold>> folds,
    List<UnitFailure> failures,
    boolean incomplete
) {}
