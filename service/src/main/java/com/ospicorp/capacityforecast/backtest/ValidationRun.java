package com.ospicorp.capacityforecast.backtest;

import com.ospicorp.capacityforecast.engine.UnitFailure;
import java.util.List;
import java.util.Map;

public record ValidationRun(
    List<PredictionRecord> records,
    List<UnitFailure> failures,
    Map<String, List<Fold>> folds,
    boolean incomplete
) {}
