package com.ospicorp.capacityforecast.engine;

import com.ospicorp.capacityforecast.alert.AlertOutcome;
import com.ospicorp.capacityforecast.forecast.ForecastRun;

public record PipelineOutcome(BacktestOutcome backtest, ForecastRun forecast, AlertOutcome alerts) {

  public boolean incomplete() {
    return backtest.incomplete() || forecast.incomplete();
  }
}
