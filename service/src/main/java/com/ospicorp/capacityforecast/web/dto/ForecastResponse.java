package com.ospicorp.capacityforecast.web.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.ospicorp.capacityforecast.engine.UnitFailure;
import com.ospicorp.capacityforecast.service.ForecastingService.ForecastResult;
import java.util.ArrayList;
import java.util.List;

public record ForecastResponse(
    DatasetSummary dataset,
    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonProperty("selected_by_backtest") String selectedByBacktest,
    List<Double> levels,
    List<ForecastPointResponse> points,
    List<UnitFailure> failures,
    boolean incomplete
) {

  public static ForecastResponse of(ForecastResult result, List<Double> levels) {
    String winner = result.backtest() == null ? null : result.backtest().winner().modelId();
    List<UnitFailure> failures = new ArrayList<>();
    if (result.backtest() != null) {
      failures.addAll(result.backtest().failures());
    }
    failures.addAll(result.run().failures());
    return new ForecastResponse(DatasetSummary.of(result.dataset()), winner, levels,
        result.run().points().stream().map(ForecastPointResponse::of).toList(),
        failures,
        result.run().incomplete() || (result.backtest() != null && result.backtest().incomplete()));
  }
}
