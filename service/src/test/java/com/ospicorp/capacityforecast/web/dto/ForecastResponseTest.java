package com.ospicorp.capacityforecast.web.dto;

import static org.assertj.core.api.Assertions.assertThat;

import com.ospicorp.capacityforecast.Fixtures;
import com.ospicorp.capacityforecast.engine.BacktestOutcome;
import com.ospicorp.capacityforecast.engine.UnitFailure;
import com.ospicorp.capacityforecast.forecast.ForecastRun;
import com.ospicorp.capacityforecast.metrics.ModelScore;
import com.ospicorp.capacityforecast.series.model.SeriesDataset;
import com.ospicorp.capacityforecast.series.service.SeriesPreparer;
import com.ospicorp.capacityforecast.service.ForecastingService.ForecastResult;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import org.junit.jupiter.api.Test;

class ForecastResponseTest {
  private static final Instant CUTOFF = Instant.parse("2024-01-20T00:00:00Z");

  private static SeriesDataset dataset() {
    return SeriesPreparer.prepare(Fixtures.daily("a", 30, Fixtures::weekly), 30);
  }

  private static BacktestOutcome backtest(SeriesDataset dataset, List<UnitFailure> failures,
      boolean incomplete) {
    ModelScore winner = new ModelScore("Naive", 0.1d, null, 14, 1);
    return new BacktestOutcome(dataset, winner, List.of(winner), Map.of(), failures, incomplete);
  }

  @Test
  void backtestFailuresAreListedWithTheForecast() {
    SeriesDataset dataset = dataset();
    UnitFailure fit = UnitFailure.fitFailure("a", "SeasonalNaive", CUTOFF, "singular fit");
    UnitFailure late = UnitFailure.cancelled("a", "HistoricAverage");
    ForecastRun run = new ForecastRun(new TreeMap<>(), List.of(), false);

    ForecastResponse response = ForecastResponse.of(
        new ForecastResult(dataset, backtest(dataset, List.of(fit, late), true), run),
        List.of(80d, 90d));

    assertThat(response.selectedByBacktest()).isEqualTo("Naive");
    assertThat(response.failures()).containsExactly(fit, late);
    assertThat(response.incomplete()).isTrue();
  }

  @Test
  void forecastFailuresFollowBacktestFailures() {
    SeriesDataset dataset = dataset();
    UnitFailure fit = UnitFailure.fitFailure("a", "SeasonalNaive", CUTOFF, "singular fit");
    UnitFailure refit = UnitFailure.fitFailure("a", "Naive", null, "refit failed");
    ForecastRun run = new ForecastRun(new TreeMap<>(), List.of(refit), false);

    ForecastResponse response = ForecastResponse.of(
        new ForecastResult(dataset, backtest(dataset, List.of(fit), false), run), List.of(90d));

    assertThat(response.failures()).containsExactly(fit, refit);
    assertThat(response.incomplete()).isFalse();
  }

  @Test
  void explicitModelsReportOnlyForecastFailures() {
    UnitFailure refit = UnitFailure.fitFailure("a", "Naive", null, "refit failed");
    ForecastRun run = new ForecastRun(new TreeMap<>(), List.of(refit), false);

    ForecastResponse response = ForecastResponse.of(new ForecastResult(dataset(), null, run),
        List.of(90d));

    assertThat(response.selectedByBacktest()).isNull();
    assertThat(response.failures()).containsExactly(refit);
  }
}
