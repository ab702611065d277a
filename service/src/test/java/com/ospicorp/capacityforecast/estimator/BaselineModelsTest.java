package com.ospicorp.capacityforecast.estimator;

import static org.junit.jupiter.api.Assertions.*;

import com.ospicorp.capacityforecast.error.FitFailureException;
import java.util.List;
import org.junit.jupiter.api.Test;

class BaselineModelsTest {
  private static final double EPS = 1e-9;
  private static final double Z90 = 1.6448536269514722;

  @Test
  void naiveRepeatsLastValue() {
    double[] out = new NaiveModel().fitPredict(new double[] {1, 2, 3, 4}, 3);
    assertArrayEquals(new double[] {4, 4, 4}, out, EPS);
  }

  @Test
  void naiveIntervalsWidenWithTheSquareRootOfTheStep() {
    QuantileForecast forecast = new NaiveModel()
        .fitPredictQuantiles(new double[] {1, 2, 3, 4}, 4, List.of(90d));

    // one-step residuals are all 1, so sigma is 1
    assertEquals(4 + Z90, forecast.band(90d, 0).upper(), 1e-6);
    assertEquals(4 - Z90 * 2, forecast.band(90d, 3).lower(), 1e-6);
  }

  @Test
  void seasonalNaiveRepeatsTheLastSeason() {
    double[] out = new SeasonalNaiveModel(3).fitPredict(new double[] {1, 2, 3, 4, 5, 6}, 4);
    assertArrayEquals(new double[] {4, 5, 6, 4}, out, EPS);
  }

  @Test
  void seasonalNaiveNeedsMoreThanOneSeason() {
    var model = new SeasonalNaiveModel(7);
    assertThrows(FitFailureException.class, () -> model.fitPredict(new double[7], 2));
  }

  @Test
  void driftExtendsTheAverageChange() {
    double[] out = new RandomWalkDriftModel().fitPredict(new double[] {1, 2, 3, 4, 5}, 2);
    assertArrayEquals(new double[] {6, 7}, out, EPS);
  }

  @Test
  void historicAverageForecastsTheMean() {
    double[] out = new HistoricAverageModel().fitPredict(new double[] {2, 4, 6}, 2);
    assertArrayEquals(new double[] {4, 4}, out, EPS);
  }

  @Test
  void everyBaselineBracketsItsPointForecast() {
    double[] history = new double[30];
    for (int i = 0; i < history.length; i++) {
      history[i] = 50 + (i % 7) * 3 + i * 0.2;
    }
    List<ForecastModel> models = List.of(new NaiveModel(), new SeasonalNaiveModel(7),
        new RandomWalkDriftModel(), new HistoricAverageModel());
    for (ForecastModel model : models) {
      QuantileForecast forecast = model.fitPredictQuantiles(history, 14, List.of(80d, 90d));
      for (int step = 0; step < 14; step++) {
        QuantileBand inner = forecast.band(80d, step);
        QuantileBand outer = forecast.band(90d, step);
        assertTrue(inner.brackets(forecast.point(step)), model.id());
        assertTrue(outer.lower() <= inner.lower() && inner.upper() <= outer.upper(), model.id());
      }
    }
  }

  @Test
  void nonFiniteHistoryIsAFitFailure() {
    var model = new NaiveModel();
    assertThrows(FitFailureException.class,
        () -> model.fitPredict(new double[] {1, Double.NaN, 3}, 1));
  }

  @Test
  void nonPositiveHorizonIsRejected() {
    var model = new HistoricAverageModel();
    assertThrows(IllegalArgumentException.class, () -> model.fitPredict(new double[] {1, 2}, 0));
  }
}
