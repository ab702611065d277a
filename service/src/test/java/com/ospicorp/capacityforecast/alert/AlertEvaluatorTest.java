package com.ospicorp.capacityforecast.alert;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.ospicorp.capacityforecast.Fixtures;
import com.ospicorp.capacityforecast.estimator.QuantileBand;
import com.ospicorp.capacityforecast.forecast.ForecastPoint;
import com.ospicorp.capacityforecast.series.model.SeriesDataset;
import com.ospicorp.capacityforecast.series.service.SeriesPreparer;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import org.assertj.core.data.Offset;
import org.junit.jupiter.api.Test;

class AlertEvaluatorTest {
  private static final Instant T1 = Instant.parse("2024-03-01T00:00:00Z");
  private static final Instant T2 = Instant.parse("2024-03-02T00:00:00Z");

  private static ForecastPoint point(String series, Instant at, double point, double upper90) {
    TreeMap<Double, QuantileBand> bands = new TreeMap<>();
    bands.put(90d, new QuantileBand(point - (upper90 - point), upper90));
    return new ForecastPoint(series, at, "Naive", point, bands);
  }

  private static SeriesDataset dataset() {
    return SeriesPreparer.prepare(Fixtures.concat(
        Fixtures.daily("with-cap", 5, i -> 90d, 100d),
        Fixtures.daily("no-cap", 5, i -> 90d)), 1);
  }

  @Test
  void upperBoundAboveCapacityRaisesExactlyOneAlert() {
    var forecasts = List.of(point("with-cap", T1, 100d, 120d), point("with-cap", T2, 90d, 99d));
    var spec = new AlertSpec("Naive", 90d, CapacityThreshold.absolute(100d), null);

    AlertOutcome outcome = AlertEvaluator.evaluate(forecasts, dataset(), spec);

    assertThat(outcome.events()).singleElement().satisfies(event -> {
      assertThat(event.seriesId()).isEqualTo("with-cap");
      assertThat(event.timestamp()).isEqualTo(T1);
      assertThat(event.predictedValue()).isEqualTo(120d);
      assertThat(event.threshold()).isEqualTo(100d);
      assertThat(event.message()).isEqualTo("P90 demand (120.00) exceeds threshold (100.00)");
    });
  }

  @Test
  void boundEqualToThresholdDoesNotAlert() {
    var spec = new AlertSpec("Naive", 90d, CapacityThreshold.absolute(100d), null);
    var outcome = AlertEvaluator.evaluate(List.of(point("with-cap", T1, 90d, 100d)), dataset(),
        spec);
    assertThat(outcome.events()).isEmpty();
  }

  @Test
  void evaluationIsIdempotent() {
    var forecasts = List.of(point("with-cap", T2, 100d, 130d), point("with-cap", T1, 100d, 120d));
    var spec = new AlertSpec("Naive", 0.9d, CapacityThreshold.absolute(100d), null);

    AlertOutcome first = AlertEvaluator.evaluate(forecasts, dataset(), spec);
    AlertOutcome second = AlertEvaluator.evaluate(forecasts, dataset(), spec);

    assertThat(second).isEqualTo(first);
    assertThat(first.events()).extracting(AlertEvent::timestamp).containsExactly(T1, T2);
  }

  @Test
  void relativeThresholdSkipsSeriesWithoutCapacity() {
    var forecasts = List.of(point("with-cap", T1, 100d, 115d), point("no-cap", T1, 100d, 500d));
    var spec = new AlertSpec("Naive", 90d, CapacityThreshold.relative(1.1d), null);

    AlertOutcome outcome = AlertEvaluator.evaluate(forecasts, dataset(), spec);

    assertThat(outcome.thresholds()).containsOnlyKeys("with-cap");
    assertThat(outcome.thresholds().get("with-cap")).isCloseTo(110d,
        Offset.offset(1e-9));
    assertThat(outcome.skippedSeries()).containsExactly("no-cap");
    assertThat(outcome.events()).extracting(AlertEvent::seriesId).containsExactly("with-cap");
  }

  @Test
  void perSeriesThresholdsAndSeriesFilter() {
    var forecasts = List.of(point("with-cap", T1, 100d, 115d), point("no-cap", T1, 100d, 115d));
    var threshold = CapacityThreshold.perSeries(Map.of("no-cap", 110d), null);

    var all = AlertEvaluator.evaluate(forecasts, dataset(),
        new AlertSpec("Naive", 90d, threshold, null));
    var filtered = AlertEvaluator.evaluate(forecasts, dataset(),
        new AlertSpec("Naive", 90d, threshold, Set.of("with-cap")));

    assertThat(all.events()).extracting(AlertEvent::seriesId).containsExactly("no-cap");
    assertThat(all.skippedSeries()).containsExactly("with-cap");
    assertThat(filtered.events()).isEmpty();
  }

  @Test
  void otherModelsAreIgnored() {
    var spec = new AlertSpec("SeasonalNaive", 90d, CapacityThreshold.absolute(100d), null);
    var outcome = AlertEvaluator.evaluate(List.of(point("with-cap", T1, 100d, 200d)), dataset(),
        spec);
    assertThat(outcome.events()).isEmpty();
  }

  @Test
  void missingLevelIsRejected() {
    var spec = new AlertSpec("Naive", 80d, CapacityThreshold.absolute(100d), null);
    assertThatThrownBy(() -> AlertEvaluator.evaluate(List.of(point("with-cap", T1, 100d, 120d)),
        dataset(), spec))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
