package com.ospicorp.capacityforecast.forecast;

import com.ospicorp.capacityforecast.engine.EngineSettings;
import com.ospicorp.capacityforecast.engine.RunControl;
import com.ospicorp.capacityforecast.engine.UnitExecution;
import com.ospicorp.capacityforecast.engine.UnitFailure;
import com.ospicorp.capacityforecast.error.FitFailureException;
import com.ospicorp.capacityforecast.error.QuantileOrderingViolationException;
import com.ospicorp.capacityforecast.estimator.ForecastModel;
import com.ospicorp.capacityforecast.estimator.ModelKind;
import com.ospicorp.capacityforecast.estimator.ModelRegistry;
import com.ospicorp.capacityforecast.estimator.QuantileBand;
import com.ospicorp.capacityforecast.estimator.QuantileForecast;
import com.ospicorp.capacityforecast.series.model.Observation;
import com.ospicorp.capacityforecast.series.model.SeriesDataset;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.concurrent.Executor;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Refits the chosen model(s) on the full history of every series and forecasts the horizon with
 * interval bands. Series are independent: a failure on one is recorded and the rest carry on.
 */
public class ForecastGenerator {
  private static final Logger log = LoggerFactory.getLogger(ForecastGenerator.class);

  private final EngineSettings settings;
  private final ModelRegistry registry;
  private final Executor executor;

  public ForecastGenerator(EngineSettings settings, ModelRegistry registry, Executor executor) {
    this.settings = settings;
    this.registry = registry;
    this.executor = executor;
  }

  public ForecastRun generate(SeriesDataset dataset, List<ModelKind> models, RunControl control) {
    List<String> seriesIds = new ArrayList<>(dataset.seriesIds());
    List<Supplier<SeriesResult>> units = new ArrayList<>(seriesIds.size());
    for (String seriesId : seriesIds) {
      units.add(() -> forecastSeries(seriesId, dataset.series(seriesId),
          dataset.values(seriesId), models, control));
    }
    List<SeriesResult> results = UnitExecution.runAll(units, executor);

    SortedMap<String, List<ForecastPoint>> bySeries = new TreeMap<>();
    List<UnitFailure> failures = new ArrayList<>();
    boolean incomplete = false;
    for (int i = 0; i < seriesIds.size(); i++) {
      SeriesResult result = results.get(i);
      if (!result.points().isEmpty()) {
        bySeries.put(seriesIds.get(i), result.points());
      }
      failures.addAll(result.failures());
      incomplete |= !result.ran();
    }
    failures.sort(UnitFailure.ORDER);

    log.info("Forecast {} of {} series with {} ({} failures{})", bySeries.size(),
        seriesIds.size(), models.stream().map(ModelKind::id).toList(), failures.size(),
        incomplete ? ", incomplete" : "");
    return new ForecastRun(Collections.unmodifiableSortedMap(bySeries), List.copyOf(failures),
        incomplete);
  }

  private SeriesResult forecastSeries(String seriesId, List<Observation> series, double[] values,
      List<ModelKind> models, RunControl control) {
    if (control.isStopped()) {
      List<UnitFailure> cancelled = models.stream()
          .map(kind -> UnitFailure.cancelled(seriesId, kind.id()))
          .toList();
      return new SeriesResult(List.of(), cancelled, false);
    }
    Instant last = series.get(series.size() - 1).timestamp();
    List<ForecastPoint> points = new ArrayList<>();
    List<UnitFailure> failures = new ArrayList<>();
    for (ModelKind kind : models) {
      ForecastModel model = registry.create(kind);
      try {
        points.addAll(forecastWith(model, kind, seriesId, values, last));
      } catch (FitFailureException ex) {
        log.debug("Forecast fit failed for series {} model {}: {}", seriesId, kind.id(),
            ex.getMessage());
        failures.add(UnitFailure.fitFailure(seriesId, kind.id(), last, ex.getMessage()));
      } catch (QuantileOrderingViolationException ex) {
        if (settings.strictQuantiles()) {
          throw ex;
        }
        log.error("Dropping forecast of series {} by {}: {}", seriesId, kind.id(),
            ex.getMessage());
        failures.add(new UnitFailure(UnitFailure.Kind.QUANTILE_ORDERING, seriesId, kind.id(),
            last, ex.getMessage()));
      }
    }
    return new SeriesResult(List.copyOf(points), failures, true);
  }

  private List<ForecastPoint> forecastWith(ForecastModel model, ModelKind kind, String seriesId,
      double[] values, Instant last) {
    int horizon = settings.horizon();
    List<ForecastPoint> points = new ArrayList<>(horizon);
    if (!model.supportsQuantiles()) {
      double[] predicted = model.fitPredict(values, horizon);
      requireHorizon(kind, predicted.length);
      for (int i = 0; i < horizon; i++) {
        points.add(ForecastPoint.pointOnly(seriesId, stepAt(last, i + 1), kind.id(),
            predicted[i]));
      }
      return points;
    }

    QuantileForecast forecast = model.fitPredictQuantiles(values, horizon, settings.levels());
    requireHorizon(kind, forecast.horizon());
    for (int i = 0; i < horizon; i++) {
      Instant timestamp = stepAt(last, i + 1);
      double point = forecast.point(i);
      SortedMap<Double, QuantileBand> bands = new TreeMap<>();
      for (double level : settings.levels()) {
        QuantileBand band = forecast.band(level, i);
        if (!band.brackets(point)) {
          throw new QuantileOrderingViolationException(seriesId, kind.id(), timestamp, level,
              band.lower(), point, band.upper());
        }
        bands.put(level, band);
      }
      points.add(new ForecastPoint(seriesId, timestamp, kind.id(), point, bands));
    }
    return points;
  }

  private void requireHorizon(ModelKind kind, int produced) {
    if (produced != settings.horizon()) {
      throw new FitFailureException(kind.id(), "Expected " + settings.horizon()
          + " forecast steps, got " + produced);
    }
  }

  private Instant stepAt(Instant last, int steps) {
    return last.plus(settings.step().multipliedBy(steps));
  }

  private record SeriesResult(List<ForecastPoint> points, List<UnitFailure> failures,
      boolean ran) {}
}
