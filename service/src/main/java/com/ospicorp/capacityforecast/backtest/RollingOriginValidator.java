package com.ospicorp.capacityforecast.backtest;

import com.ospicorp.capacityforecast.engine.EngineSettings;
import com.ospicorp.capacityforecast.engine.RunControl;
import com.ospicorp.capacityforecast.engine.UnitExecution;
import com.ospicorp.capacityforecast.engine.UnitFailure;
import com.ospicorp.capacityforecast.error.FitFailureException;
import com.ospicorp.capacityforecast.estimator.ForecastModel;
import com.ospicorp.capacityforecast.estimator.ModelKind;
import com.ospicorp.capacityforecast.estimator.ModelRegistry;
import com.ospicorp.capacityforecast.estimator.QuantileForecast;
import com.ospicorp.capacityforecast.series.model.Observation;
import com.ospicorp.capacityforecast.series.model.SeriesDataset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.Executor;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Scores every requested model against every rolling-origin fold of every series. One unit of
 * work is a (series, model) pair: it builds one model instance and walks all folds of the series.
 */
public class RollingOriginValidator {
  private static final Logger log = LoggerFactory.getLogger(RollingOriginValidator.class);

  private final EngineSettings settings;
  private final ModelRegistry registry;
  private final Executor executor;

  public RollingOriginValidator(EngineSettings settings, ModelRegistry registry, Executor executor) {
    this.settings = settings;
    this.registry = registry;
    this.executor = executor;
  }

  public ValidationRun validate(SeriesDataset dataset, List<ModelKind> models, RunControl control) {
    boolean withCapacity = dataset.hasCapacity();
    Map<String, List<Fold>> folds = new TreeMap<>();
    List<UnitFailure> failures = new ArrayList<>();
    List<UnitKey> keys = new ArrayList<>();
    List<Supplier<UnitResult>> units = new ArrayList<>();

    for (String seriesId : dataset.seriesIds()) {
      List<Observation> series = dataset.series(seriesId);
      FoldPlanner.FoldPlan plan = FoldPlanner.plan(series, settings.horizon(),
          settings.stepSize(), settings.nFolds(), settings.minTrainLength());
      folds.put(seriesId, plan.folds());
      for (int k : plan.skipped()) {
        failures.add(UnitFailure.insufficientHistory(seriesId, null,
            "Fold " + k + " leaves fewer than " + settings.minTrainLength()
                + " training points"));
      }
      if (plan.folds().isEmpty()) {
        continue;
      }
      double[] values = dataset.values(seriesId);
      for (ModelKind kind : models) {
        keys.add(new UnitKey(seriesId, kind.id()));
        units.add(() -> evaluateUnit(seriesId, series, values, kind, plan.folds(), withCapacity,
            control));
      }
    }

    List<UnitResult> results = UnitExecution.runAll(units, executor);
    Map<UnitKey, UnitResult> byKey = new TreeMap<>();
    for (int i = 0; i < keys.size(); i++) {
      byKey.put(keys.get(i), results.get(i));
    }

    List<PredictionRecord> records = new ArrayList<>();
    boolean incomplete = false;
    for (UnitResult result : byKey.values()) {
      records.addAll(result.records());
      failures.addAll(result.failures());
      incomplete |= !result.ran();
    }
    failures.sort(UnitFailure.ORDER);

    log.info("Validated {} series x {} models: {} predictions, {} failures{}",
        dataset.seriesCount(), models.size(), records.size(), failures.size(),
        incomplete ? " (incomplete)" : "");
    return new ValidationRun(List.copyOf(records), List.copyOf(failures), folds, incomplete);
  }

  private UnitResult evaluateUnit(String seriesId, List<Observation> series, double[] values,
      ModelKind kind, List<Fold> folds, boolean withCapacity, RunControl control) {
    if (control.isStopped()) {
      return new UnitResult(List.of(), List.of(UnitFailure.cancelled(seriesId, kind.id())), false);
    }
    ForecastModel model = registry.create(kind);
    boolean withUpper = withCapacity && model.supportsQuantiles();
    List<PredictionRecord> records = new ArrayList<>();
    List<UnitFailure> failures = new ArrayList<>();

    for (Fold fold : folds) {
      double[] train = fold.train(values);
      double[] predicted;
      double[] upper = null;
      try {
        if (withUpper) {
          QuantileForecast forecast = model.fitPredictQuantiles(train, fold.horizon(),
              List.of(settings.alertLevel()));
          predicted = forecast.point();
          upper = new double[fold.horizon()];
          for (int i = 0; i < upper.length; i++) {
            upper[i] = forecast.upper(settings.alertLevel(), i);
          }
        } else {
          predicted = model.fitPredict(train, fold.horizon());
        }
        if (predicted.length != fold.horizon()) {
          throw new FitFailureException(kind.id(), "Expected " + fold.horizon()
              + " predictions, got " + predicted.length);
        }
      } catch (FitFailureException ex) {
        log.debug("Fit failed for series {} model {} at {}: {}", seriesId, kind.id(),
            fold.cutoff(), ex.getMessage());
        failures.add(UnitFailure.fitFailure(seriesId, kind.id(), fold.cutoff(), ex.getMessage()));
        continue;
      }

      for (int i = 0; i < fold.horizon(); i++) {
        Observation actual = series.get(fold.trainLength() + i);
        records.add(new PredictionRecord(seriesId, kind.id(), fold.cutoff(), i + 1,
            actual.timestamp(), predicted[i], actual.value(),
            upper == null ? null : upper[i], actual.capacity()));
      }
    }
    return new UnitResult(records, failures, true);
  }

  private record UnitKey(String seriesId, String modelId) implements Comparable<UnitKey> {
    @Override
    public int compareTo(UnitKey other) {
      int bySeries = seriesId.compareTo(other.seriesId);
      return bySeries != 0 ? bySeries : modelId.compareTo(other.modelId);
    }
  }

  private record UnitResult(List<PredictionRecord> records, List<UnitFailure> failures,
      boolean ran) {}
}
