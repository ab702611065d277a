package com.ospicorp.capacityforecast.engine;

import com.ospicorp.capacityforecast.alert.AlertEvaluator;
import com.ospicorp.capacityforecast.alert.AlertOutcome;
import com.ospicorp.capacityforecast.alert.AlertSpec;
import com.ospicorp.capacityforecast.alert.CapacityThreshold;
import com.ospicorp.capacityforecast.backtest.RollingOriginValidator;
import com.ospicorp.capacityforecast.backtest.ValidationRun;
import com.ospicorp.capacityforecast.error.InsufficientHistoryException;
import com.ospicorp.capacityforecast.error.NoScorableModelException;
import com.ospicorp.capacityforecast.estimator.ModelKind;
import com.ospicorp.capacityforecast.estimator.ModelRegistry;
import com.ospicorp.capacityforecast.forecast.ForecastGenerator;
import com.ospicorp.capacityforecast.forecast.ForecastRun;
import com.ospicorp.capacityforecast.metrics.MetricsCalculator;
import com.ospicorp.capacityforecast.metrics.ModelScore;
import com.ospicorp.capacityforecast.selection.ModelSelector;
import com.ospicorp.capacityforecast.selection.Selection;
import com.ospicorp.capacityforecast.series.model.RawObservation;
import com.ospicorp.capacityforecast.series.model.SeriesDataset;
import com.ospicorp.capacityforecast.series.service.SeriesPreparer;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Executor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * One configured pipeline: prepare, backtest, select, forecast, alert. Build a new engine for
 * each distinct configuration; engines share nothing but the executor they are given.
 */
public class ForecastingEngine {
  private static final Logger log = LoggerFactory.getLogger(ForecastingEngine.class);

  private final EngineSettings settings;
  private final ModelRegistry registry;
  private final RollingOriginValidator validator;
  private final ForecastGenerator generator;

  public ForecastingEngine(EngineSettings settings, ModelRegistry registry, Executor executor) {
    this.settings = settings;
    this.registry = registry;
    this.validator = new RollingOriginValidator(settings, registry, executor);
    this.generator = new ForecastGenerator(settings, registry, executor);
  }

  public SeriesDataset prepare(List<RawObservation> rows) {
    SeriesDataset dataset = SeriesPreparer.prepare(rows, settings.minSeriesLength());
    if (dataset.isEmpty()) {
      throw new InsufficientHistoryException(settings.minSeriesLength(), dataset.droppedSeries());
    }
    if (!dataset.droppedSeries().isEmpty()) {
      log.info("Dropped {} series shorter than {} observations: {}",
          dataset.droppedSeries().size(), settings.minSeriesLength(), dataset.droppedSeries());
    }
    return dataset;
  }

  public BacktestOutcome backtest(SeriesDataset dataset, List<ModelKind> models,
      RunControl control) {
    requireModels(models);
    ValidationRun run = validator.validate(dataset, models, control);
    List<ModelScore> scores = MetricsCalculator.score(run.records(), dataset.hasCapacity());
    if (scores.isEmpty()) {
      throw new NoScorableModelException(run.incomplete()
          ? "Run stopped before any model could be scored"
          : "Every model failed on every fold", run.failures());
    }
    Selection selection = ModelSelector.select(scores);
    log.info("Backtest winner {} (wape={}) among {}", selection.winner().modelId(),
        selection.winner().wape(), scores.size());
    return new BacktestOutcome(dataset, selection.winner(), selection.ranking(), run.folds(),
        run.failures(), run.incomplete());
  }

  public ForecastRun forecast(SeriesDataset dataset, List<ModelKind> models, RunControl control) {
    requireModels(models);
    return generator.generate(dataset, models, control);
  }

  public AlertOutcome evaluateAlerts(ForecastRun forecast, SeriesDataset dataset, AlertSpec spec) {
    return AlertEvaluator.evaluate(forecast.points(), dataset, spec);
  }

  /** Backtests the candidates, forecasts with the winner and checks its alert-level band. */
  public PipelineOutcome run(List<RawObservation> rows, List<ModelKind> candidates,
      CapacityThreshold threshold, Set<String> seriesFilter, RunControl control) {
    SeriesDataset dataset = prepare(rows);
    BacktestOutcome backtest = backtest(dataset, candidates, control);
    ModelKind winner = registry.resolve(backtest.winner().modelId());
    ForecastRun forecast = forecast(dataset, List.of(winner), control);
    AlertOutcome alerts = threshold == null
        ? null
        : evaluateAlerts(forecast, dataset,
            new AlertSpec(winner.id(), settings.alertLevel(), threshold, seriesFilter));
    return new PipelineOutcome(backtest, forecast, alerts);
  }

  private static void requireModels(List<ModelKind> models) {
    if (models == null || models.isEmpty()) {
      throw new IllegalArgumentException("At least one model must be requested");
    }
  }
}
