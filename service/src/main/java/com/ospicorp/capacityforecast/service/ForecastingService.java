package com.ospicorp.capacityforecast.service;

import com.ospicorp.capacityforecast.alert.AlertSink;
import com.ospicorp.capacityforecast.alert.CapacityThreshold;
import com.ospicorp.capacityforecast.config.ForecastProperties;
import com.ospicorp.capacityforecast.engine.BacktestOutcome;
import com.ospicorp.capacityforecast.engine.EngineSettings;
import com.ospicorp.capacityforecast.engine.ForecastingEngine;
import com.ospicorp.capacityforecast.engine.PipelineOutcome;
import com.ospicorp.capacityforecast.engine.RunControl;
import com.ospicorp.capacityforecast.estimator.ModelKind;
import com.ospicorp.capacityforecast.estimator.ModelRegistry;
import com.ospicorp.capacityforecast.forecast.ForecastRun;
import com.ospicorp.capacityforecast.series.model.RawObservation;
import com.ospicorp.capacityforecast.series.model.SeriesDataset;
import com.ospicorp.capacityforecast.series.model.ValidationReport;
import com.ospicorp.capacityforecast.series.service.DatasetValidator;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Executor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Request-scoped entry point. Each call builds its own {@link ForecastingEngine} from the
 * resolved settings; only the worker pool and the model registry are shared.
 */
@Service
public class ForecastingService {
  private static final Logger log = LoggerFactory.getLogger(ForecastingService.class);

  private final ForecastProperties properties;
  private final ModelRegistry registry;
  private final Executor executor;
  private final AlertSink alertSink;

  public ForecastingService(ForecastProperties properties, ModelRegistry registry,
      @Qualifier("forecastExecutor") Executor executor, AlertSink alertSink) {
    this.properties = properties;
    this.registry = registry;
    this.executor = executor;
    this.alertSink = alertSink;
  }

  public EngineSettings defaultSettings() {
    return properties.toSettings();
  }

  public List<ModelKind> defaultModels() {
    return registry.resolveAll(properties.models());
  }

  public ModelRegistry registry() {
    return registry;
  }

  public ValidationReport validate(List<RawObservation> rows, EngineSettings settings) {
    ValidationReport report = DatasetValidator.validate(rows, settings.minSeriesLength());
    log.debug("Validated {} rows: valid={}, issues={}", report.observationCount(), report.valid(),
        report.issues().size());
    return report;
  }

  public BacktestOutcome backtest(List<RawObservation> rows, EngineSettings settings,
      List<ModelKind> models) {
    ForecastingEngine engine = engine(settings);
    SeriesDataset dataset = engine.prepare(rows);
    return engine.backtest(dataset, candidates(models), newControl());
  }

  /**
   * Forecasts with the given models, or with the backtest winner among the configured candidates
   * when none are given.
   */
  public ForecastResult forecast(List<RawObservation> rows, EngineSettings settings,
      List<ModelKind> models) {
    ForecastingEngine engine = engine(settings);
    SeriesDataset dataset = engine.prepare(rows);
    RunControl control = newControl();
    BacktestOutcome backtest = null;
    List<ModelKind> selected = models;
    if (selected == null || selected.isEmpty()) {
      backtest = engine.backtest(dataset, defaultModels(), control);
      selected = List.of(registry.resolve(backtest.winner().modelId()));
    }
    ForecastRun run = engine.forecast(dataset, selected, control);
    log.info("Forecast {} series x {} model(s), horizon {}: {} points, {} failures",
        dataset.seriesCount(), selected.size(), settings.horizon(), run.points().size(),
        run.failures().size());
    return new ForecastResult(dataset, backtest, run);
  }

  public PipelineOutcome evaluateAlerts(List<RawObservation> rows, EngineSettings settings,
      List<ModelKind> models, CapacityThreshold threshold, Set<String> seriesFilter) {
    PipelineOutcome outcome = engine(settings)
        .run(rows, candidates(models), threshold, seriesFilter, newControl());
    alertSink.publish(outcome.alerts().events());
    return outcome;
  }

  private ForecastingEngine engine(EngineSettings settings) {
    return new ForecastingEngine(settings, registry, executor);
  }

  private List<ModelKind> candidates(List<ModelKind> models) {
    return models == null || models.isEmpty() ? defaultModels() : models;
  }

  private RunControl newControl() {
    return RunControl.withTimeout(properties.runTimeout());
  }

  public record ForecastResult(SeriesDataset dataset, BacktestOutcome backtest, ForecastRun run) {}
}
