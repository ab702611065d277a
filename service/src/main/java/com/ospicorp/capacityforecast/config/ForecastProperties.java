package com.ospicorp.capacityforecast.config;

import com.ospicorp.capacityforecast.engine.EngineSettings;
import java.time.Duration;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/** Engine defaults under {@code forecast.*}; request bodies may override most of them. */
@ConfigurationProperties(prefix = "forecast")
public record ForecastProperties(
    @DefaultValue("14") int horizon,
    @DefaultValue({"80", "90"}) List<Double> levels,
    @DefaultValue("3") int nFolds,
    @DefaultValue("7") int stepSize,
    @DefaultValue("30") int minSeriesLength,
    @DefaultValue("7") int minTrainLength,
    @DefaultValue("7") int seasonLength,
    @DefaultValue("P1D") Duration step,
    @DefaultValue("90") double alertLevel,
    @DefaultValue("false") boolean strictQuantiles,
    @DefaultValue({"Naive", "SeasonalNaive", "RandomWalkDrift", "HistoricAverage"})
        List<String> models,
    @DefaultValue("PT2M") Duration runTimeout,
    @DefaultValue Worker worker
) {

  public EngineSettings toSettings() {
    return new EngineSettings(horizon, levels, nFolds, stepSize, minSeriesLength, minTrainLength,
        step, alertLevel, strictQuantiles);
  }

  public record Worker(
      @DefaultValue("4") int corePoolSize,
      @DefaultValue("8") int maxPoolSize,
      @DefaultValue("256") int queueCapacity
  ) {}
}
