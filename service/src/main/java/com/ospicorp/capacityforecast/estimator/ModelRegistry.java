package com.ospicorp.capacityforecast.estimator;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Maps each model identifier to a factory. Every call to {@link #create} builds a new model, so
 * units of work running in parallel never share an instance.
 */
public final class ModelRegistry {
  private final Map<ModelKind, Supplier<? extends ForecastModel>> factories;

  public ModelRegistry(Map<ModelKind, Supplier<? extends ForecastModel>> factories) {
    if (factories.isEmpty()) {
      throw new IllegalArgumentException("At least one model must be registered");
    }
    this.factories = Collections.unmodifiableMap(new EnumMap<>(factories));
  }

  public static ModelRegistry baselines(int seasonLength) {
    Map<ModelKind, Supplier<? extends ForecastModel>> factories = new EnumMap<>(ModelKind.class);
    factories.put(ModelKind.NAIVE, NaiveModel::new);
    factories.put(ModelKind.SEASONAL_NAIVE, () -> new SeasonalNaiveModel(seasonLength));
    factories.put(ModelKind.RANDOM_WALK_DRIFT, RandomWalkDriftModel::new);
    factories.put(ModelKind.HISTORIC_AVERAGE, HistoricAverageModel::new);
    return new ModelRegistry(factories);
  }

  public ForecastModel create(ModelKind kind) {
    Supplier<? extends ForecastModel> factory = factories.get(kind);
    if (factory == null) {
      throw new IllegalArgumentException("Model not registered: " + kind.id());
    }
    return factory.get();
  }

  public ModelKind resolve(String id) {
    ModelKind kind = ModelKind.fromId(id);
    if (!factories.containsKey(kind)) {
      throw new IllegalArgumentException("Model not registered: " + kind.id());
    }
    return kind;
  }

  public List<ModelKind> resolveAll(List<String> ids) {
    return ids.stream().map(this::resolve).distinct().sorted().toList();
  }

  public List<ModelKind> registered() {
    return List.copyOf(factories.keySet());
  }
}
