package com.ospicorp.capacityforecast.estimator;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import java.util.Map;
import java.util.function.Supplier;
import org.junit.jupiter.api.Test;

class ModelRegistryTest {

  private final ModelRegistry registry = ModelRegistry.baselines(7);

  @Test
  void identifiersResolveLeniently() {
    assertEquals(ModelKind.SEASONAL_NAIVE, registry.resolve("seasonal_naive"));
    assertEquals(ModelKind.RANDOM_WALK_DRIFT, registry.resolve("RandomWalkDrift"));
    assertEquals(ModelKind.NAIVE, registry.resolve(" naive "));
  }

  @Test
  void unknownIdentifierIsRejected() {
    var ex = assertThrows(IllegalArgumentException.class, () -> registry.resolve("Prophet"));
    assertTrue(ex.getMessage().contains("Prophet"));
  }

  @Test
  void resolveAllDeduplicatesInRegistryOrder() {
    assertEquals(List.of(ModelKind.NAIVE, ModelKind.HISTORIC_AVERAGE),
        registry.resolveAll(List.of("HistoricAverage", "Naive", "naive")));
  }

  @Test
  void everyCreateBuildsAFreshInstance() {
    assertNotSame(registry.create(ModelKind.NAIVE), registry.create(ModelKind.NAIVE));
  }

  @Test
  void unregisteredKindIsRejected() {
    Map<ModelKind, Supplier<? extends ForecastModel>> only = Map.of(ModelKind.NAIVE,
        NaiveModel::new);
    var partial = new ModelRegistry(only);

    assertEquals(List.of(ModelKind.NAIVE), partial.registered());
    assertThrows(IllegalArgumentException.class, () -> partial.resolve("HistoricAverage"));
    assertThrows(IllegalArgumentException.class, () -> partial.create(ModelKind.SEASONAL_NAIVE));
  }
}
