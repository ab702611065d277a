package com.ospicorp.capacityforecast.web;

import static org.junit.jupiter.api.Assertions.*;

import com.ospicorp.capacityforecast.alert.CapacityThreshold;
import com.ospicorp.capacityforecast.engine.EngineSettings;
import com.ospicorp.capacityforecast.estimator.ModelKind;
import com.ospicorp.capacityforecast.estimator.ModelRegistry;
import com.ospicorp.capacityforecast.web.dto.RunOptions;
import com.ospicorp.capacityforecast.web.dto.ThresholdRequest;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class RunOptionsResolverTest {

  private final EngineSettings defaults = EngineSettings.defaults().withStrictQuantiles(true);

  @Test
  void missingOverridesKeepDefaults() {
    assertEquals(defaults, RunOptionsResolver.settings(defaults, RunOptions.none()));
  }

  @Test
  void overridesReplaceDefaults() {
    var options = new RunOptions(7, List.of(0.5), 2, 3, 20, 5, "PT1H", 95d, null);

    EngineSettings settings = RunOptionsResolver.settings(defaults, options);

    assertEquals(7, settings.horizon());
    assertEquals(List.of(50d, 95d), settings.levels());
    assertEquals(Duration.ofHours(1), settings.step());
    assertTrue(settings.strictQuantiles());
  }

  @Test
  void badStepIsReportedWithItsCode() {
    var options = new RunOptions(null, null, null, null, null, null, "daily", null, null);
    var ex = assertThrows(InvalidParameterException.class,
        () -> RunOptionsResolver.settings(defaults, options));
    assertEquals(RunOptionsResolver.STEP, ex.errorCode());
    assertEquals("step", ex.parameter());
  }

  @Test
  void mixedLevelScalesAreReported() {
    var options = new RunOptions(null, List.of(0.8, 90d), null, null, null, null, null, null, null);
    var ex = assertThrows(InvalidParameterException.class,
        () -> RunOptionsResolver.settings(defaults, options));
    assertEquals(RunOptionsResolver.LEVELS, ex.errorCode());
  }

  @Test
  void noModelsMeansCallerChooses() {
    assertNull(RunOptionsResolver.models(ModelRegistry.baselines(7), List.of()));
    assertEquals(List.of(ModelKind.NAIVE),
        RunOptionsResolver.models(ModelRegistry.baselines(7), List.of("naive")));
  }

  @Test
  void thresholdKinds() {
    assertInstanceOf(CapacityThreshold.Relative.class,
        RunOptionsResolver.threshold(new ThresholdRequest(null, null, 1.2d)));
    assertInstanceOf(CapacityThreshold.Absolute.class,
        RunOptionsResolver.threshold(new ThresholdRequest(100d, Map.of("a", 80d), null)));
    assertThrows(InvalidParameterException.class,
        () -> RunOptionsResolver.threshold(new ThresholdRequest(null, null, null)));
    assertThrows(InvalidParameterException.class,
        () -> RunOptionsResolver.threshold(new ThresholdRequest(-5d, null, null)));
  }
}
