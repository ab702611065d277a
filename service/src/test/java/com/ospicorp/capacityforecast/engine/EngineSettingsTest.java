package com.ospicorp.capacityforecast.engine;

import static org.junit.jupiter.api.Assertions.*;

import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.Test;

class EngineSettingsTest {

  @Test
  void alertLevelIsAlwaysForecast() {
    var settings = new EngineSettings(7, List.of(0.5, 0.8), 2, 7, 20, 5, Duration.ofHours(1),
        0.95, false);

    assertEquals(List.of(50d, 80d, 95d), settings.levels());
    assertEquals(95d, settings.alertLevel());
  }

  @Test
  void nonPositiveValuesAreRejected() {
    assertThrows(IllegalArgumentException.class, () -> new EngineSettings(0, List.of(90d), 3, 7,
        30, 7, Duration.ofDays(1), 90d, false));
    assertThrows(IllegalArgumentException.class, () -> new EngineSettings(14, List.of(90d), 3, 7,
        30, 7, Duration.ZERO, 90d, false));
  }

  @Test
  void expiredDeadlineStopsTheRun() {
    assertTrue(RunControl.withTimeout(Duration.ofSeconds(-1)).isStopped());
    assertFalse(RunControl.unbounded().isStopped());
  }
}
