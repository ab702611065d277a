package com.ospicorp.capacityforecast.estimator;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import org.junit.jupiter.api.Test;

class IntervalLevelsTest {

  @Test
  void fractionsBecomePercentages() {
    assertEquals(List.of(80d, 90d), IntervalLevels.normalize(List.of(0.9, 0.8)));
  }

  @Test
  void percentagesAreSortedAndDeduplicated() {
    assertEquals(List.of(50d, 95d), IntervalLevels.normalize(List.of(95d, 50d, 95d)));
  }

  @Test
  void mixedScalesAreRejected() {
    assertThrows(IllegalArgumentException.class,
        () -> IntervalLevels.normalize(List.of(0.9, 80d)));
  }

  @Test
  void outOfRangeLevelsAreRejected() {
    assertThrows(IllegalArgumentException.class, () -> IntervalLevels.normalize(List.of(100d)));
    assertThrows(IllegalArgumentException.class, () -> IntervalLevels.normalize(List.of()));
  }

  @Test
  void labelsDropTrailingZeros() {
    assertEquals("90", IntervalLevels.label(90d));
    assertEquals("97.5", IntervalLevels.label(97.5d));
  }
}
