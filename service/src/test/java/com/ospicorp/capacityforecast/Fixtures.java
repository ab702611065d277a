package com.ospicorp.capacityforecast;

import com.ospicorp.capacityforecast.series.model.RawObservation;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.function.IntToDoubleFunction;

public final class Fixtures {
  public static final LocalDate START = LocalDate.of(2024, 1, 1);

  private Fixtures() {
  }

  public static List<RawObservation> daily(String seriesId, int length, IntToDoubleFunction value) {
    return daily(seriesId, length, value, null);
  }

  public static List<RawObservation> daily(String seriesId, int length, IntToDoubleFunction value,
      Double capacity) {
    List<RawObservation> rows = new ArrayList<>(length);
    for (int i = 0; i < length; i++) {
      rows.add(new RawObservation(seriesId, START.plusDays(i).toString(),
          value.applyAsDouble(i), capacity));
    }
    return rows;
  }

  /** Weekly pattern around a gentle upward trend. */
  public static double weekly(int day) {
    return 100d + day * 0.5d + 10d * Math.sin(2 * Math.PI * day / 7d);
  }

  @SafeVarargs
  public static List<RawObservation> concat(List<RawObservation>... parts) {
    List<RawObservation> rows = new ArrayList<>();
    for (List<RawObservation> part : parts) {
      rows.addAll(part);
    }
    return rows;
  }
}
