package com.ospicorp.capacityforecast.series.service;

import static org.junit.jupiter.api.Assertions.*;

import com.ospicorp.capacityforecast.Fixtures;
import com.ospicorp.capacityforecast.error.MalformedTimestampException;
import com.ospicorp.capacityforecast.series.model.Observation;
import com.ospicorp.capacityforecast.series.model.RawObservation;
import com.ospicorp.capacityforecast.series.model.SeriesDataset;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;

class SeriesPreparerTest {

  @Test
  void seriesBelowMinimumLengthAreDropped() {
    var rows = Fixtures.concat(
        Fixtures.daily("short", 25, i -> i),
        Fixtures.daily("long", 50, i -> i));

    SeriesDataset dataset = SeriesPreparer.prepare(rows, 30);

    assertEquals(Set.of("long"), dataset.seriesIds());
    assertEquals(List.of("short"), dataset.droppedSeries());
    assertEquals(50, dataset.observationCount());
  }

  @Test
  void observationsAreSortedByTimestamp() {
    List<RawObservation> rows = new ArrayList<>(Fixtures.daily("a", 10, i -> i));
    Collections.reverse(rows);

    SeriesDataset dataset = SeriesPreparer.prepare(rows, 5);

    List<Observation> series = dataset.series("a");
    for (int i = 1; i < series.size(); i++) {
      assertTrue(series.get(i - 1).timestamp().isBefore(series.get(i).timestamp()));
    }
    assertArrayEquals(new double[] {0, 1, 2, 3, 4, 5, 6, 7, 8, 9}, dataset.values("a"));
  }

  @Test
  void acceptsDateAndDateTimeForms() {
    var rows = List.of(
        new RawObservation("a", "2024-01-01", 1d, null),
        new RawObservation("a", "2024-01-02T00:00:00Z", 2d, null),
        new RawObservation("a", "2024-01-03 00:00:00", 3d, null),
        new RawObservation("a", "2024-01-04T00:00:00+00:00", 4d, null));

    SeriesDataset dataset = SeriesPreparer.prepare(rows, 1);

    assertEquals(Instant.parse("2024-01-01T00:00:00Z"), dataset.start());
    assertEquals(Instant.parse("2024-01-04T00:00:00Z"), dataset.end());
    assertEquals(4, dataset.series("a").size());
  }

  @Test
  void malformedTimestampFailsTheWholeBatch() {
    var rows = List.of(
        new RawObservation("a", "2024-01-01", 1d, null),
        new RawObservation("a", "yesterday", 2d, null));

    var ex = assertThrows(MalformedTimestampException.class,
        () -> SeriesPreparer.prepare(rows, 1));
    assertEquals("a", ex.seriesId());
    assertEquals("yesterday", ex.rawValue());
  }

  @Test
  void duplicateTimestampsAreKeptWithAWarning() {
    var rows = List.of(
        new RawObservation("a", "2024-01-01", 1d, null),
        new RawObservation("a", "2024-01-01", 2d, null),
        new RawObservation("a", "2024-01-02", 3d, null));

    SeriesDataset dataset = SeriesPreparer.prepare(rows, 1);

    assertEquals(3, dataset.series("a").size());
    assertEquals(1, dataset.warnings().size());
  }

  @Test
  void latestCapacityIsTheReference() {
    var rows = List.of(
        new RawObservation("a", "2024-01-01", 1d, 80d),
        new RawObservation("a", "2024-01-02", 1d, 100d),
        new RawObservation("a", "2024-01-03", 1d, null));

    SeriesDataset dataset = SeriesPreparer.prepare(rows, 1);

    assertTrue(dataset.hasCapacity());
    assertEquals(100d, dataset.referenceCapacity("a").getAsDouble());
  }

  @Test
  void missingValueIsRejected() {
    var rows = List.of(new RawObservation("a", "2024-01-01", null, null));
    assertThrows(IllegalArgumentException.class, () -> SeriesPreparer.prepare(rows, 1));
  }

  @Test
  void nullRowIsRejected() {
    List<RawObservation> rows = new ArrayList<>(Fixtures.daily("a", 3, i -> i));
    rows.add(null);

    assertThrows(IllegalArgumentException.class, () -> SeriesPreparer.prepare(rows, 1));
  }
}
