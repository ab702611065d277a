package com.ospicorp.capacityforecast.series.service;

import com.ospicorp.capacityforecast.error.MalformedTimestampException;
import com.ospicorp.capacityforecast.series.model.Observation;
import com.ospicorp.capacityforecast.series.model.RawObservation;
import com.ospicorp.capacityforecast.series.model.SeriesDataset;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class SeriesPreparer {
  private static final Logger log = LoggerFactory.getLogger(SeriesPreparer.class);

  private SeriesPreparer() {
  }

  public static SeriesDataset prepare(List<RawObservation> rows, int minSeriesLength) {
    if (minSeriesLength < 1) {
      throw new IllegalArgumentException("min_series_length must be positive");
    }
    Map<String, List<Observation>> grouped = new TreeMap<>();
    for (RawObservation row : rows) {
      if (row == null) {
        throw new IllegalArgumentException("rows must not contain null entries");
      }
      if (row.seriesId() == null || row.seriesId().isBlank()) {
        throw new IllegalArgumentException("series_id is required on every row");
      }
      if (row.value() == null) {
        throw new IllegalArgumentException("Missing value in series " + row.seriesId()
            + " at " + row.timestamp());
      }
      Instant timestamp = TimestampParser.tryParse(row.timestamp())
          .orElseThrow(() -> new MalformedTimestampException(row.seriesId(), row.timestamp(), null));
      grouped.computeIfAbsent(row.seriesId(), id -> new ArrayList<>())
          .add(new Observation(row.seriesId(), timestamp, row.value(), row.capacity()));
    }

    Map<String, List<Observation>> kept = new TreeMap<>();
    List<String> dropped = new ArrayList<>();
    List<String> warnings = new ArrayList<>();
    for (var entry : grouped.entrySet()) {
      List<Observation> observations = entry.getValue();
      if (observations.size() < minSeriesLength) {
        dropped.add(entry.getKey());
        continue;
      }
      observations.sort(Comparator.comparing(Observation::timestamp));
      int duplicates = countDuplicateTimestamps(observations);
      if (duplicates > 0) {
        warnings.add("Series " + entry.getKey() + " has " + duplicates + " duplicate timestamp(s)");
      }
      kept.put(entry.getKey(), observations);
    }

    log.debug("Prepared {} series from {} rows; dropped {} below {} observations",
        kept.size(), rows.size(), dropped.size(), minSeriesLength);
    return new SeriesDataset(kept, dropped, warnings, minSeriesLength);
  }

  private static int countDuplicateTimestamps(List<Observation> sorted) {
    int duplicates = 0;
    for (int i = 1; i < sorted.size(); i++) {
      if (sorted.get(i).timestamp().equals(sorted.get(i - 1).timestamp())) {
        duplicates++;
      }
    }
    return duplicates;
  }
}
