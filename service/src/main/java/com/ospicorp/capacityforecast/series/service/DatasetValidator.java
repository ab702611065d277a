package com.ospicorp.capacityforecast.series.service;

import com.ospicorp.capacityforecast.series.model.RawObservation;
import com.ospicorp.capacityforecast.series.model.ValidationReport;
import com.ospicorp.capacityforecast.series.model.ValidationReport.SeriesStats;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.IntSummaryStatistics;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

public final class DatasetValidator {
  private DatasetValidator() {
  }

  public static ValidationReport validate(List<RawObservation> rows, int minSeriesLength) {
    List<String> issues = new ArrayList<>();
    int missingIds = 0;
    int missingValues = 0;
    int badTimestamps = 0;
    boolean hasCapacity = false;
    Map<String, Integer> lengths = new TreeMap<>();
    Map<String, Set<Instant>> seen = new TreeMap<>();
    Map<String, Integer> duplicates = new TreeMap<>();

    for (RawObservation row : rows) {
      if (row.seriesId() == null || row.seriesId().isBlank()) {
        missingIds++;
        continue;
      }
      lengths.merge(row.seriesId(), 1, Integer::sum);
      if (row.value() == null) {
        missingValues++;
      }
      if (row.capacity() != null) {
        hasCapacity = true;
      }
      var timestamp = TimestampParser.tryParse(row.timestamp());
      if (timestamp.isEmpty()) {
        badTimestamps++;
      } else if (!seen.computeIfAbsent(row.seriesId(), id -> new HashSet<>())
          .add(timestamp.get())) {
        duplicates.merge(row.seriesId(), 1, Integer::sum);
      }
    }

    if (rows.isEmpty()) {
      issues.add("Dataset is empty");
    }
    if (missingIds > 0) {
      issues.add("Found " + missingIds + " rows without series_id");
    }
    if (missingValues > 0) {
      issues.add("Found " + missingValues + " null values in target variable 'value'");
    }
    if (badTimestamps > 0) {
      issues.add("Could not parse " + badTimestamps + " timestamp(s)");
    }
    duplicates.forEach((id, count) ->
        issues.add("Series " + id + " has " + count + " duplicate timestamp(s)"));

    IntSummaryStatistics stats = lengths.values().stream()
        .mapToInt(Integer::intValue)
        .summaryStatistics();
    int belowMin = (int) lengths.values().stream().filter(n -> n < minSeriesLength).count();
    SeriesStats seriesStats = lengths.isEmpty()
        ? new SeriesStats(0, 0, 0, 0d, 0)
        : new SeriesStats(lengths.size(), stats.getMin(), stats.getMax(), stats.getAverage(),
            belowMin);

    return new ValidationReport(issues.isEmpty(), issues, rows.size(), seriesStats, hasCapacity);
  }
}
