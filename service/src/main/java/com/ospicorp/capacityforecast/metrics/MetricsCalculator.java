package com.ospicorp.capacityforecast.metrics;

import com.ospicorp.capacityforecast.backtest.PredictionRecord;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns flat backtest predictions into one score per model. WAPE is a single global ratio over
 * every (series, fold, step) tuple of a model, not an average of per-series ratios.
 */
public final class MetricsCalculator {
  private static final Logger log = LoggerFactory.getLogger(MetricsCalculator.class);

  private MetricsCalculator() {
  }

  public static List<ModelScore> score(List<PredictionRecord> records, boolean capacityPresent) {
    List<PredictionRecord> sorted = new ArrayList<>(records);
    sorted.sort(PredictionRecord.ORDER);

    Map<String, Accumulator> byModel = new TreeMap<>();
    for (PredictionRecord record : sorted) {
      if (!Double.isFinite(record.predicted()) || !Double.isFinite(record.actual())) {
        continue;
      }
      byModel.computeIfAbsent(record.modelId(), id -> new Accumulator()).add(record);
    }

    List<ModelScore> scores = new ArrayList<>(byModel.size());
    for (var entry : byModel.entrySet()) {
      Accumulator acc = entry.getValue();
      Double wape = acc.wape();
      if (wape == null) {
        log.warn("Model {} excluded from scoring: actual values sum to zero but errors do not",
            entry.getKey());
        continue;
      }
      if (!Double.isFinite(wape)) {
        log.warn("Model {} excluded from scoring: error sums overflow ({} / {})",
            entry.getKey(), acc.absoluteError, acc.absoluteActual);
        continue;
      }
      Double breachRate = capacityPresent ? acc.breachRate() : null;
      scores.add(new ModelScore(entry.getKey(), wape, breachRate, acc.pairs, acc.series.size()));
    }
    return List.copyOf(scores);
  }

  private static final class Accumulator {
    private double absoluteError;
    private double absoluteActual;
    private int pairs;
    private int breachChecks;
    private int breachMismatches;
    private final Set<String> series = new HashSet<>();

    void add(PredictionRecord record) {
      absoluteError += Math.abs(record.actual() - record.predicted());
      absoluteActual += Math.abs(record.actual());
      pairs++;
      series.add(record.seriesId());
      if (record.capacity() != null && record.predictedUpper() != null
          && Double.isFinite(record.predictedUpper())) {
        boolean predictedBreach = record.predictedUpper() > record.capacity();
        boolean actualBreach = record.actual() > record.capacity();
        breachChecks++;
        if (predictedBreach != actualBreach) {
          breachMismatches++;
        }
      }
    }

    Double wape() {
      if (absoluteActual > 0d) {
        return absoluteError / absoluteActual;
      }
      return absoluteError == 0d ? 0d : null;
    }

    Double breachRate() {
      return breachChecks == 0 ? null : (double) breachMismatches / breachChecks;
    }
  }
}
