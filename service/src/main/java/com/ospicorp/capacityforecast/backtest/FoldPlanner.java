package com.ospicorp.capacityforecast.backtest;

import com.ospicorp.capacityforecast.series.model.Observation;
import java.util.ArrayList;
import java.util.List;

/**
 * Rolling-origin fold boundaries. For a series of length L the k-th fold trains on the first
 * {@code L - horizon - k * stepSize} points (k = 0 is the most recent origin). Folds leaving fewer
 * than {@code minTrainLength} training points are skipped.
 */
public final class FoldPlanner {
  private FoldPlanner() {
  }

  public record FoldPlan(List<Fold> folds, List<Integer> skipped) {}

  public static FoldPlan plan(List<Observation> series, int horizon, int stepSize, int nFolds,
      int minTrainLength) {
    int length = series.size();
    List<Fold> folds = new ArrayList<>(nFolds);
    List<Integer> skipped = new ArrayList<>();
    for (int k = 0; k < nFolds; k++) {
      int cutoff = length - horizon - k * stepSize;
      if (cutoff - minTrainLength < 0) {
        skipped.add(k);
        continue;
      }
      folds.add(new Fold(k, cutoff, horizon,
          series.get(cutoff - 1).timestamp(),
          series.get(cutoff).timestamp(),
          series.get(cutoff + horizon - 1).timestamp()));
    }
    return new FoldPlan(List.copyOf(folds), List.copyOf(skipped));
  }
}
