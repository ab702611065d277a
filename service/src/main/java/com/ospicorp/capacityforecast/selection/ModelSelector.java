package com.ospicorp.capacityforecast.selection;

import com.ospicorp.capacityforecast.error.NoScorableModelException;
import com.ospicorp.capacityforecast.metrics.ModelScore;
import java.util.Comparator;
import java.util.List;

/**
 * Lowest WAPE wins. Ties go to the lower capacity breach rate (a computed rate ranks ahead of a
 * missing one), then to the lexicographically smaller model id.
 */
public final class ModelSelector {

  static final Comparator<ModelScore> RANKING = Comparator
      .comparingDouble(ModelScore::wape)
      .thenComparing(ModelScore::capacityBreachRate,
          Comparator.nullsLast(Comparator.naturalOrder()))
      .thenComparing(ModelScore::modelId);

  private ModelSelector() {
  }

  public static Selection select(List<ModelScore> scores) {
    if (scores == null || scores.isEmpty()) {
      throw new NoScorableModelException("No model produced a score", List.of());
    }
    List<ModelScore> ranking = scores.stream().sorted(RANKING).toList();
    return new Selection(ranking.get(0), ranking);
  }
}
