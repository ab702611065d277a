package com.ospicorp.capacityforecast.error;

import java.util.List;

/**
 * Raised when no series survives the minimum-length filter, so nothing can be backtested or
 * forecast. Shortfalls for a single series or fold are reported as unit failures instead.
 */
public class InsufficientHistoryException extends ForecastingException {
  private final List<String> droppedSeries;

  public InsufficientHistoryException(int minSeriesLength, List<String> droppedSeries) {
    super("No series has at least " + minSeriesLength + " observations (dropped "
        + droppedSeries.size() + ")");
    this.droppedSeries = List.copyOf(droppedSeries);
  }

  public List<String> droppedSeries() {
    return droppedSeries;
  }
}
