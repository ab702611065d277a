package com.ospicorp.capacityforecast.error;

import com.ospicorp.capacityforecast.engine.UnitFailure;
import java.util.List;

public class NoScorableModelException extends ForecastingException {
  private final List<UnitFailure> failures;

  public NoScorableModelException(String message, List<UnitFailure> failures) {
    super(message);
    this.failures = List.copyOf(failures);
  }

  public List<UnitFailure> failures() {
    return failures;
  }
}
