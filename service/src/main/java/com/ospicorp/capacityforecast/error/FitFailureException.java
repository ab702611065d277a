package com.ospicorp.capacityforecast.error;

public class FitFailureException extends ForecastingException {
  private final String modelId;

  public FitFailureException(String modelId, String message) {
    super(message);
    this.modelId = modelId;
  }

  public FitFailureException(String modelId, String message, Throwable cause) {
    super(message, cause);
    this.modelId = modelId;
  }

  public String modelId() {
    return modelId;
  }
}
