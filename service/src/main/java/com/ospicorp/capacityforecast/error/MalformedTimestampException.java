package com.ospicorp.capacityforecast.error;

public class MalformedTimestampException extends ForecastingException {
  private final String seriesId;
  private final String rawValue;

  public MalformedTimestampException(String seriesId, String rawValue, Throwable cause) {
    super("Unparsable timestamp '" + rawValue + "' in series " + seriesId, cause);
    this.seriesId = seriesId;
    this.rawValue = rawValue;
  }

  public String seriesId() {
    return seriesId;
  }

  public String rawValue() {
    return rawValue;
  }
}
