package com.ospicorp.capacityforecast.web.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.ospicorp.capacityforecast.estimator.QuantileBand;
import com.ospicorp.capacityforecast.forecast.ForecastPoint;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

public record ForecastPointResponse(
    @JsonProperty("series_id") String seriesId,
    Instant timestamp,
    String model,
    double point,
    List<Interval> intervals
) {

  public static ForecastPointResponse of(ForecastPoint point) {
    List<Interval> intervals = new ArrayList<>(point.bands().size());
    for (Map.Entry<Double, QuantileBand> band : point.bands().entrySet()) {
      intervals.add(new Interval(band.getKey(), band.getValue().lower(),
          band.getValue().upper()));
    }
    return new ForecastPointResponse(point.seriesId(), point.timestamp(), point.modelId(),
        point.pointValue(), intervals);
  }

  public record Interval(double level, double lower, double upper) {}
}
