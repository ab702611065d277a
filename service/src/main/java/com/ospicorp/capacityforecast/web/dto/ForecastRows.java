package com.ospicorp.capacityforecast.web.dto;

import com.ospicorp.capacityforecast.estimator.IntervalLevels;
import com.ospicorp.capacityforecast.estimator.QuantileBand;
import com.ospicorp.capacityforecast.forecast.ForecastPoint;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Flattens forecast points to CSV rows: one row per point, two columns per level. */
public final class ForecastRows {
  private ForecastRows() {
  }

  public static List<Map<String, Object>> of(List<ForecastPoint> points, List<Double> levels) {
    List<Map<String, Object>> rows = new ArrayList<>(points.size());
    for (ForecastPoint point : points) {
      Map<String, Object> row = new LinkedHashMap<>();
      row.put("series_id", point.seriesId());
      row.put("timestamp", point.timestamp().toString());
      row.put("model", point.modelId());
      row.put("point", point.pointValue());
      for (Double level : levels) {
        QuantileBand band = point.band(level);
        String label = IntervalLevels.label(level);
        row.put("lower_" + label, band == null ? null : band.lower());
        row.put("upper_" + label, band == null ? null : band.upper());
      }
      rows.add(row);
    }
    return rows;
  }
}
