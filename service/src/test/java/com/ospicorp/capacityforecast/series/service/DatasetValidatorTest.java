package com.ospicorp.capacityforecast.series.service;

import static org.assertj.core.api.Assertions.assertThat;

import com.ospicorp.capacityforecast.Fixtures;
import com.ospicorp.capacityforecast.series.model.RawObservation;
import com.ospicorp.capacityforecast.series.model.ValidationReport;
import java.util.List;
import org.junit.jupiter.api.Test;

class DatasetValidatorTest {

  @Test
  void emptyDatasetIsInvalid() {
    ValidationReport report = DatasetValidator.validate(List.of(), 30);

    assertThat(report.valid()).isFalse();
    assertThat(report.issues()).containsExactly("Dataset is empty");
    assertThat(report.seriesStats().seriesCount()).isZero();
  }

  @Test
  void cleanDatasetReportsStats() {
    var rows = Fixtures.concat(
        Fixtures.daily("a", 25, i -> i),
        Fixtures.daily("b", 50, i -> i, 120d));

    ValidationReport report = DatasetValidator.validate(rows, 30);

    assertThat(report.valid()).isTrue();
    assertThat(report.issues()).isEmpty();
    assertThat(report.observationCount()).isEqualTo(75);
    assertThat(report.hasCapacity()).isTrue();
    assertThat(report.seriesStats().seriesCount()).isEqualTo(2);
    assertThat(report.seriesStats().minLength()).isEqualTo(25);
    assertThat(report.seriesStats().maxLength()).isEqualTo(50);
    assertThat(report.seriesStats().averageLength()).isEqualTo(37.5d);
    assertThat(report.seriesStats().belowMinLength()).isEqualTo(1);
  }

  @Test
  void collectsEveryProblemInsteadOfStoppingAtTheFirst() {
    var rows = List.of(
        new RawObservation(null, "2024-01-01", 1d, null),
        new RawObservation("a", "2024-01-01", null, null),
        new RawObservation("a", "not-a-date", 2d, null),
        new RawObservation("a", "2024-01-02", 3d, null),
        new RawObservation("a", "2024-01-02", 4d, null));

    ValidationReport report = DatasetValidator.validate(rows, 1);

    assertThat(report.valid()).isFalse();
    assertThat(report.issues()).containsExactly(
        "Found 1 rows without series_id",
        "Found 1 null values in target variable 'value'",
        "Could not parse 1 timestamp(s)",
        "Series a has 1 duplicate timestamp(s)");
  }
}
