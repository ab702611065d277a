package com.ospicorp.capacityforecast.series.service;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;

/** Parses the timestamp forms accepted on ingestion. Zone-less values are read as UTC. */
public final class TimestampParser {
  private static final List<Function<String, Instant>> FORMS = List.of(
      Instant::parse,
      value -> OffsetDateTime.parse(value).toInstant(),
      value -> LocalDateTime.parse(value.replace(' ', 'T')).toInstant(ZoneOffset.UTC),
      value -> LocalDate.parse(value).atStartOfDay(ZoneOffset.UTC).toInstant());

  private TimestampParser() {
  }

  public static Optional<Instant> tryParse(String text) {
    if (text == null || text.isBlank()) return Optional.empty();
    String value = text.trim();
    for (Function<String, Instant> form : FORMS) {
      Optional<Instant> parsed = attempt(form, value);
      if (parsed.isPresent()) return parsed;
    }
    return Optional.empty();
  }

  private static Optional<Instant> attempt(Function<String, Instant> form, String value) {
    try {
      return Optional.of(form.apply(value));
    } catch (DateTimeParseException ex) {
      return Optional.empty();
    }
  }
}
