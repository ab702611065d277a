package com.ospicorp.capacityforecast.series.service;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.ospicorp.capacityforecast.series.model.RawObservation;
import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.io.StringReader;
import java.util.List;

/**
 * Reads headed CSV into ingestion rows. Columns are matched by name ({@code series_id},
 * {@code timestamp}, {@code value}, {@code capacity}, plus the {@code ds}/{@code y} aliases);
 * extra columns are ignored and empty cells become nulls.
 */
public final class ObservationCsvReader {
  private static final CsvMapper MAPPER = CsvMapper.builder()
      .enable(CsvParser.Feature.EMPTY_STRING_AS_NULL)
      .enable(CsvParser.Feature.TRIM_SPACES)
      .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
      .build();
  private static final ObjectReader READER = MAPPER
      .readerFor(RawObservation.class)
      .with(CsvSchema.emptySchema().withHeader());

  private ObservationCsvReader() {
  }

  public static List<RawObservation> read(InputStream in) throws IOException {
    try (MappingIterator<RawObservation> rows = READER.readValues(in)) {
      return rows.readAll();
    }
  }

  public static List<RawObservation> read(Reader in) throws IOException {
    try (MappingIterator<RawObservation> rows = READER.readValues(in)) {
      return rows.readAll();
    }
  }

  public static List<RawObservation> read(String csv) throws IOException {
    return read(new StringReader(csv));
  }
}
