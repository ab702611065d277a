package com.ospicorp.capacityforecast.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.ospicorp.capacityforecast.series.model.RawObservation;
import com.ospicorp.capacityforecast.series.service.ObservationCsvReader;
import java.io.IOException;
import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.springframework.http.HttpInputMessage;
import org.springframework.http.HttpOutputMessage;
import org.springframework.http.MediaType;
import org.springframework.http.converter.AbstractHttpMessageConverter;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.http.converter.HttpMessageNotWritableException;
import org.springframework.lang.NonNull;

/**
 * {@code text/csv} bodies: reads {@code RawObservation[]} uploads and writes collections of
 * records or of flat maps (one column per distinct key, in first-seen order).
 */
public class CsvHttpMessageConverter extends AbstractHttpMessageConverter<Object> {
  public static final MediaType TEXT_CSV = MediaType.valueOf("text/csv");

  private final CsvMapper mapper = new CsvMapper();

  public CsvHttpMessageConverter() {
    super(TEXT_CSV);
    mapper.findAndRegisterModules();
  }

  @Override
  protected boolean supports(@NonNull Class<?> clazz) {
    return Collection.class.isAssignableFrom(clazz) || clazz.isArray();
  }

  @Override
  public boolean canRead(@NonNull Class<?> clazz, MediaType mediaType) {
    return clazz == RawObservation[].class && mediaType != null && canRead(mediaType);
  }

  @Override
  @NonNull
  protected Object readInternal(@NonNull Class<?> clazz, @NonNull HttpInputMessage inputMessage)
      throws IOException, HttpMessageNotReadableException {
    try {
      return ObservationCsvReader.read(inputMessage.getBody()).toArray(new RawObservation[0]);
    } catch (JsonProcessingException ex) {
      throw new HttpMessageNotReadableException("Malformed CSV: " + ex.getOriginalMessage(), ex,
          inputMessage);
    }
  }

  @Override
  protected void writeInternal(@NonNull Object object, @NonNull HttpOutputMessage outputMessage)
      throws IOException, HttpMessageNotWritableException {
    Collection<?> rows = object instanceof Collection<?> collection
        ? collection
        : Arrays.asList((Object[]) object);
    var writer = mapper.writer(schemaFor(rows)).writeValues(outputMessage.getBody());
    for (Object row : rows) {
      writer.write(row);
    }
    writer.flush();
  }

  private CsvSchema schemaFor(Collection<?> rows) {
    Object sample = rows.stream().filter(Objects::nonNull).findFirst().orElse(null);
    if (sample instanceof Map<?, ?>) {
      Set<String> columns = new LinkedHashSet<>();
      for (Object row : rows) {
        if (row instanceof Map<?, ?> map) {
          map.keySet().forEach(key -> columns.add(String.valueOf(key)));
        }
      }
      CsvSchema.Builder builder = CsvSchema.builder();
      columns.forEach(builder::addColumn);
      return builder.setUseHeader(true).build();
    }
    if (sample != null) {
      return mapper.schemaFor(sample.getClass()).withHeader();
    }
    return CsvSchema.emptySchema().withHeader();
  }
}
