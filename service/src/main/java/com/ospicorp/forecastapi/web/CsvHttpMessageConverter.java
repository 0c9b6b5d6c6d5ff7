package com.ospicorp.forecastapi.web;

import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import java.io.IOException;
import java.util.Collection;
import java.util.Objects;
import org.springframework.http.HttpInputMessage;
import org.springframework.http.HttpOutputMessage;
import org.springframework.http.MediaType;
import org.springframework.http.converter.AbstractHttpMessageConverter;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.http.converter.HttpMessageNotWritableException;
import org.springframework.lang.NonNull;

/**
 * Writes a collection of flat records (forecast points) as {@code text/csv} with a header row.
 * Column order follows the element type's {@code @JsonPropertyOrder}; timestamps are ISO-8601.
 */
public class CsvHttpMessageConverter extends AbstractHttpMessageConverter<Collection<?>> {
  public static final MediaType TEXT_CSV = MediaType.valueOf("text/csv");

  private final CsvMapper mapper = new CsvMapper();

  public CsvHttpMessageConverter() {
    super(TEXT_CSV);
    mapper.findAndRegisterModules();
    mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
  }

  @Override
  protected boolean supports(@NonNull Class<?> clazz) {
    return Collection.class.isAssignableFrom(clazz);
  }

  @Override
  protected boolean canRead(MediaType mediaType) {
    return false;
  }

  @Override
  @NonNull
  protected Collection<?> readInternal(@NonNull Class<? extends Collection<?>> clazz,
      @NonNull HttpInputMessage inputMessage) throws HttpMessageNotReadableException {
    throw new HttpMessageNotReadableException("CSV reading not supported", inputMessage);
  }

  @Override
  protected void writeInternal(@NonNull Collection<?> rows, @NonNull HttpOutputMessage outputMessage)
      throws IOException, HttpMessageNotWritableException {
    Object sample = rows.stream().filter(Objects::nonNull).findFirst().orElse(null);
    if (sample == null) {
      // No rows, no schema to derive a header from
      outputMessage.getBody().flush();
      return;
    }
    CsvSchema schema = mapper.schemaFor(sample.getClass()).withHeader();
    var writer = mapper.writer(schema).writeValues(outputMessage.getBody());
    for (Object row : rows) {
      if (row != null) {
        writer.write(row);
      }
    }
    writer.flush();
  }
}
