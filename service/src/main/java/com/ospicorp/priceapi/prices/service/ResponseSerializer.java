package com.ospicorp.priceapi.prices.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.ospicorp.priceapi.prices.model.DayAheadPrices;
import org.springframework.stereotype.Component;

/**
 * Renders {@link DayAheadPrices} as {@code {"first_date":..,"prices":[..],"next_date":..}} with no
 * whitespace, whatever the application-wide Jackson settings are.
 */
@Component
public class ResponseSerializer {

  private final ObjectWriter writer;
  private final ObjectReader reader;

  public ResponseSerializer(ObjectMapper mapper) {
    this.writer = mapper.writerFor(DayAheadPrices.class)
        .without(SerializationFeature.INDENT_OUTPUT);
    this.reader = mapper.readerFor(DayAheadPrices.class)
        .with(DeserializationFeature.FAIL_ON_MISSING_CREATOR_PROPERTIES)
        .with(DeserializationFeature.FAIL_ON_NULL_CREATOR_PROPERTIES);
  }

  public String serialize(DayAheadPrices prices) {
    try {
      return writer.writeValueAsString(prices);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("Could not serialize day-ahead prices", ex);
    }
  }

  /**
   * Reads a body produced by {@link #serialize(DayAheadPrices)} back.
   *
   * @throws MalformedPayloadException if the body is not a complete, valid payload
   */
  public DayAheadPrices parse(String json) {
    if (json == null) {
      throw new MalformedPayloadException("payload body is missing", null);
    }
    try {
      return reader.readValue(json);
    } catch (JsonProcessingException ex) {
      throw new MalformedPayloadException(ex.getOriginalMessage(), ex);
    }
  }

  public static class MalformedPayloadException extends RuntimeException {
    public MalformedPayloadException(String message, Throwable cause) {
      super(message, cause);
    }
  }
}
