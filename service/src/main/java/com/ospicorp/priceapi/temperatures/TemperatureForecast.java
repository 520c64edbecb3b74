package com.ospicorp.priceapi.temperatures;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.util.List;

/** Hourly temperatures in tenths of a degree Celsius, starting at {@code first_date}. */
@JsonPropertyOrder({"first_date", "hourly"})
public record TemperatureForecast(
    @JsonProperty("first_date") long firstDate,
    @JsonProperty("hourly") List<Integer> hourly) {

  public TemperatureForecast {
    hourly = List.copyOf(hourly);
  }
}
