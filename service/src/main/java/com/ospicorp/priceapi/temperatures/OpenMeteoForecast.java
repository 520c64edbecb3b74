package com.ospicorp.priceapi.temperatures;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/** The part of an Open-Meteo forecast answer this service reads. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record OpenMeteoForecast(@JsonProperty("hourly") Hourly hourly) {

  @JsonIgnoreProperties(ignoreUnknown = true)
  public record Hourly(
      @JsonProperty("time") List<Long> time,
      @JsonProperty("temperature_2m") List<Double> temperature2m) {
  }
}
