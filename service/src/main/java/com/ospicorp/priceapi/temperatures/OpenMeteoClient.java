package com.ospicorp.priceapi.temperatures;

import java.net.URI;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

/** Calls the Open-Meteo DWD ICON model for a two-day hourly 2 m temperature forecast. */
public class OpenMeteoClient {

  private static final Logger log = LoggerFactory.getLogger(OpenMeteoClient.class);

  static final String UNAVAILABLE = "Weather service unavailable";
  static final String INVALID_RESPONSE = "Invalid response from weather service";
  static final String INVALID_COORDINATES = "Invalid coordinates";

  private final RestTemplate restTemplate;
  private final String baseUrl;

  public OpenMeteoClient(RestTemplate restTemplate, String baseUrl) {
    this.restTemplate = restTemplate;
    this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
  }

  public OpenMeteoForecast fetchForecast(double latitude, double longitude) {
    URI uri = buildUri(latitude, longitude);
    try {
      OpenMeteoForecast forecast = restTemplate.getForObject(uri, OpenMeteoForecast.class);
      if (forecast == null) {
        throw new TemperatureProviderException(HttpStatus.SERVICE_UNAVAILABLE, INVALID_RESPONSE);
      }
      return forecast;
    } catch (HttpClientErrorException.BadRequest ex) {
      log.info("Open-Meteo rejected coordinates lat={} lon={}: {}", latitude, longitude,
          ex.getResponseBodyAsString());
      throw new TemperatureProviderException(HttpStatus.BAD_REQUEST, INVALID_COORDINATES, ex);
    } catch (HttpStatusCodeException ex) {
      log.warn("Open-Meteo answered with status {}", ex.getStatusCode().value());
      throw new TemperatureProviderException(HttpStatus.SERVICE_UNAVAILABLE, UNAVAILABLE, ex);
    } catch (ResourceAccessException ex) {
      log.warn("Open-Meteo unreachable: {}", ex.getMessage());
      throw new TemperatureProviderException(HttpStatus.SERVICE_UNAVAILABLE, UNAVAILABLE, ex);
    } catch (RestClientException ex) {
      log.warn("Unreadable Open-Meteo response: {}", ex.getMessage());
      throw new TemperatureProviderException(HttpStatus.SERVICE_UNAVAILABLE, INVALID_RESPONSE, ex);
    }
  }

  URI buildUri(double latitude, double longitude) {
    return UriComponentsBuilder.fromHttpUrl(baseUrl)
        .path("/v1/dwd-icon")
        .queryParam("latitude", latitude)
        .queryParam("longitude", longitude)
        .queryParam("hourly", "temperature_2m")
        .queryParam("timezone", "auto")
        .queryParam("forecast_days", 2)
        .queryParam("timeformat", "unixtime")
        .build()
        .toUri();
  }
}
