package com.ospicorp.priceapi.temperatures;

import com.ospicorp.priceapi.web.InvalidParameterException;
import java.util.ArrayList;
import java.util.List;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;

@Service
public class TemperatureService {

  // Two forecast days minus the possible DST gap.
  static final int MINIMUM_HOURS = 47;

  private final OpenMeteoClient client;

  public TemperatureService(OpenMeteoClient client) {
    this.client = client;
  }

  public TemperatureForecast forecast(String latitude, String longitude) {
    double lat = parseCoordinate(latitude, "latitude");
    double lon = parseCoordinate(longitude, "longitude");
    if (!(lat >= -90 && lat <= 90)) {
      throw new InvalidParameterException("latitude", "Latitude must be between -90 and 90");
    }
    if (!(lon >= -180 && lon <= 180)) {
      throw new InvalidParameterException("longitude", "Longitude must be between -180 and 180");
    }
    return toForecast(client.fetchForecast(lat, lon));
  }

  static TemperatureForecast toForecast(OpenMeteoForecast forecast) {
    OpenMeteoForecast.Hourly hourly = forecast.hourly();
    if (hourly == null || hourly.time() == null || hourly.temperature2m() == null
        || hourly.time().size() < MINIMUM_HOURS
        || hourly.temperature2m().size() < MINIMUM_HOURS
        || hourly.time().get(0) == null) {
      throw invalidResponse();
    }

    List<Integer> tenths = new ArrayList<>(hourly.temperature2m().size());
    for (Double celsius : hourly.temperature2m()) {
      if (celsius == null) {
        throw invalidResponse();
      }
      tenths.add((int) Math.rint(celsius * 10));
    }
    return new TemperatureForecast(hourly.time().get(0), tenths);
  }

  private static double parseCoordinate(String raw, String name) {
    try {
      return Double.parseDouble(raw.trim());
    } catch (NumberFormatException ex) {
      throw new InvalidParameterException(name, "Invalid " + name + " format");
    }
  }

  private static TemperatureProviderException invalidResponse() {
    return new TemperatureProviderException(HttpStatus.SERVICE_UNAVAILABLE,
        OpenMeteoClient.INVALID_RESPONSE);
  }
}
