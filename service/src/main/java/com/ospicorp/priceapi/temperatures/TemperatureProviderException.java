package com.ospicorp.priceapi.temperatures;

import org.springframework.http.HttpStatus;

/** Forecast lookup failure, carrying the status and message handed to the caller. */
public class TemperatureProviderException extends RuntimeException {

  private final HttpStatus status;

  public TemperatureProviderException(HttpStatus status, String message) {
    super(message);
    this.status = status;
  }

  public TemperatureProviderException(HttpStatus status, String message, Throwable cause) {
    super(message, cause);
    this.status = status;
  }

  public HttpStatus status() {
    return status;
  }
}
