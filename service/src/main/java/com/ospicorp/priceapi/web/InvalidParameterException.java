package com.ospicorp.priceapi.web;

/** A path or query value the API cannot serve. The message is returned to the caller verbatim. */
public class InvalidParameterException extends RuntimeException {

  private final String parameter;

  public InvalidParameterException(String parameter, String message) {
    super(message);
    this.parameter = parameter;
  }

  public String parameter() {
    return parameter;
  }
}
