package com.ospicorp.priceapi.prices.model;

/** Day-ahead bidding zones served by the cache, keyed by their ENTSO-E EIC code. */
public enum BiddingZone {
  DE_LU("10Y1001A1001A82H"),
  AT("10YAT-APG------L");

  private final String eicCode;

  BiddingZone(String eicCode) {
    this.eicCode = eicCode;
  }

  public String eicCode() {
    return eicCode;
  }
}
