package com.ospicorp.priceapi.prices.model;

import java.util.Locale;
import java.util.Optional;

/** Country codes accepted on the API; DE and LU share one bidding zone. */
public enum Country {
  DE(BiddingZone.DE_LU),
  LU(BiddingZone.DE_LU),
  AT(BiddingZone.AT);

  private final BiddingZone zone;

  Country(BiddingZone zone) {
    this.zone = zone;
  }

  public BiddingZone zone() {
    return zone;
  }

  public static Optional<Country> fromCode(String code) {
    if (code == null) {
      return Optional.empty();
    }
    try {
      return Optional.of(Country.valueOf(code.toUpperCase(Locale.ROOT)));
    } catch (IllegalArgumentException ex) {
      return Optional.empty();
    }
  }
}
