package com.ospicorp.priceapi.prices.service;

import com.ospicorp.priceapi.prices.model.CachedPayload;
import com.ospicorp.priceapi.prices.model.Country;
import com.ospicorp.priceapi.prices.model.MarketSlot;
import com.ospicorp.priceapi.prices.model.Resolution;
import com.ospicorp.priceapi.web.InvalidParameterException;
import org.springframework.stereotype.Service;

/**
 * Answers price requests from the cache only; a request never triggers an upstream call.
 */
@Service
public class DayAheadPriceService {

  private final PriceSnapshotReader snapshots;

  public DayAheadPriceService(PriceSnapshotReader snapshots) {
    this.snapshots = snapshots;
  }

  /**
   * Returns the cached body for the country's bidding zone at the given resolution.
   *
   * @throws InvalidParameterException for an unknown country (checked first) or resolution
   * @throws PriceDataNotFoundException when the slot holds no usable payload
   */
  public String lookup(String country, String resolution) {
    Country parsedCountry = Country.fromCode(country)
        .orElseThrow(() -> new InvalidParameterException("country", "Country not supported"));
    Resolution parsedResolution = Resolution.fromPathCode(resolution)
        .orElseThrow(() -> new InvalidParameterException("resolution", "Resolution not supported"));

    MarketSlot slot = MarketSlot.of(parsedCountry.zone(), parsedResolution);
    CachedPayload payload = snapshots.get(slot)
        .filter(CachedPayload::found)
        .orElseThrow(() -> new PriceDataNotFoundException(slot));
    if (payload.json() == null) {
      throw new PriceDataNotFoundException(slot);
    }
    return payload.json();
  }
}
