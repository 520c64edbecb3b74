package com.ospicorp.priceapi.prices.source;

import com.ospicorp.priceapi.prices.model.BiddingZone;
import com.ospicorp.priceapi.prices.model.Resolution;
import java.time.Instant;

public record DayAheadQuery(BiddingZone zone, Instant start, Instant end, Resolution resolution) {

  public DayAheadQuery {
    if (!end.isAfter(start)) {
      throw new IllegalArgumentException("end must be after start");
    }
  }
}
