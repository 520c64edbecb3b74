package com.ospicorp.priceapi.prices.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.util.List;
import java.util.Objects;

/**
 * Wire payload served to chargers. Field order is part of the contract: clients read the body by
 * position, not with a JSON parser.
 *
 * @param firstDate epoch seconds of the first price
 * @param prices prices in hundredths of the upstream unit, truncated toward zero
 * @param nextDate epoch seconds at which clients should poll again
 */
@JsonPropertyOrder({"first_date", "prices", "next_date"})
public record DayAheadPrices(
    @JsonProperty("first_date") long firstDate,
    @JsonProperty("prices") List<Integer> prices,
    @JsonProperty("next_date") long nextDate
) {
  public DayAheadPrices {
    Objects.requireNonNull(prices, "prices");
    prices = List.copyOf(prices);
    if (nextDate <= firstDate) {
      throw new IllegalArgumentException(
          "next_date " + nextDate + " must be after first_date " + firstDate);
    }
  }
}
