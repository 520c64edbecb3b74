package com.ospicorp.priceapi.prices.service;

import com.ospicorp.priceapi.prices.model.MarketSlot;

public class PriceDataNotFoundException extends RuntimeException {

  private final MarketSlot slot;

  public PriceDataNotFoundException(MarketSlot slot) {
    super("Data not found");
    this.slot = slot;
  }

  public MarketSlot slot() {
    return slot;
  }
}
