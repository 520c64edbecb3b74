package com.ospicorp.priceapi.prices.service;

import com.ospicorp.priceapi.prices.model.CachedPayload;
import com.ospicorp.priceapi.prices.model.MarketSlot;
import java.util.Optional;

/** Read-only view of the slot cache handed to request handlers. */
public interface PriceSnapshotReader {

  Optional<CachedPayload> get(MarketSlot slot);
}
