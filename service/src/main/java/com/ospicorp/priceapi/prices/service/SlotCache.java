package com.ospicorp.priceapi.prices.service;

import com.ospicorp.priceapi.prices.model.CachedPayload;
import com.ospicorp.priceapi.prices.model.MarketSlot;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Latest payload per {@link MarketSlot}. Entries are immutable and swapped whole, so a reader sees
 * either the previous or the new payload and never blocks on the refresh thread.
 */
@Component
public class SlotCache implements PriceSnapshotReader {

  private static final Logger log = LoggerFactory.getLogger(SlotCache.class);

  private final ConcurrentHashMap<MarketSlot, CachedPayload> store = new ConcurrentHashMap<>();

  @Override
  public Optional<CachedPayload> get(MarketSlot slot) {
    return Optional.ofNullable(store.get(slot));
  }

  public void put(MarketSlot slot, CachedPayload payload) {
    Objects.requireNonNull(payload, "payload");
    store.put(slot, payload);
    log.info("CACHE_UPDATE slot={} found={} bytes={}", slot, payload.found(),
        payload.json() == null ? 0 : payload.json().length());
  }
}
