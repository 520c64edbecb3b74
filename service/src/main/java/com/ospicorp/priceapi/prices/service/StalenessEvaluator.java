package com.ospicorp.priceapi.prices.service;

import com.ospicorp.priceapi.prices.model.CachedPayload;
import com.ospicorp.priceapi.prices.model.DayAheadPrices;
import java.time.Duration;
import java.time.Instant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Decides whether a slot's cached payload has to be fetched again.
 *
 * <p>Checks run in a fixed order and the first hit wins: no payload, unreadable payload, payload
 * marked not-found, next poll date within {@link #SAFETY_MARGIN} of now, and too few prices. Nothing
 * thrown while evaluating escapes; it simply counts as stale.
 */
@Component
public class StalenessEvaluator {

  private static final Logger log = LoggerFactory.getLogger(StalenessEvaluator.class);

  // Chargers poll at next_date; renew before they do.
  static final Duration SAFETY_MARGIN = Duration.ofMinutes(30);

  private final ResponseSerializer serializer;

  public StalenessEvaluator(ResponseSerializer serializer) {
    this.serializer = serializer;
  }

  public boolean isStale(CachedPayload payload, int minLength, Instant now) {
    try {
      return evaluate(payload, minLength, now);
    } catch (RuntimeException ex) {
      log.warn("Treating payload as stale after evaluation error: {}", ex.getMessage(), ex);
      return true;
    }
  }

  private boolean evaluate(CachedPayload payload, int minLength, Instant now) {
    if (payload == null) {
      log.debug("Stale: no payload");
      return true;
    }

    DayAheadPrices prices;
    try {
      prices = serializer.parse(payload.json());
    } catch (ResponseSerializer.MalformedPayloadException ex) {
      log.debug("Stale: malformed payload ({})", ex.getMessage());
      return true;
    }

    if (!payload.found()) {
      log.debug("Stale: payload marked not found");
      return true;
    }

    long refreshAt = prices.nextDate() - SAFETY_MARGIN.toSeconds();
    long nowSeconds = now.getEpochSecond();
    if (refreshAt < nowSeconds) {
      log.debug("Stale: refresh point {} < now {}", refreshAt, nowSeconds);
      return true;
    }

    if (prices.prices().size() < minLength) {
      log.debug("Stale: {} prices < required {}", prices.prices().size(), minLength);
      return true;
    }

    log.debug("Fresh: next_date={} prices={}", prices.nextDate(), prices.prices().size());
    return false;
  }
}
