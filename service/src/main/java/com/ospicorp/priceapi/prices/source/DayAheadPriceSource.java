package com.ospicorp.priceapi.prices.source;

/**
 * Upstream day-ahead price feed. Implementations hold no per-call state and are shared across all
 * slots and retries.
 */
public interface DayAheadPriceSource {

  /**
   * Runs one upstream query.
   *
   * @throws UpstreamException for every failure; no other exception type escapes
   */
  PublicationDocument fetch(DayAheadQuery query);
}
