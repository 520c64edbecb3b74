package com.ospicorp.priceapi.prices.model;

/**
 * Latest refresh result for one slot. {@code json} holds the exact response body; it is null for a
 * slot whose refresh ran out of attempts.
 */
public record CachedPayload(String json, boolean found) {

  private static final CachedPayload NOT_FOUND = new CachedPayload(null, false);

  public static CachedPayload found(String json) {
    return new CachedPayload(json, true);
  }

  public static CachedPayload notFound() {
    return NOT_FOUND;
  }
}
