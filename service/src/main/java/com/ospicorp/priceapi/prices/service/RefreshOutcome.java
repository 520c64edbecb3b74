package com.ospicorp.priceapi.prices.service;

public enum RefreshOutcome {
  /** Payload was still fresh, nothing fetched. */
  FRESH,
  /** A new payload replaced the slot entry. */
  UPDATED,
  /** Attempts ran out; the previous found payload stays in place. */
  RETAINED,
  /** Attempts ran out; the slot now reports not found. */
  NOT_FOUND
}
