package com.ospicorp.priceapi.prices.model;

/** The fixed catalog of cached zone/resolution combinations. */
public enum MarketSlot {
  DE_LU_15MIN(BiddingZone.DE_LU, Resolution.QUARTER_HOURLY),
  DE_LU_60MIN(BiddingZone.DE_LU, Resolution.HOURLY),
  AT_15MIN(BiddingZone.AT, Resolution.QUARTER_HOURLY),
  AT_60MIN(BiddingZone.AT, Resolution.HOURLY);

  private final BiddingZone zone;
  private final Resolution resolution;

  MarketSlot(BiddingZone zone, Resolution resolution) {
    this.zone = zone;
    this.resolution = resolution;
  }

  public BiddingZone zone() {
    return zone;
  }

  public Resolution resolution() {
    return resolution;
  }

  public static MarketSlot of(BiddingZone zone, Resolution resolution) {
    for (MarketSlot slot : values()) {
      if (slot.zone == zone && slot.resolution == resolution) {
        return slot;
      }
    }
    throw new IllegalArgumentException("No slot for " + zone + "/" + resolution);
  }
}
