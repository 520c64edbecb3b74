package com.ospicorp.priceapi.prices.model;

import java.time.Duration;
import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Price grid resolutions served by the cache.
 *
 * <p>{@code minimumLength} is the shortest series accepted from the upstream source (23 hours of
 * points, the short DST day). {@code extendedHorizonLength} is 25 hours of points: a series at least
 * this long already contains the following day.
 */
public enum Resolution {
  QUARTER_HOURLY("15min", "PT15M", Duration.ofMinutes(15)),
  HOURLY("60min", "PT60M", Duration.ofMinutes(60));

  private final String pathCode;
  private final String isoLabel;
  private final Duration step;

  Resolution(String pathCode, String isoLabel, Duration step) {
    this.pathCode = pathCode;
    this.isoLabel = isoLabel;
    this.step = step;
  }

  public String pathCode() {
    return pathCode;
  }

  public String isoLabel() {
    return isoLabel;
  }

  public Duration step() {
    return step;
  }

  public int pointsPerHour() {
    return (int) (Duration.ofHours(1).toMinutes() / step.toMinutes());
  }

  public int minimumLength() {
    return 23 * pointsPerHour();
  }

  public int extendedHorizonLength() {
    return 25 * pointsPerHour();
  }

  public static Optional<Resolution> fromPathCode(String code) {
    if (code == null) {
      return Optional.empty();
    }
    String normalized = code.toLowerCase(Locale.ROOT);
    return Arrays.stream(values())
        .filter(r -> r.pathCode.equals(normalized))
        .findFirst();
  }
}
