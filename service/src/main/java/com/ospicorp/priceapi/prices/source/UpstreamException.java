package com.ospicorp.priceapi.prices.source;

import java.time.Duration;
import java.util.Optional;

/**
 * Failure talking to the upstream price source. The {@link Kind} decides how the refresh loop
 * reacts; none of these ever reach an API client.
 */
public class UpstreamException extends RuntimeException {

  public enum Kind {
    /** I/O error, timeout or an unexpected HTTP status. */
    TRANSPORT,
    /** The response could not be parsed or carries too few points. */
    DATA_FORMAT,
    /** HTTP 429 from the source. */
    RATE_LIMITED,
    /** The source answered but holds no prices for the requested window. */
    NO_DATA
  }

  private final Kind kind;
  private final Duration retryAfter;

  public UpstreamException(Kind kind, String message) {
    this(kind, message, null, null);
  }

  public UpstreamException(Kind kind, String message, Throwable cause) {
    this(kind, message, null, cause);
  }

  private UpstreamException(Kind kind, String message, Duration retryAfter, Throwable cause) {
    super(message, cause);
    this.kind = kind;
    this.retryAfter = retryAfter;
  }

  public static UpstreamException rateLimited(String message, Duration retryAfter) {
    return new UpstreamException(Kind.RATE_LIMITED, message, retryAfter, null);
  }

  public Kind kind() {
    return kind;
  }

  public Optional<Duration> retryAfter() {
    return Optional.ofNullable(retryAfter);
  }
}
