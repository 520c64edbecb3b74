package com.ospicorp.priceapi.prices.service;

import com.ospicorp.priceapi.config.PriceApiProperties;
import com.ospicorp.priceapi.prices.model.CachedPayload;
import com.ospicorp.priceapi.prices.model.DayAheadPrices;
import com.ospicorp.priceapi.prices.model.MarketSlot;
import com.ospicorp.priceapi.prices.model.PricePoint;
import com.ospicorp.priceapi.prices.source.DayAheadPriceSource;
import com.ospicorp.priceapi.prices.source.DayAheadQuery;
import com.ospicorp.priceapi.prices.source.PublicationDocument;
import com.ospicorp.priceapi.prices.source.UpstreamException;
import com.ospicorp.priceapi.prices.source.UpstreamException.Kind;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Refreshes one slot with a bounded number of attempts.
 *
 * <p>Each attempt fetches the document, resamples it and builds the payload. The wait before attempt
 * {@code k} (1-based) is {@code backoffStep * (k - 2)}, so 0, 1, 2 ... steps; a rate-limit answer
 * with a Retry-After hint waits at least that long. Nothing is awaited after the last attempt.
 */
@Component
public class SlotRefresher {

  private static final Logger log = LoggerFactory.getLogger(SlotRefresher.class);

  static final Duration MAX_RATE_LIMIT_PAUSE = Duration.ofMinutes(10);

  private final DayAheadPriceSource source;
  private final DayAheadPricesBuilder builder;
  private final ResponseSerializer serializer;
  private final SlotCache cache;
  private final Clock clock;
  private final Sleeper sleeper;
  private final PriceApiProperties.Refresh settings;

  @Autowired
  public SlotRefresher(DayAheadPriceSource source, DayAheadPricesBuilder builder,
      ResponseSerializer serializer, SlotCache cache, Clock clock, Sleeper sleeper,
      PriceApiProperties properties) {
    this(source, builder, serializer, cache, clock, sleeper, properties.refresh());
  }

  public SlotRefresher(DayAheadPriceSource source, DayAheadPricesBuilder builder,
      ResponseSerializer serializer, SlotCache cache, Clock clock, Sleeper sleeper,
      PriceApiProperties.Refresh settings) {
    this.source = source;
    this.builder = builder;
    this.serializer = serializer;
    this.cache = cache;
    this.clock = clock;
    this.sleeper = sleeper;
    this.settings = settings;
  }

  public RefreshOutcome refresh(MarketSlot slot) throws InterruptedException {
    int maxAttempts = settings.maxAttempts();
    UpstreamException lastFailure = null;
    for (int attempt = 1; attempt <= maxAttempts; attempt++) {
      if (attempt > 1) {
        Duration delay = backoffBefore(attempt, lastFailure);
        log.info("REFRESH_BACKOFF slot={} nextAttempt={}/{} delayMs={}",
            slot, attempt, maxAttempts, delay.toMillis());
        sleeper.sleep(delay);
      }
      try {
        String body = fetchAndRender(slot);
        cache.put(slot, CachedPayload.found(body));
        log.info("REFRESH_OK slot={} attempt={}/{}", slot, attempt, maxAttempts);
        return RefreshOutcome.UPDATED;
      } catch (UpstreamException ex) {
        lastFailure = ex;
        logFailure(slot, attempt, maxAttempts, ex);
      } catch (RuntimeException ex) {
        lastFailure = new UpstreamException(Kind.DATA_FORMAT,
            "Unexpected refresh failure: " + ex.getMessage(), ex);
        log.warn("REFRESH_UNEXPECTED_ERROR slot={} attempt={}/{}", slot, attempt, maxAttempts, ex);
      }
    }
    return exhausted(slot, lastFailure);
  }

  Duration backoffBefore(int attempt, UpstreamException lastFailure) {
    Duration delay = settings.backoffStep().multipliedBy(attempt - 2L);
    if (lastFailure != null && lastFailure.kind() == Kind.RATE_LIMITED) {
      Optional<Duration> hint = lastFailure.retryAfter();
      if (hint.isPresent()) {
        Duration capped = hint.get().compareTo(MAX_RATE_LIMIT_PAUSE) > 0
            ? MAX_RATE_LIMIT_PAUSE
            : hint.get();
        if (capped.compareTo(delay) > 0) {
          delay = capped;
        }
      }
    }
    return delay;
  }

  private String fetchAndRender(MarketSlot slot) {
    ZoneId zone = settings.marketZone();
    LocalDate marketDay = LocalDate.now(clock.withZone(zone));
    Instant start = marketDay.atStartOfDay(zone).toInstant();
    Instant end = marketDay.plusDays(settings.lookaheadDays()).atStartOfDay(zone).toInstant();

    PublicationDocument document =
        source.fetch(new DayAheadQuery(slot.zone(), start, end, slot.resolution()));
    if (document == null) {
      throw new UpstreamException(Kind.DATA_FORMAT, "Source returned no document");
    }
    List<PricePoint> grid = GridResampler.resample(document, slot.resolution().isoLabel(),
        Duration.between(start, end));
    DayAheadPrices prices = builder.build(slot.resolution(), grid, marketDay);
    log.debug("Built prices slot={} first_date={} count={} next_date={}",
        slot, prices.firstDate(), prices.prices().size(), prices.nextDate());
    return serializer.serialize(prices);
  }

  private RefreshOutcome exhausted(MarketSlot slot, UpstreamException lastFailure) {
    String reason = lastFailure == null ? "unknown" : lastFailure.getMessage();
    Optional<CachedPayload> current = cache.get(slot);
    if (settings.retainLastGoodPayload() && current.isPresent() && current.get().found()) {
      log.error("REFRESH_EXHAUSTED slot={} attempts={} keeping last good payload, last error: {}",
          slot, settings.maxAttempts(), reason);
      return RefreshOutcome.RETAINED;
    }
    log.error("REFRESH_EXHAUSTED slot={} attempts={} marking not found, last error: {}",
        slot, settings.maxAttempts(), reason);
    cache.put(slot, CachedPayload.notFound());
    return RefreshOutcome.NOT_FOUND;
  }

  private static void logFailure(MarketSlot slot, int attempt, int maxAttempts,
      UpstreamException ex) {
    switch (ex.kind()) {
      case NO_DATA -> log.info("REFRESH_NO_DATA slot={} attempt={}/{}: {}",
          slot, attempt, maxAttempts, ex.getMessage());
      case RATE_LIMITED -> log.warn("REFRESH_RATE_LIMITED slot={} attempt={}/{} retryAfter={}",
          slot, attempt, maxAttempts, ex.retryAfter().map(Duration::toSeconds).orElse(null));
      case DATA_FORMAT -> log.warn("REFRESH_BAD_DATA slot={} attempt={}/{}: {}",
          slot, attempt, maxAttempts, ex.getMessage());
      case TRANSPORT -> log.warn("REFRESH_TRANSPORT_ERROR slot={} attempt={}/{}: {}",
          slot, attempt, maxAttempts, ex.getMessage());
    }
  }
}
