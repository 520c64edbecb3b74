package com.ospicorp.priceapi.prices.service;

import com.ospicorp.priceapi.config.PriceApiProperties;
import com.ospicorp.priceapi.prices.model.CachedPayload;
import com.ospicorp.priceapi.prices.model.MarketSlot;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.SmartLifecycle;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import org.springframework.stereotype.Component;

/**
 * Drives the refresh of all slots from a single background thread.
 *
 * <p>On start the first pass runs to completion before {@link #start()} returns. The lifecycle phase
 * sits below the embedded web server's, so no request is accepted until every slot has either been
 * filled or exhausted its attempts. Later passes run with a fixed delay; slots are handled one after
 * the other and a failure on one never stops the others.
 */
@Component
public class RefreshScheduler implements SmartLifecycle {

  private static final Logger log = LoggerFactory.getLogger(RefreshScheduler.class);

  static final int PHASE = SmartLifecycle.DEFAULT_PHASE - 4096;

  private final SlotRefresher refresher;
  private final StalenessEvaluator evaluator;
  private final SlotCache cache;
  private final ThreadPoolTaskScheduler taskScheduler;
  private final Clock clock;
  private final PriceApiProperties.Refresh settings;

  // Set while a manual pass waits in the queue; further triggers join it.
  private final AtomicBoolean manualPassPending = new AtomicBoolean();

  private volatile ScheduledFuture<?> periodic;
  private volatile boolean running;

  @Autowired
  public RefreshScheduler(SlotRefresher refresher, StalenessEvaluator evaluator, SlotCache cache,
      @Qualifier("priceRefreshTaskScheduler") ThreadPoolTaskScheduler taskScheduler, Clock clock,
      PriceApiProperties properties) {
    this(refresher, evaluator, cache, taskScheduler, clock, properties.refresh());
  }

  public RefreshScheduler(SlotRefresher refresher, StalenessEvaluator evaluator, SlotCache cache,
      ThreadPoolTaskScheduler taskScheduler, Clock clock, PriceApiProperties.Refresh settings) {
    this.refresher = refresher;
    this.evaluator = evaluator;
    this.cache = cache;
    this.taskScheduler = taskScheduler;
    this.clock = clock;
    this.settings = settings;
  }

  @Override
  public void start() {
    if (!settings.enabled()) {
      log.info("Price refresh disabled by configuration");
      running = true;
      return;
    }

    log.info("Initial price refresh started. slots={}", MarketSlot.values().length);
    Future<?> firstPass = taskScheduler.submit(this::refreshAll);
    try {
      firstPass.get();
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      throw new IllegalStateException("Interrupted while waiting for the initial price refresh", ex);
    } catch (ExecutionException ex) {
      throw new IllegalStateException("Initial price refresh failed", ex.getCause());
    }

    Duration interval = settings.interval();
    periodic = taskScheduler.scheduleWithFixedDelay(this::refreshAll,
        clock.instant().plus(interval), interval);
    running = true;
    log.info("Initial price refresh finished; next passes every {}s", interval.toSeconds());
  }

  @Override
  public void stop() {
    ScheduledFuture<?> current = periodic;
    if (current != null) {
      current.cancel(false);
      periodic = null;
    }
    running = false;
  }

  @Override
  public boolean isRunning() {
    return running;
  }

  @Override
  public int getPhase() {
    return PHASE;
  }

  /**
   * Queues one extra pass on the refresh thread and returns at once. At most one manual pass waits
   * in the queue; triggers arriving before it starts are merged into it.
   *
   * @return true if a new pass was queued, false if one was already waiting
   */
  public boolean triggerRefresh() {
    if (!manualPassPending.compareAndSet(false, true)) {
      log.info("Manual price refresh requested; a pass is already queued");
      return false;
    }
    log.info("Manual price refresh requested");
    try {
      taskScheduler.execute(() -> {
        manualPassPending.set(false);
        refreshAll();
      });
    } catch (RuntimeException ex) {
      manualPassPending.set(false);
      throw ex;
    }
    return true;
  }

  public Map<MarketSlot, RefreshOutcome> refreshAll() {
    Instant started = clock.instant();
    Map<MarketSlot, RefreshOutcome> outcomes = new EnumMap<>(MarketSlot.class);
    for (MarketSlot slot : MarketSlot.values()) {
      try {
        outcomes.put(slot, refreshIfStale(slot));
      } catch (InterruptedException ex) {
        Thread.currentThread().interrupt();
        log.warn("Refresh pass interrupted at slot={}", slot);
        return outcomes;
      } catch (RuntimeException ex) {
        log.error("REFRESH_FAILED slot={}, continuing with remaining slots", slot, ex);
      }
    }
    log.debug("Refresh pass done in {} ms: {}",
        Duration.between(started, clock.instant()).toMillis(), outcomes);
    return outcomes;
  }

  RefreshOutcome refreshIfStale(MarketSlot slot) throws InterruptedException {
    CachedPayload current = cache.get(slot).orElse(null);
    int minLength = slot.resolution().extendedHorizonLength();
    if (!evaluator.isStale(current, minLength, clock.instant())) {
      return RefreshOutcome.FRESH;
    }
    return refresher.refresh(slot);
  }
}
