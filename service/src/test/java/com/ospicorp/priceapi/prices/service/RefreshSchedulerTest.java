package com.ospicorp.priceapi.prices.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ospicorp.priceapi.config.PriceApiProperties;
import com.ospicorp.priceapi.prices.model.CachedPayload;
import com.ospicorp.priceapi.prices.model.DayAheadPrices;
import com.ospicorp.priceapi.prices.model.MarketSlot;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.Collections;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.context.SmartLifecycle;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

class RefreshSchedulerTest {

  private static final Instant NOW = Instant.parse("2024-03-10T08:00:00Z");

  private final ResponseSerializer serializer = new ResponseSerializer(new ObjectMapper());
  private final StalenessEvaluator evaluator = new StalenessEvaluator(serializer);
  private final SlotRefresher refresher = mock(SlotRefresher.class);
  private SlotCache cache;
  private ThreadPoolTaskScheduler taskScheduler;

  @BeforeEach
  void setUp() {
    cache = new SlotCache();
    taskScheduler = new ThreadPoolTaskScheduler();
    taskScheduler.setPoolSize(1);
    taskScheduler.setThreadNamePrefix("test-refresh-");
    taskScheduler.initialize();
  }

  @AfterEach
  void tearDown() {
    taskScheduler.shutdown();
  }

  private static PriceApiProperties.Refresh settings(boolean enabled) {
    return new PriceApiProperties.Refresh(enabled, Duration.ofMinutes(5), 3, Duration.ZERO,
        "13:30", ZoneId.of("Europe/Berlin"), 7, true);
  }

  private RefreshScheduler scheduler(Clock clock, boolean enabled) {
    return new RefreshScheduler(refresher, evaluator, cache, taskScheduler, clock,
        settings(enabled));
  }

  private String freshBody(int count) {
    return serializer.serialize(new DayAheadPrices(NOW.getEpochSecond(),
        Collections.nCopies(count, 500), NOW.plus(Duration.ofDays(1)).getEpochSecond()));
  }

  @Test
  void failingSlotDoesNotStopTheOthers() throws Exception {
    when(refresher.refresh(any())).thenReturn(RefreshOutcome.UPDATED);
    when(refresher.refresh(MarketSlot.DE_LU_15MIN)).thenThrow(new IllegalStateException("boom"));

    Map<MarketSlot, RefreshOutcome> outcomes =
        scheduler(Clock.fixed(NOW, ZoneOffset.UTC), true).refreshAll();

    assertThat(outcomes).hasSize(3).doesNotContainKey(MarketSlot.DE_LU_15MIN);
    for (MarketSlot slot : MarketSlot.values()) {
      verify(refresher).refresh(slot);
    }
  }

  @Test
  void freshSlotIsNotRefetched() throws Exception {
    cache.put(MarketSlot.AT_60MIN, CachedPayload.found(freshBody(25)));
    when(refresher.refresh(any())).thenReturn(RefreshOutcome.UPDATED);

    Map<MarketSlot, RefreshOutcome> outcomes =
        scheduler(Clock.fixed(NOW, ZoneOffset.UTC), true).refreshAll();

    assertThat(outcomes).containsEntry(MarketSlot.AT_60MIN, RefreshOutcome.FRESH);
    verify(refresher, never()).refresh(MarketSlot.AT_60MIN);
  }

  @Test
  void slotWithoutTomorrowIsRefetched() throws Exception {
    cache.put(MarketSlot.AT_60MIN, CachedPayload.found(freshBody(24)));
    when(refresher.refresh(any())).thenReturn(RefreshOutcome.UPDATED);

    Map<MarketSlot, RefreshOutcome> outcomes =
        scheduler(Clock.fixed(NOW, ZoneOffset.UTC), true).refreshAll();

    assertThat(outcomes).containsEntry(MarketSlot.AT_60MIN, RefreshOutcome.UPDATED);
  }

  @Test
  void startReturnsOnlyAfterEverySlotWasAttempted() throws Exception {
    when(refresher.refresh(any())).thenAnswer(invocation -> {
      MarketSlot slot = invocation.getArgument(0);
      Thread.sleep(20);
      cache.put(slot, CachedPayload.found(freshBody(100)));
      return RefreshOutcome.UPDATED;
    });
    RefreshScheduler scheduler = scheduler(Clock.systemUTC(), true);

    scheduler.start();
    try {
      assertThat(scheduler.isRunning()).isTrue();
      for (MarketSlot slot : MarketSlot.values()) {
        assertThat(cache.get(slot)).isPresent();
      }
    } finally {
      scheduler.stop();
    }
    assertThat(scheduler.isRunning()).isFalse();
  }

  @Test
  void disabledSchedulerNeverFetches() {
    RefreshScheduler scheduler = scheduler(Clock.fixed(NOW, ZoneOffset.UTC), false);

    scheduler.start();

    assertThat(scheduler.isRunning()).isTrue();
    verifyNoInteractions(refresher);
  }

  @Test
  void startsBeforeTheWebServer() {
    RefreshScheduler scheduler = scheduler(Clock.systemUTC(), true);

    assertThat(scheduler.getPhase()).isLessThan(SmartLifecycle.DEFAULT_PHASE - 1024);
  }

  @Test
  void manualTriggersDuringARunningPassQueueOneMorePass() throws Exception {
    CountDownLatch passStarted = new CountDownLatch(1);
    CountDownLatch release = new CountDownLatch(1);
    when(refresher.refresh(any())).thenAnswer(invocation -> {
      passStarted.countDown();
      release.await(10, TimeUnit.SECONDS);
      return RefreshOutcome.NOT_FOUND;
    });
    RefreshScheduler scheduler = scheduler(Clock.fixed(NOW, ZoneOffset.UTC), true);

    assertThat(scheduler.triggerRefresh()).isTrue();
    assertThat(passStarted.await(10, TimeUnit.SECONDS)).isTrue();

    assertThat(scheduler.triggerRefresh()).isTrue();
    for (int i = 0; i < 1000; i++) {
      assertThat(scheduler.triggerRefresh()).isFalse();
    }
    assertThat(taskScheduler.getScheduledThreadPoolExecutor().getQueue()).hasSize(1);

    release.countDown();
    taskScheduler.getScheduledThreadPoolExecutor().shutdown();
    assertThat(taskScheduler.getScheduledThreadPoolExecutor().awaitTermination(10, TimeUnit.SECONDS))
        .isTrue();
    verify(refresher, times(2 * MarketSlot.values().length)).refresh(any());
  }
}
