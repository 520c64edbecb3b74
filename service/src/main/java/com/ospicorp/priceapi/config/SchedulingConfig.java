package com.ospicorp.priceapi.config;

import com.ospicorp.priceapi.prices.service.Sleeper;
import java.time.Clock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

@Configuration
public class SchedulingConfig {

  // One thread: slots are refreshed strictly one after another to spare the upstream rate limit.
  @Bean
  ThreadPoolTaskScheduler priceRefreshTaskScheduler() {
    ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
    scheduler.setPoolSize(1);
    scheduler.setThreadNamePrefix("price-refresh-");
    scheduler.setRemoveOnCancelPolicy(true);
    return scheduler;
  }

  @Bean
  Clock clock() {
    return Clock.systemUTC();
  }

  @Bean
  Sleeper sleeper() {
    return Sleeper.threadSleeper();
  }
}
