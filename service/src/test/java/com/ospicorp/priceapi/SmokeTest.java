package com.ospicorp.priceapi;

import static org.assertj.core.api.Assertions.assertThat;

import com.ospicorp.priceapi.config.PriceApiProperties;
import java.time.Duration;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;

@SpringBootTest
class SmokeTest {

  @Autowired
  private ApplicationContext context;

  @Autowired
  private PriceApiProperties properties;

  @Test
  void contextLoads() {
    assertThat(context).isNotNull();
  }

  @Test
  void refreshSettingsBindWithDefaults() {
    assertThat(properties.refresh().enabled()).isFalse();
    assertThat(properties.refresh().backoffStep()).isEqualTo(Duration.ZERO);
    assertThat(properties.refresh().interval()).isEqualTo(Duration.ofMinutes(5));
    assertThat(properties.refresh().cutover().toString()).isEqualTo("13:30");
    assertThat(properties.refresh().marketZone().getId()).isEqualTo("Europe/Berlin");
    assertThat(properties.refresh().retainLastGoodPayload()).isTrue();
    assertThat(properties.entsoe().readTimeout()).isEqualTo(Duration.ofSeconds(30));
  }
}
