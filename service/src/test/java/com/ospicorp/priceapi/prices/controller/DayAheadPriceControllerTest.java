package com.ospicorp.priceapi.prices.controller;

import static org.assertj.core.api.Assertions.assertThat;

import com.ospicorp.priceapi.prices.model.CachedPayload;
import com.ospicorp.priceapi.prices.model.MarketSlot;
import com.ospicorp.priceapi.prices.service.SlotCache;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
class DayAheadPriceControllerTest {

  private static final MediaType JSON_UTF8 =
      new MediaType("application", "json", StandardCharsets.UTF_8);

  @Autowired
  private TestRestTemplate rest;

  @Autowired
  private SlotCache cache;

  private static String body(int firstPrice) {
    long first = Instant.now().minus(Duration.ofHours(8)).getEpochSecond();
    long next = Instant.now().plus(Duration.ofDays(2)).getEpochSecond();
    return "{\"first_date\":" + first + ",\"prices\":[" + firstPrice + ",8012,-550],\"next_date\":"
        + next + "}";
  }

  private final String deLuQuarterHourly = body(1);
  private final String deLuHourly = body(2);
  private final String atHourly = body(3);

  @BeforeEach
  void fillCache() {
    cache.put(MarketSlot.DE_LU_15MIN, CachedPayload.found(deLuQuarterHourly));
    cache.put(MarketSlot.DE_LU_60MIN, CachedPayload.found(deLuHourly));
    cache.put(MarketSlot.AT_60MIN, CachedPayload.found(atHourly));
    cache.put(MarketSlot.AT_15MIN, CachedPayload.notFound());
  }

  @Test
  void servesCachedBodyVerbatim() {
    ResponseEntity<String> response =
        rest.getForEntity("/v1/day_ahead_prices/de/15min", String.class);

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
    assertThat(response.getHeaders().getContentType()).isEqualTo(JSON_UTF8);
    assertThat(response.getBody()).isEqualTo(deLuQuarterHourly);
  }

  @Test
  void mapsCountriesToTheirBiddingZone() {
    assertThat(rest.getForObject("/v1/day_ahead_prices/de/60min", String.class))
        .isEqualTo(deLuHourly);
    assertThat(rest.getForObject("/v1/day_ahead_prices/lu/60min", String.class))
        .isEqualTo(deLuHourly);
    assertThat(rest.getForObject("/v1/day_ahead_prices/lu/15min", String.class))
        .isEqualTo(deLuQuarterHourly);
    assertThat(rest.getForObject("/v1/day_ahead_prices/at/60min", String.class))
        .isEqualTo(atHourly);
  }

  @Test
  void servesEveryFilledSlot() {
    String atQuarterHourly = body(4);
    cache.put(MarketSlot.AT_15MIN, CachedPayload.found(atQuarterHourly));

    assertThat(rest.getForObject("/v1/day_ahead_prices/de/15min", String.class))
        .isEqualTo(deLuQuarterHourly);
    assertThat(rest.getForObject("/v1/day_ahead_prices/de/60min", String.class))
        .isEqualTo(deLuHourly);
    assertThat(rest.getForObject("/v1/day_ahead_prices/at/60min", String.class))
        .isEqualTo(atHourly);
    ResponseEntity<String> response =
        rest.getForEntity("/v1/day_ahead_prices/AT/15MIN", String.class);
    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
    assertThat(response.getBody()).isEqualTo(atQuarterHourly);
  }

  @Test
  void pathValuesAreCaseInsensitive() {
    assertThat(rest.getForObject("/v1/day_ahead_prices/DE/15MIN", String.class))
        .isEqualTo(deLuQuarterHourly);
    assertThat(rest.getForObject("/v1/day_ahead_prices/At/60Min", String.class))
        .isEqualTo(atHourly);
  }

  @Test
  void unknownCountryIsRejectedFirst() {
    ResponseEntity<String> response =
        rest.getForEntity("/v1/day_ahead_prices/fr/30min", String.class);

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
    assertThat(response.getHeaders().getContentType().isCompatibleWith(MediaType.APPLICATION_JSON))
        .isTrue();
    assertThat(response.getBody()).isEqualTo("{\"error\":\"Country not supported\"}");
  }

  @Test
  void unknownCountryIsRejectedInAnyCasing() {
    assertThat(rest.getForEntity("/v1/day_ahead_prices/FR/15min", String.class).getStatusCode())
        .isEqualTo(HttpStatus.BAD_REQUEST);
    assertThat(rest.getForEntity("/v1/day_ahead_prices/fr/15MIN", String.class).getStatusCode())
        .isEqualTo(HttpStatus.BAD_REQUEST);
  }

  @Test
  void unknownResolutionIsRejected() {
    ResponseEntity<String> response =
        rest.getForEntity("/v1/day_ahead_prices/de/30min", String.class);

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
    assertThat(response.getBody()).isEqualTo("{\"error\":\"Resolution not supported\"}");
  }

  @Test
  void slotWithoutDataAnswersNotFound() {
    ResponseEntity<String> response =
        rest.getForEntity("/v1/day_ahead_prices/at/15min", String.class);

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
    assertThat(response.getBody()).isEqualTo("{\"error\":\"Data not found\"}");
  }

  @Test
  void unchangedBodyCanBeRevalidated() {
    ResponseEntity<String> first =
        rest.getForEntity("/v1/day_ahead_prices/de/15min", String.class);
    String etag = first.getHeaders().getETag();
    assertThat(etag).isNotBlank();

    HttpHeaders headers = new HttpHeaders();
    headers.setIfNoneMatch(etag);
    ResponseEntity<String> second = rest.exchange("/v1/day_ahead_prices/de/15min",
        HttpMethod.GET, new HttpEntity<>(headers), String.class);

    assertThat(second.getStatusCode()).isEqualTo(HttpStatus.NOT_MODIFIED);
  }
}
