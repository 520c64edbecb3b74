package com.ospicorp.priceapi.temperatures;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
class TemperatureControllerTest {

  @Autowired
  private TestRestTemplate rest;

  @Test
  void malformedLatitudeIsRejected() {
    ResponseEntity<String> response = rest.getForEntity("/v1/temperatures/abc/13.4", String.class);

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
    assertThat(response.getBody()).isEqualTo("{\"error\":\"Invalid latitude format\"}");
  }

  @Test
  void outOfRangeLongitudeIsRejected() {
    ResponseEntity<String> response = rest.getForEntity("/v1/temperatures/52.5/200", String.class);

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
    assertThat(response.getBody()).isEqualTo("{\"error\":\"Longitude must be between -180 and 180\"}");
  }

  @Test
  void unreachableProviderAnswersServiceUnavailable() {
    ResponseEntity<String> response = rest.getForEntity("/v1/temperatures/52.5/13.4", String.class);

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);
    assertThat(response.getBody()).isEqualTo("{\"error\":\"Weather service unavailable\"}");
  }
}
