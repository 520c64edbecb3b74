package com.ospicorp.priceapi.web;

import java.util.Map;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class RootController {

  @GetMapping(value = "/", produces = MediaType.APPLICATION_JSON_VALUE)
  public Map<String, Object> root() {
    return Map.of("service", "day-ahead-price-api", "status", "ok");
  }

  @GetMapping(value = "/v1/ping", produces = MediaType.APPLICATION_JSON_VALUE)
  public ResponseEntity<Map<String, Object>> ping() {
    return ResponseEntity.ok(Map.of("pong", true));
  }
}
