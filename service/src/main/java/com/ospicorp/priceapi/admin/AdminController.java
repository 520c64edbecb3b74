package com.ospicorp.priceapi.admin;

import com.ospicorp.priceapi.prices.service.RefreshScheduler;
import java.util.Map;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/admin")
public class AdminController {
  private final RefreshScheduler refreshScheduler;

  public AdminController(RefreshScheduler refreshScheduler) {
    this.refreshScheduler = refreshScheduler;
  }

  @PostMapping(value = "/refresh", produces = MediaType.APPLICATION_JSON_VALUE)
  public ResponseEntity<Map<String, String>> refresh() {
    refreshScheduler.triggerRefresh();
    return ResponseEntity.accepted().body(Map.of("status", "refresh scheduled"));
  }
}
