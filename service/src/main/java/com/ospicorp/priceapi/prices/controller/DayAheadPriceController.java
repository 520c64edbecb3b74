package com.ospicorp.priceapi.prices.controller;

import com.ospicorp.priceapi.prices.model.DayAheadPrices;
import com.ospicorp.priceapi.prices.service.DayAheadPriceService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import java.nio.charset.StandardCharsets;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/day_ahead_prices")
@Tag(name = "Prices")
public class DayAheadPriceController {

  static final MediaType JSON_UTF8 = new MediaType("application", "json", StandardCharsets.UTF_8);

  private final DayAheadPriceService service;

  public DayAheadPriceController(DayAheadPriceService service) {
    this.service = service;
  }

  @GetMapping("/{country}/{resolution}")
  @Operation(summary = "Get day-ahead prices",
      description = "Cached day-ahead prices in hundredths of EUR/MWh for the country's bidding "
          + "zone. Clients should poll again at next_date.")
  @ApiResponses({
      @ApiResponse(responseCode = "200", description = "Prices",
          content = @Content(mediaType = "application/json",
              schema = @Schema(implementation = DayAheadPrices.class))),
      @ApiResponse(responseCode = "400", description = "Country or resolution not supported",
          content = @Content(mediaType = "application/json")),
      @ApiResponse(responseCode = "404", description = "No prices cached for this market",
          content = @Content(mediaType = "application/json"))
  })
  public ResponseEntity<String> prices(
      @PathVariable("country") @Parameter(description = "Country code: de, lu or at",
          example = "de") String country,
      @PathVariable("resolution") @Parameter(description = "15min or 60min",
          example = "15min") String resolution) {
    return ResponseEntity.ok()
        .contentType(JSON_UTF8)
        .body(service.lookup(country, resolution));
  }
}
