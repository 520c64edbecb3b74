package com.ospicorp.priceapi.temperatures;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/temperatures")
@Tag(name = "Temperatures")
public class TemperatureController {

  private final TemperatureService service;

  public TemperatureController(TemperatureService service) {
    this.service = service;
  }

  @GetMapping(value = "/{lat}/{lon}", produces = MediaType.APPLICATION_JSON_VALUE)
  @Operation(summary = "Hourly temperature forecast",
      description = "Two-day hourly 2 m temperature forecast in tenths of a degree Celsius.")
  @ApiResponses({
      @ApiResponse(responseCode = "200", description = "Forecast",
          content = @Content(mediaType = "application/json",
              schema = @Schema(implementation = TemperatureForecast.class))),
      @ApiResponse(responseCode = "400", description = "Invalid coordinates",
          content = @Content(mediaType = "application/json")),
      @ApiResponse(responseCode = "503", description = "Weather service unavailable",
          content = @Content(mediaType = "application/json"))
  })
  public TemperatureForecast forecast(
      @PathVariable("lat") @Parameter(description = "Latitude", example = "52.52") String lat,
      @PathVariable("lon") @Parameter(description = "Longitude", example = "13.41") String lon) {
    return service.forecast(lat, lon);
  }
}
