package com.ospicorp.priceapi.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import java.time.Duration;
import java.time.LocalTime;
import java.time.ZoneId;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "prices")
public record PriceApiProperties(
    @Valid @DefaultValue Refresh refresh,
    @Valid @DefaultValue Entsoe entsoe,
    @Valid @DefaultValue Temperatures temperatures
) {

  /**
   * Refresh loop tuning.
   *
   * @param retainLastGoodPayload keep serving the previous found payload when a slot exhausts its
   *     retries; when false the slot is overwritten with "not found"
   */
  public record Refresh(
      @DefaultValue("true") boolean enabled,
      @DefaultValue("5m") Duration interval,
      @Min(1) @DefaultValue("5") int maxAttempts,
      @DefaultValue("60s") Duration backoffStep,
      @DefaultValue("13:30") String cutoverTime,
      @DefaultValue("Europe/Berlin") ZoneId marketZone,
      @Min(1) @DefaultValue("7") int lookaheadDays,
      @DefaultValue("true") boolean retainLastGoodPayload
  ) {
    public Refresh {
      // Malformed cutover fails binding.
      LocalTime.parse(cutoverTime);
    }

    public LocalTime cutover() {
      return LocalTime.parse(cutoverTime);
    }
  }

  public record Entsoe(
      @NotBlank @DefaultValue("https://web-api.tp.entsoe.eu") String baseUrl,
      String securityToken,
      String tokenFile,
      @DefaultValue("10s") Duration connectTimeout,
      @DefaultValue("30s") Duration readTimeout
  ) {}

  public record Temperatures(
      @NotBlank @DefaultValue("https://api.open-meteo.com") String baseUrl,
      @DefaultValue("10s") Duration connectTimeout,
      @DefaultValue("10s") Duration readTimeout
  ) {}
}
