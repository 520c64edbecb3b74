package com.ospicorp.priceapi.config;

import com.fasterxml.jackson.dataformat.xml.XmlMapper;
import com.ospicorp.priceapi.prices.source.DayAheadPriceSource;
import com.ospicorp.priceapi.prices.source.EntsoeDayAheadPriceSource;
import com.ospicorp.priceapi.temperatures.OpenMeteoClient;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.boot.web.servlet.FilterRegistrationBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.util.StringUtils;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.filter.ShallowEtagHeaderFilter;

@Configuration
public class WebConfig {

  private static final Logger log = LoggerFactory.getLogger(WebConfig.class);

  @Bean
  DayAheadPriceSource dayAheadPriceSource(RestTemplateBuilder builder,
      PriceApiProperties properties) {
    PriceApiProperties.Entsoe entsoe = properties.entsoe();
    RestTemplate restTemplate = builder
        .setConnectTimeout(entsoe.connectTimeout())
        .setReadTimeout(entsoe.readTimeout())
        .build();
    return new EntsoeDayAheadPriceSource(restTemplate, new XmlMapper(), entsoe.baseUrl(),
        resolveSecurityToken(entsoe));
  }

  @Bean
  OpenMeteoClient openMeteoClient(RestTemplateBuilder builder, PriceApiProperties properties) {
    PriceApiProperties.Temperatures temperatures = properties.temperatures();
    RestTemplate restTemplate = builder
        .setConnectTimeout(temperatures.connectTimeout())
        .setReadTimeout(temperatures.readTimeout())
        .build();
    return new OpenMeteoClient(restTemplate, temperatures.baseUrl());
  }

  // Lets polling chargers revalidate with If-None-Match instead of downloading the prices again.
  @Bean
  FilterRegistrationBean<ShallowEtagHeaderFilter> shallowEtagHeaderFilter() {
    FilterRegistrationBean<ShallowEtagHeaderFilter> registration =
        new FilterRegistrationBean<>(new ShallowEtagHeaderFilter());
    registration.addUrlPatterns("/v1/day_ahead_prices/*");
    return registration;
  }

  static String resolveSecurityToken(PriceApiProperties.Entsoe entsoe) {
    if (StringUtils.hasText(entsoe.securityToken())) {
      return entsoe.securityToken().trim();
    }
    if (StringUtils.hasText(entsoe.tokenFile())) {
      Path path = Path.of(entsoe.tokenFile());
      try {
        return Files.readString(path).strip();
      } catch (IOException ex) {
        throw new IllegalStateException("Cannot read ENTSO-E token file " + path, ex);
      }
    }
    log.warn("No ENTSO-E security token configured; price refreshes will be rejected upstream");
    return "";
  }
}
