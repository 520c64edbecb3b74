package com.ospicorp.priceapi.prices.source;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.dataformat.xml.XmlMapper;
import com.ospicorp.priceapi.prices.source.UpstreamException.Kind;
import java.net.URI;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.util.StringUtils;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

/**
 * Queries the ENTSO-E transparency platform for day-ahead prices (document type A44) and maps the
 * XML answer onto {@link PublicationDocument}.
 */
public class EntsoeDayAheadPriceSource implements DayAheadPriceSource {

  private static final Logger log = LoggerFactory.getLogger(EntsoeDayAheadPriceSource.class);

  // The API rejects period bounds with non-zero minutes.
  static final DateTimeFormatter PERIOD_FORMAT =
      DateTimeFormatter.ofPattern("yyyyMMddHH'00'").withZone(ZoneOffset.UTC);
  static final String DOCUMENT_TYPE_DAY_AHEAD_PRICES = "A44";
  private static final String ACKNOWLEDGEMENT_ROOT = "Acknowledgement_MarketDocument";
  private static final Pattern TOKEN_PARAM = Pattern.compile("(securityToken=)[^&\\s\"]*");

  private final RestTemplate restTemplate;
  private final XmlMapper xmlMapper;
  private final String baseUrl;
  private final String securityToken;

  public EntsoeDayAheadPriceSource(RestTemplate restTemplate, XmlMapper xmlMapper, String baseUrl,
      String securityToken) {
    this.restTemplate = restTemplate;
    this.xmlMapper = xmlMapper;
    this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
    this.securityToken = securityToken == null ? "" : securityToken;
  }

  @Override
  public PublicationDocument fetch(DayAheadQuery query) {
    URI uri = buildUri(query);
    log.debug("ENTSO-E query zone={} start={} end={} resolution={}",
        query.zone(), query.start(), query.end(), query.resolution().isoLabel());

    String body;
    try {
      ResponseEntity<String> response = restTemplate.getForEntity(uri, String.class);
      body = response.getBody();
    } catch (HttpStatusCodeException ex) {
      throw classifyStatus(ex);
    } catch (ResourceAccessException ex) {
      throw new UpstreamException(Kind.TRANSPORT,
          "ENTSO-E unreachable: " + maskToken(ex.getMessage()));
    } catch (RestClientException ex) {
      throw new UpstreamException(Kind.TRANSPORT,
          "ENTSO-E request failed: " + maskToken(ex.getMessage()));
    }

    if (!StringUtils.hasText(body)) {
      throw new UpstreamException(Kind.DATA_FORMAT, "ENTSO-E returned an empty body");
    }
    PublicationDocument document = parse(body);
    if (document.getTimeSeries().isEmpty() && !document.getReasons().isEmpty()) {
      throw new UpstreamException(Kind.NO_DATA, describeReasons(document));
    }
    return document;
  }

  URI buildUri(DayAheadQuery query) {
    String eic = query.zone().eicCode();
    return UriComponentsBuilder.fromHttpUrl(baseUrl)
        .path("/api")
        .queryParam("securityToken", securityToken)
        .queryParam("documentType", DOCUMENT_TYPE_DAY_AHEAD_PRICES)
        .queryParam("in_Domain", eic)
        .queryParam("out_Domain", eic)
        .queryParam("periodStart", format(query.start()))
        .queryParam("periodEnd", format(query.end()))
        .encode()
        .build()
        .toUri();
  }

  /**
   * Removes the security token from text that may embed the request URI. Client exceptions quote
   * the URI, so neither their message nor the exception itself is passed on.
   */
  String maskToken(String text) {
    if (text == null) {
      return null;
    }
    String masked = TOKEN_PARAM.matcher(text).replaceAll("$1****");
    return securityToken.isEmpty() ? masked : masked.replace(securityToken, "****");
  }

  private PublicationDocument parse(String body) {
    try {
      return xmlMapper.readValue(body, PublicationDocument.class);
    } catch (JsonProcessingException ex) {
      throw new UpstreamException(Kind.DATA_FORMAT,
          "ENTSO-E response is not a market document: " + ex.getOriginalMessage(), ex);
    }
  }

  private UpstreamException classifyStatus(HttpStatusCodeException ex) {
    if (ex.getStatusCode().value() == HttpStatus.TOO_MANY_REQUESTS.value()) {
      return UpstreamException.rateLimited("ENTSO-E rate limit hit",
          parseRetryAfter(ex.getResponseHeaders()));
    }
    String body = ex.getResponseBodyAsString();
    // "No matching data" comes back as an acknowledgement document with a 4xx status.
    if (body.contains(ACKNOWLEDGEMENT_ROOT)) {
      try {
        PublicationDocument ack = xmlMapper.readValue(body, PublicationDocument.class);
        return new UpstreamException(Kind.NO_DATA, describeReasons(ack), ex);
      } catch (JsonProcessingException parseEx) {
        log.debug("Unreadable acknowledgement document: {}", parseEx.getOriginalMessage());
      }
    }
    return new UpstreamException(Kind.TRANSPORT,
        "ENTSO-E answered with status " + ex.getStatusCode().value(), ex);
  }

  private static String describeReasons(PublicationDocument document) {
    return document.getReasons().stream()
        .map(r -> r.getCode() + " " + (r.getText() == null ? "" : r.getText().trim()))
        .collect(Collectors.joining("; ", "ENTSO-E has no data: ", ""));
  }

  private static Duration parseRetryAfter(HttpHeaders headers) {
    String value = headers == null ? null : headers.getFirst(HttpHeaders.RETRY_AFTER);
    if (!StringUtils.hasText(value)) {
      return null;
    }
    try {
      return Duration.ofSeconds(Long.parseLong(value.trim()));
    } catch (NumberFormatException ex) {
      log.debug("Ignoring non-numeric Retry-After header '{}'", value);
      return null;
    }
  }

  private static String format(Instant instant) {
    return PERIOD_FORMAT.format(instant);
  }
}
