package com.ospicorp.priceapi.prices.service;

import com.ospicorp.priceapi.prices.model.PricePoint;
import com.ospicorp.priceapi.prices.source.PublicationDocument;
import com.ospicorp.priceapi.prices.source.PublicationDocument.Period;
import com.ospicorp.priceapi.prices.source.PublicationDocument.Point;
import com.ospicorp.priceapi.prices.source.PublicationDocument.TimeSeries;
import com.ospicorp.priceapi.prices.source.UpstreamException;
import com.ospicorp.priceapi.prices.source.UpstreamException.Kind;
import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.TreeMap;

/**
 * Turns the irregular, possibly overlapping series of a market document into one contiguous grid.
 *
 * <p>Only periods declared at the requested resolution are used. Where two points land on the same
 * timestamp the one met first wins. Holes between the first and last observation are forward-filled.
 * Observations further apart than the allowed span are rejected instead of filled.
 */
public final class GridResampler {

  private static final Map<String, Duration> STEPS = Map.of(
      "PT15M", Duration.ofMinutes(15),
      "PT30M", Duration.ofMinutes(30),
      "PT60M", Duration.ofMinutes(60),
      "P1D", Duration.ofDays(1),
      "P7D", Duration.ofDays(7),
      "P1M", Duration.ofDays(30),
      "P1Y", Duration.ofDays(365)
  );

  static final Duration DEFAULT_MAX_SPAN = Duration.ofDays(31);

  private GridResampler() {
  }

  public static List<PricePoint> resample(PublicationDocument document, String resolution) {
    return resample(document, resolution, DEFAULT_MAX_SPAN);
  }

  /**
   * @param maxSpan largest allowed distance between the first and last observation
   * @throws UpstreamException of kind {@code DATA_FORMAT} for an unknown resolution, an unreadable
   *     period start, or observations spread over more than {@code maxSpan}
   */
  public static List<PricePoint> resample(PublicationDocument document, String resolution,
      Duration maxSpan) {
    Duration step = stepOf(resolution);
    NavigableMap<Instant, Double> observed = collect(document, resolution, step);
    if (observed.isEmpty()) {
      return List.of();
    }

    Instant first = observed.firstKey();
    Instant last = observed.lastKey();
    if (Duration.between(first, last).compareTo(maxSpan) > 0) {
      throw new UpstreamException(Kind.DATA_FORMAT, "Observations span " + first + " to " + last
          + ", more than " + maxSpan);
    }
    List<PricePoint> out = new ArrayList<>();
    Double carried = null;
    for (Instant t = first; !t.isAfter(last); t = t.plus(step)) {
      Double value = observed.get(t);
      carried = value != null ? value : carried;
      out.add(new PricePoint(t, carried));
    }
    return out;
  }

  static Duration stepOf(String resolution) {
    Duration step = resolution == null ? null : STEPS.get(resolution);
    if (step == null) {
      throw new UpstreamException(Kind.DATA_FORMAT, "Unsupported resolution: " + resolution);
    }
    return step;
  }

  private static NavigableMap<Instant, Double> collect(PublicationDocument document,
      String resolution, Duration step) {
    NavigableMap<Instant, Double> observed = new TreeMap<>();
    for (TimeSeries series : document.getTimeSeries()) {
      for (Period period : series.getPeriods()) {
        if (!resolution.equals(period.getResolution()) || period.getStart() == null) {
          continue;
        }
        Instant start = parseStart(period.getStart());
        for (Point point : period.getPoints()) {
          if (point.getPosition() == null || point.getPrice() == null) {
            continue;
          }
          Instant timestamp = start.plus(step.multipliedBy(point.getPosition() - 1L));
          observed.putIfAbsent(timestamp, point.getPrice());
        }
      }
    }
    return observed;
  }

  private static Instant parseStart(String start) {
    try {
      return OffsetDateTime.parse(start.trim()).toInstant();
    } catch (DateTimeParseException ex) {
      throw new UpstreamException(Kind.DATA_FORMAT, "Unreadable period start: " + start, ex);
    }
  }
}
