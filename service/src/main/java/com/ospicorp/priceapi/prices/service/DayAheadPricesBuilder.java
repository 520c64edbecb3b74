package com.ospicorp.priceapi.prices.service;

import com.ospicorp.priceapi.config.PriceApiProperties;
import com.ospicorp.priceapi.prices.model.DayAheadPrices;
import com.ospicorp.priceapi.prices.model.PricePoint;
import com.ospicorp.priceapi.prices.model.Resolution;
import com.ospicorp.priceapi.prices.source.UpstreamException;
import com.ospicorp.priceapi.prices.source.UpstreamException.Kind;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.List;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

@Component
public class DayAheadPricesBuilder {

  private final LocalTime cutover;
  private final ZoneId marketZone;

  @Autowired
  public DayAheadPricesBuilder(PriceApiProperties properties) {
    this(properties.refresh().cutover(), properties.refresh().marketZone());
  }

  public DayAheadPricesBuilder(LocalTime cutover, ZoneId marketZone) {
    this.cutover = cutover;
    this.marketZone = marketZone;
  }

  /**
   * Builds the payload for a resampled series fetched on {@code marketDay}.
   *
   * <p>A series that does not yet reach into the next day is due again at today's cutover, when the
   * next auction result is expected; otherwise at tomorrow's cutover. The cutover moves on by whole
   * days until it lies after the first price.
   *
   * @throws UpstreamException of kind {@code DATA_FORMAT} when the series is shorter than the
   *     resolution's minimum
   */
  public DayAheadPrices build(Resolution resolution, List<PricePoint> series, LocalDate marketDay) {
    if (series.size() < resolution.minimumLength()) {
      throw new UpstreamException(Kind.DATA_FORMAT, "Only " + series.size() + " "
          + resolution.pathCode() + " prices, need at least " + resolution.minimumLength());
    }

    long firstDate = series.get(0).timestamp().getEpochSecond();
    List<Integer> prices = new ArrayList<>(series.size());
    for (PricePoint point : series) {
      prices.add(toHundredths(point.value()));
    }

    LocalDate dueDay = series.size() < resolution.extendedHorizonLength()
        ? marketDay
        : marketDay.plusDays(1);
    ZonedDateTime next = ZonedDateTime.of(dueDay, cutover, marketZone);
    while (next.toEpochSecond() <= firstDate) {
      next = next.plusDays(1);
    }
    return new DayAheadPrices(firstDate, prices, next.toEpochSecond());
  }

  static int toHundredths(double price) {
    return (int) (price * 100);
  }
}
