package com.ospicorp.priceapi.prices.source;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlElementWrapper;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlProperty;
import java.util.ArrayList;
import java.util.List;

/**
 * Schema of an ENTSO-E market document (A44 publication or acknowledgement). Only the elements the
 * price grid needs are mapped; everything else is ignored.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class PublicationDocument {

  @JacksonXmlElementWrapper(useWrapping = false)
  @JacksonXmlProperty(localName = "TimeSeries")
  private List<TimeSeries> timeSeries = new ArrayList<>();

  @JacksonXmlElementWrapper(useWrapping = false)
  @JacksonXmlProperty(localName = "Reason")
  private List<Reason> reasons = new ArrayList<>();

  public PublicationDocument() {
  }

  public PublicationDocument(List<TimeSeries> timeSeries) {
    this.timeSeries = new ArrayList<>(timeSeries);
  }

  public List<TimeSeries> getTimeSeries() {
    return timeSeries == null ? List.of() : timeSeries;
  }

  public List<Reason> getReasons() {
    return reasons == null ? List.of() : reasons;
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  public static class TimeSeries {

    @JacksonXmlElementWrapper(useWrapping = false)
    @JacksonXmlProperty(localName = "Period")
    private List<Period> periods = new ArrayList<>();

    public TimeSeries() {
    }

    public TimeSeries(List<Period> periods) {
      this.periods = new ArrayList<>(periods);
    }

    public List<Period> getPeriods() {
      return periods == null ? List.of() : periods;
    }
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  public static class Period {

    @JacksonXmlProperty(localName = "timeInterval")
    private TimeInterval timeInterval;

    @JacksonXmlProperty(localName = "resolution")
    private String resolution;

    @JacksonXmlElementWrapper(useWrapping = false)
    @JacksonXmlProperty(localName = "Point")
    private List<Point> points = new ArrayList<>();

    public Period() {
    }

    public Period(String start, String resolution, List<Point> points) {
      this.timeInterval = new TimeInterval(start);
      this.resolution = resolution;
      this.points = new ArrayList<>(points);
    }

    public String getStart() {
      return timeInterval == null ? null : timeInterval.start;
    }

    public String getResolution() {
      return resolution;
    }

    public List<Point> getPoints() {
      return points == null ? List.of() : points;
    }
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  public static class TimeInterval {

    @JacksonXmlProperty(localName = "start")
    private String start;

    public TimeInterval() {
    }

    TimeInterval(String start) {
      this.start = start;
    }
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  public static class Point {

    @JacksonXmlProperty(localName = "position")
    private Integer position;

    @JacksonXmlProperty(localName = "price.amount")
    private Double price;

    public Point() {
    }

    public Point(Integer position, Double price) {
      this.position = position;
      this.price = price;
    }

    public Integer getPosition() {
      return position;
    }

    public Double getPrice() {
      return price;
    }
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  public static class Reason {

    @JacksonXmlProperty(localName = "code")
    private String code;

    @JacksonXmlProperty(localName = "text")
    private String text;

    public String getCode() {
      return code;
    }

    public String getText() {
      return text;
    }
  }
}
