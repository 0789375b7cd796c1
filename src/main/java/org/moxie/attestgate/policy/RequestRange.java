package org.moxie.attestgate.policy;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;
import java.util.Optional;

/**
 * A {@code <start>/<end>} time range embedded in a request URL after a fixed path marker,
 * e.g. {@code https://api.example.org/intensity/2024-01-01T00:00Z/2024-01-01T00:30Z}.
 */
public record RequestRange(String startIso, String endIso, Instant start, Instant end) {

  private static final DateTimeFormatter BOUND = new DateTimeFormatterBuilder().append(DateTimeFormatter.ISO_LOCAL_DATE)
                                                                              .optionalStart()
                                                                              .appendLiteral('T')
                                                                              .append(DateTimeFormatter.ISO_LOCAL_TIME)
                                                                              .optionalStart()
                                                                              .appendOffsetId()
                                                                              .optionalEnd()
                                                                              .optionalEnd()
                                                                              .toFormatter();

  public boolean valid() {
    return end.isAfter(start);
  }

  /**
   * @return empty when the marker is absent or either bound does not parse as a date or timestamp
   */
  public static Optional<RequestRange> parse(String url, String marker) {
    if (url == null || marker == null || marker.isEmpty()) return Optional.empty();

    int index = url.indexOf(marker);
    if (index < 0) return Optional.empty();

    String tail = url.substring(index + marker.length());
    int    query = tail.indexOf('?');
    if (query >= 0) tail = tail.substring(0, query);

    String[] chunks = tail.split("/");
    if (chunks.length < 2) return Optional.empty();

    Optional<Instant> start = instant(chunks[0]);
    Optional<Instant> end   = instant(chunks[1]);

    if (start.isEmpty() || end.isEmpty()) return Optional.empty();

    return Optional.of(new RequestRange(chunks[0], chunks[1], start.get(), end.get()));
  }

  private static Optional<Instant> instant(String value) {
    try {
      TemporalAccessor parsed = BOUND.parseBest(value, OffsetDateTime::from, LocalDateTime::from, LocalDate::from);

      if (parsed instanceof OffsetDateTime offset) return Optional.of(offset.toInstant());
      if (parsed instanceof LocalDateTime local)   return Optional.of(local.toInstant(ZoneOffset.UTC));

      return Optional.of(((LocalDate) parsed).atStartOfDay().toInstant(ZoneOffset.UTC));
    } catch (DateTimeParseException e) {
      return Optional.empty();
    }
  }
}
