package com.finpulse.ingest.util;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Date;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;
import java.util.regex.Pattern;

/**
 * Best-effort conversion of source date values into instants.
 * Understands ISO-8601 (with or without offset/time), the dotted day-first
 * format of local bank exports, space-separated date-times and epoch numbers.
 * Values without an offset are read in the supplied zone.
 */
public final class TransactionDates {

    // above this an epoch number is taken as milliseconds
    private static final long EPOCH_MILLIS_THRESHOLD = 100_000_000_000L;

    private static final Pattern EPOCH_PATTERN = Pattern.compile("-?\\d{9,13}");

    private static final List<DateTimeFormatter> LOCAL_DATE_TIME_FORMATS = List.of(
            DateTimeFormatter.ISO_LOCAL_DATE_TIME,
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss"),
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm"),
            DateTimeFormatter.ofPattern("dd.MM.yyyy HH:mm:ss"),
            DateTimeFormatter.ofPattern("dd.MM.yyyy HH:mm")
    );

    private static final List<DateTimeFormatter> LOCAL_DATE_FORMATS = List.of(
            DateTimeFormatter.ISO_LOCAL_DATE,
            DateTimeFormatter.BASIC_ISO_DATE,
            DateTimeFormatter.ofPattern("dd.MM.yyyy"),
            DateTimeFormatter.ofPattern("dd/MM/yyyy")
    );

    private TransactionDates() {
    }

    public static Optional<Instant> toInstant(Object value, ZoneId zone) {
        if (value == null) {
            return Optional.empty();
        }
        if (value instanceof Instant instant) {
            return Optional.of(instant);
        }
        if (value instanceof OffsetDateTime offsetDateTime) {
            return Optional.of(offsetDateTime.toInstant());
        }
        if (value instanceof ZonedDateTime zonedDateTime) {
            return Optional.of(zonedDateTime.toInstant());
        }
        if (value instanceof LocalDateTime localDateTime) {
            return Optional.of(localDateTime.atZone(zone).toInstant());
        }
        if (value instanceof LocalDate localDate) {
            return Optional.of(localDate.atStartOfDay(zone).toInstant());
        }
        if (value instanceof Date date) {
            return Optional.of(date.toInstant());
        }
        if (value instanceof Number number) {
            return attempt(() -> fromEpoch(number.longValue()));
        }
        return parse(value.toString().trim(), zone);
    }

    private static Optional<Instant> parse(String text, ZoneId zone) {
        if (text.isEmpty()) {
            return Optional.empty();
        }
        if (EPOCH_PATTERN.matcher(text).matches()) {
            return attempt(() -> fromEpoch(Long.parseLong(text)));
        }

        List<Supplier<Instant>> parsers = new ArrayList<>();
        parsers.add(() -> OffsetDateTime.parse(text).toInstant());
        for (DateTimeFormatter format : LOCAL_DATE_TIME_FORMATS) {
            parsers.add(() -> LocalDateTime.parse(text, format).atZone(zone).toInstant());
        }
        for (DateTimeFormatter format : LOCAL_DATE_FORMATS) {
            parsers.add(() -> LocalDate.parse(text, format).atStartOfDay(zone).toInstant());
        }

        return parsers.stream()
                .map(TransactionDates::attempt)
                .flatMap(Optional::stream)
                .findFirst();
    }

    private static Instant fromEpoch(long epoch) {
        return Math.abs(epoch) >= EPOCH_MILLIS_THRESHOLD
                ? Instant.ofEpochMilli(epoch)
                : Instant.ofEpochSecond(epoch);
    }

    private static Optional<Instant> attempt(Supplier<Instant> parser) {
        try {
            return Optional.of(parser.get());
        } catch (DateTimeException e) {
            return Optional.empty();
        }
    }
}
