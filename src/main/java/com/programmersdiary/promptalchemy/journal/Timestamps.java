package com.programmersdiary.promptalchemy.journal;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Optional;

public final class Timestamps {

    private static final DateTimeFormatter FORMAT = DateTimeFormatter
            .ofPattern("uuuu-MM-dd'T'HH:mm:ss.SSSSSSXXX")
            .withZone(ZoneOffset.UTC);

    private Timestamps() {
    }

    public static String now(Clock clock) {
        return format(clock.instant());
    }

    public static String format(Instant instant) {
        return FORMAT.format(instant);
    }

    public static Optional<Instant> parse(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        var trimmed = text.trim();
        try {
            return Optional.of(OffsetDateTime.parse(trimmed).toInstant());
        } catch (DateTimeParseException ignored) {
            // fall through to the offset-less forms
        }
        try {
            return Optional.of(LocalDateTime.parse(trimmed).toInstant(ZoneOffset.UTC));
        } catch (DateTimeParseException ignored) {
            // fall through
        }
        try {
            return Optional.of(LocalDate.parse(trimmed).atStartOfDay().toInstant(ZoneOffset.UTC));
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }

    /**
     * Chronological order. Anything that does not parse is older than everything that does;
     * ties are broken on the raw text.
     */
    public static int compare(String a, String b) {
        return compare(a, parse(a).orElse(null), b, parse(b).orElse(null));
    }

    static int compare(String a, Instant parsedA, String b, Instant parsedB) {
        var rawA = a != null ? a : "";
        var rawB = b != null ? b : "";
        if (parsedA != null && parsedB != null) {
            var byTime = parsedA.compareTo(parsedB);
            return byTime != 0 ? byTime : rawA.compareTo(rawB);
        }
        if (parsedA != null) return 1;
        if (parsedB != null) return -1;
        return rawA.compareTo(rawB);
    }
}
