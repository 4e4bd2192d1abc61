package tech.clusterops.sdk.resilience;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Parser for the {@code Retry-After} response header.
 *
 * <p>Supports both forms from RFC 7231 section 7.1.3:
 * <ul>
 *   <li>delta-seconds, e.g. {@code 120}</li>
 *   <li>HTTP-date, e.g. {@code Sun, 06 Nov 1994 08:49:37 GMT}</li>
 * </ul>
 * Malformed values and dates that are not in the future yield an empty result.
 */
public final class RetryAfter {

    private static final Pattern DELTA_SECONDS = Pattern.compile("\\d+");

    private RetryAfter() {}

    public static Optional<Duration> parse(String value, Clock clock) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String trimmed = value.trim();

        if (DELTA_SECONDS.matcher(trimmed).matches()) {
            try {
                return Optional.of(Duration.ofSeconds(Long.parseLong(trimmed)));
            } catch (NumberFormatException e) {
                return Optional.empty();
            }
        }

        try {
            Instant date = ZonedDateTime.parse(trimmed, DateTimeFormatter.RFC_1123_DATE_TIME).toInstant();
            Instant now = clock.instant();
            return date.isAfter(now) ? Optional.of(Duration.between(now, date)) : Optional.empty();
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }
}
