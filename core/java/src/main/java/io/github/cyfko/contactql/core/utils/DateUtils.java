package io.github.cyfko.contactql.core.utils;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.Year;
import java.time.ZoneId;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parsing of human-entered dates and times.
 * <p>
 * Values are first tried as full ISO-8601 date-times with an offset (machine-written values),
 * then as ISO-8601 dates or date-times without an offset, read in the organization timezone.
 * Otherwise the first {@code day month year} triple (or {@code month day year}, depending on the
 * organization's date order) forming a valid date is used, with separators {@code - . \ / _}
 * or space. Two-digit years are placed in the current century unless that would put them in
 * the future, in which case the previous century is used.
 * </p>
 *
 * <pre>{@code
 * DateUtils.parseDate("31/1/2014", zone, true);   // 2014-01-31
 * DateUtils.parseDate("1-31-14", zone, false);    // 2014-01-31
 * DateUtils.parseDate("2014-01-31", zone, true);  // 2014-01-31
 * DateUtils.parseDate("tomorrow", zone, true);    // empty
 * }</pre>
 *
 * @since 1.0.0
 */
public final class DateUtils {

    private static final Pattern FULL_ISO8601 =
            Pattern.compile("^\\d{4}-\\d{2}-\\d{2}T\\d{2}:\\d{2}:\\d{2}(\\.(\\d{0,9}))?([+\\-]\\d{2}:\\d{2}|Z)$");

    private static final Pattern LOCAL_ISO8601 =
            Pattern.compile("^\\d{4}-\\d{2}-\\d{2}(T\\d{2}:\\d{2}(:\\d{2}(\\.\\d{0,9})?)?)?$");

    private static final Pattern DAY_MONTH_YEAR =
            Pattern.compile("\\b([0-9]{1,2})[-.\\\\/_ ]([0-9]{1,2})[-.\\\\/_ ]([0-9]{4}|[0-9]{2})\\b");

    private static final Pattern HOUR_MINUTE_SECOND =
            Pattern.compile("\\b([0-9]{1,2}):([0-9]{2})(:([0-9]{2})(\\.(\\d+))?)?\\W*([aApP][mM])?\\b");

    private DateUtils() {}

    /**
     * Parses the local date a value designates.
     * <p>
     * Full ISO values keep the date as written in their own offset; other values are read in the
     * organization's date order and any time part is ignored.
     * </p>
     *
     * @param text     the value
     * @param zone     the organization timezone
     * @param dayFirst whether day comes before month
     * @return the date, or empty if none can be found
     */
    public static Optional<LocalDate> parseDate(String text, ZoneId zone, boolean dayFirst) {
        if (text == null) {
            return Optional.empty();
        }
        String cleaned = clean(text);

        Optional<OffsetDateTime> iso = parseIso(cleaned);
        if (iso.isPresent()) {
            return Optional.of(iso.get().toLocalDate());
        }
        Optional<LocalDateTime> local = parseLocalIso(cleaned);
        if (local.isPresent()) {
            return Optional.of(local.get().toLocalDate());
        }
        return dateFromOrgFormat(cleaned, Year.now(zone).getValue(), dayFirst);
    }

    /**
     * Parses a value to an instant, as stored date field values are.
     * <p>
     * Values without a time are placed at local midnight of the organization timezone.
     * </p>
     *
     * @param text     the value
     * @param zone     the organization timezone
     * @param dayFirst whether day comes before month
     * @return the instant, or empty if no date can be found
     */
    public static Optional<Instant> parseInstant(String text, ZoneId zone, boolean dayFirst) {
        if (text == null) {
            return Optional.empty();
        }
        String cleaned = clean(text);

        Optional<OffsetDateTime> iso = parseIso(cleaned);
        if (iso.isPresent()) {
            return Optional.of(iso.get().toInstant());
        }
        Optional<LocalDateTime> local = parseLocalIso(cleaned);
        if (local.isPresent()) {
            return Optional.of(local.get().atZone(zone).toInstant());
        }

        Optional<LocalDate> date = dateFromOrgFormat(cleaned, Year.now(zone).getValue(), dayFirst);
        if (date.isEmpty()) {
            return Optional.empty();
        }
        LocalTime time = parseTime(cleaned).orElse(LocalTime.MIDNIGHT);
        return Optional.of(LocalDateTime.of(date.get(), time).atZone(zone).toInstant());
    }

    /**
     * Returns the UTC window covering a local date in a timezone: from local midnight
     * (inclusive) to the next local midnight (exclusive).
     *
     * @param date the local date
     * @param zone the timezone
     * @return the window
     */
    public static UtcRange utcRange(LocalDate date, ZoneId zone) {
        Instant start = date.atStartOfDay(zone).toInstant();
        return new UtcRange(start, date.plusDays(1).atStartOfDay(zone).toInstant());
    }

    /**
     * Extracts the first valid {@code H:MM[:SS[.fff]] [am|pm]} time from a value.
     *
     * @param text the value
     * @return the time, or empty if none is found
     */
    public static Optional<LocalTime> parseTime(String text) {
        Matcher matcher = HOUR_MINUTE_SECOND.matcher(text);
        while (matcher.find()) {
            int hour = Integer.parseInt(matcher.group(1));
            int minute = Integer.parseInt(matcher.group(2));
            String amPm = matcher.group(7) == null ? null : matcher.group(7).toLowerCase(Locale.ROOT);

            if (hour < 12 && "pm".equals(amPm)) {
                hour += 12;
            } else if (hour == 12 && "am".equals(amPm)) {
                hour -= 12;
            }

            int second = matcher.group(4) == null ? 0 : Integer.parseInt(matcher.group(4));
            int nanos = matcher.group(6) == null ? 0 : fractionToNanos(matcher.group(6));

            try {
                return Optional.of(LocalTime.of(hour, minute, second, nanos));
            } catch (DateTimeException e) {
                // not a valid time, try the next match
            }
        }
        return Optional.empty();
    }

    static Optional<LocalDate> dateFromOrgFormat(String text, int currentYear, boolean dayFirst) {
        Matcher matcher = DAY_MONTH_YEAR.matcher(text);
        while (matcher.find()) {
            int day = Integer.parseInt(matcher.group(dayFirst ? 1 : 2));
            int month = Integer.parseInt(matcher.group(dayFirst ? 2 : 1));
            String yearText = matcher.group(3);
            int year = Integer.parseInt(yearText);

            if (yearText.length() == 2) {
                year += year > currentYear % 100 ? 1900 : 2000;
            }

            try {
                return Optional.of(LocalDate.of(year, month, day));
            } catch (DateTimeException e) {
                // not a valid date, try the next match
            }
        }
        return Optional.empty();
    }

    private static Optional<OffsetDateTime> parseIso(String text) {
        if (!FULL_ISO8601.matcher(text).matches()) {
            return Optional.empty();
        }
        try {
            return Optional.of(OffsetDateTime.parse(text));
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }

    private static Optional<LocalDateTime> parseLocalIso(String text) {
        if (!LOCAL_ISO8601.matcher(text).matches()) {
            return Optional.empty();
        }
        try {
            return Optional.of(text.length() == 10
                    ? LocalDate.parse(text).atStartOfDay()
                    : LocalDateTime.parse(text));
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }

    private static int fractionToNanos(String fraction) {
        String digits = fraction.length() > 9 ? fraction.substring(0, 9) : fraction;
        StringBuilder padded = new StringBuilder(digits);
        while (padded.length() < 9) {
            padded.append('0');
        }
        return Integer.parseInt(padded.toString());
    }

    private static String clean(String text) {
        String trimmed = text.strip();
        while (trimmed.endsWith(".")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        return trimmed;
    }

    /**
     * A half-open window of instants.
     *
     * @param start inclusive start, {@code null} if unbounded
     * @param end   exclusive end, {@code null} if unbounded
     */
    public record UtcRange(Instant start, Instant end) {

        public boolean contains(Instant instant) {
            return (start == null || !instant.isBefore(start)) && (end == null || instant.isBefore(end));
        }
    }
}
