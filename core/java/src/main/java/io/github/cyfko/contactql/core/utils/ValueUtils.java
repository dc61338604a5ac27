package io.github.cyfko.contactql.core.utils;

import io.github.cyfko.contactql.core.exception.SearchException;

import java.math.BigDecimal;
import java.util.Locale;
import java.util.Optional;

/**
 * Conversions of query literals and stored values shared by the compiler and the evaluator, so
 * that both sides interpret a value the same way.
 *
 * @since 1.0.0
 */
public final class ValueUtils {

    /**
     * Number of leading characters of text values taken into account by equality.
     */
    public static final int STRING_VALUE_COMPARISON_LIMIT = 32;

    /**
     * Separator between the levels of a location path, e.g. {@code Rwanda > Eastern Province > Gatsibo}.
     */
    public static final String LOCATION_PATH_SEPARATOR = ">";

    private ValueUtils() {}

    /**
     * Parses a query literal as a decimal.
     *
     * @param value the literal
     * @return the decimal
     * @throws SearchException if the literal is not a number
     */
    public static BigDecimal parseDecimal(String value) {
        try {
            return new BigDecimal(value.strip());
        } catch (NumberFormatException e) {
            throw new SearchException(value + " isn't a valid number", e);
        }
    }

    /**
     * Parses a stored value as a decimal.
     *
     * @param value the stored value, may be {@code null}
     * @return the decimal, or empty if the value is missing or not a number
     */
    public static Optional<BigDecimal> toDecimal(String value) {
        if (value == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(new BigDecimal(value.strip()));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    /**
     * Normalizes a text value for equality: its first 32 characters, upper-cased.
     *
     * @param value the text
     * @return the comparison key
     */
    public static String textKey(String value) {
        String truncated = value.length() > STRING_VALUE_COMPARISON_LIMIT
                ? value.substring(0, STRING_VALUE_COMPARISON_LIMIT)
                : value;
        return truncated.toUpperCase(Locale.ROOT);
    }

    /**
     * Returns the boundary name at a level of a location path.
     * <p>
     * Level 1 is the first element after the country; a path {@code Rwanda > Eastern Province >
     * Gatsibo} has {@code Eastern Province} at level 1 and {@code Gatsibo} at level 2. A value with
     * no separator is taken to be the boundary name itself.
     * </p>
     *
     * @param path  the location path
     * @param level the boundary level, 1 to 3
     * @return the boundary name, or empty if the path doesn't reach that level
     */
    public static Optional<String> boundaryName(String path, int level) {
        if (path == null || path.isBlank()) {
            return Optional.empty();
        }
        if (!path.contains(LOCATION_PATH_SEPARATOR)) {
            return Optional.of(path.strip());
        }
        String[] parts = path.split(LOCATION_PATH_SEPARATOR);
        if (level >= parts.length) {
            return Optional.empty();
        }
        String name = parts[level].strip();
        return name.isEmpty() ? Optional.empty() : Optional.of(name);
    }

    public static boolean equalsIgnoreCase(String a, String b) {
        return a.toLowerCase(Locale.ROOT).equals(b.toLowerCase(Locale.ROOT));
    }

    public static boolean containsIgnoreCase(String haystack, String needle) {
        return haystack.toLowerCase(Locale.ROOT).contains(needle.toLowerCase(Locale.ROOT));
    }
}
