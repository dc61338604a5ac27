package io.github.cyfko.contactql.core.tree;

import java.math.BigDecimal;
import java.util.List;
import java.util.Objects;

/**
 * A {@code property comparator value} clause such as {@code age > 18}.
 * <p>
 * The comparator is normalized on construction ({@code is} becomes {@code =}, {@code has}
 * becomes {@code ~}). Whether it is legal for the property is only known once the property is
 * resolved against an organization, so it is not checked here.
 * </p>
 *
 * @param prop       the lower-cased property name
 * @param comparator the normalized comparator
 * @param value      the literal; empty literals are parsed as {@link IsSetCondition} instead
 * @since 1.0.0
 */
public record Condition(String prop, String comparator, String value) implements PropertyCondition {

    public Condition {
        Objects.requireNonNull(prop, "prop cannot be null");
        Objects.requireNonNull(comparator, "comparator cannot be null");
        Objects.requireNonNull(value, "value cannot be null");
        comparator = Comparators.normalize(comparator);
    }

    @Override
    public List<String> propComparators() {
        return List.of(comparator);
    }

    /**
     * Numbers are written bare, everything else quoted with embedded quotes doubled.
     */
    @Override
    public String asText() {
        return prop + " " + comparator + " " + literal(value);
    }

    static String literal(String value) {
        if (isDecimal(value)) {
            return value;
        }
        return "\"" + value.replace("\"", "\"\"") + "\"";
    }

    private static boolean isDecimal(String value) {
        try {
            new BigDecimal(value);
            return true;
        } catch (NumberFormatException e) {
            return false;
        }
    }

    @Override
    public String toString() {
        return prop + comparator + value;
    }
}
