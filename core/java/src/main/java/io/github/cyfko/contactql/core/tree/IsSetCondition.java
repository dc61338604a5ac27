package io.github.cyfko.contactql.core.tree;

import io.github.cyfko.contactql.core.exception.SearchException;

import java.util.List;
import java.util.Objects;

/**
 * A comparison against the empty string, testing whether a property has a value.
 * <ul>
 *   <li>{@code x != ""} means "x is set"</li>
 *   <li>{@code x = ""} (or {@code x is ""}) means "x is not set"</li>
 * </ul>
 * Presence checks bypass the per-type comparator tables, so every property supports them,
 * including URNs in anonymous organizations.
 *
 * @param prop       the lower-cased property name
 * @param comparator the normalized comparator
 * @since 1.0.0
 */
public record IsSetCondition(String prop, String comparator) implements PropertyCondition {

    public IsSetCondition {
        Objects.requireNonNull(prop, "prop cannot be null");
        Objects.requireNonNull(comparator, "comparator cannot be null");
        comparator = Comparators.normalize(comparator);
    }

    @Override
    public String value() {
        return "";
    }

    /**
     * @return {@code true} for an "is set" check, {@code false} for "is not set"
     * @throws SearchException if the comparator has no meaning against an empty string
     */
    public boolean isSet() {
        if (Comparators.NEQ.equals(comparator)) {
            return true;
        }
        if (Comparators.EQ.equals(comparator)) {
            return false;
        }
        throw new SearchException("Invalid operator for empty string comparison");
    }

    @Override
    public List<String> propComparators() {
        return List.of(Comparators.NEQ.equals(comparator) ? "SET" : "NOTSET");
    }

    @Override
    public String asText() {
        return prop + " " + comparator + " \"\"";
    }

    @Override
    public String toString() {
        return prop + comparator;
    }
}
