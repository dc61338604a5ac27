package io.github.cyfko.contactql.core.tree;

import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Comparator symbols of the query language.
 *
 * @since 1.0.0
 */
public final class Comparators {

    public static final String EQ = "=";
    public static final String NEQ = "!=";
    public static final String CONTAINS = "~";
    public static final String GT = ">";
    public static final String GTE = ">=";
    public static final String LT = "<";
    public static final String LTE = "<=";

    /** Equality plus the four ordering comparators, as accepted by dates. */
    public static final Set<String> ORDERED_EQ = Set.of(EQ, LT, LTE, GT, GTE);

    private static final Map<String, String> ALIASES = Map.of("is", EQ, "has", CONTAINS);

    private Comparators() {}

    /**
     * Lower-cases a comparator and replaces the word aliases {@code is} and {@code has}.
     *
     * @param comparator the comparator as written
     * @return the canonical comparator
     */
    public static String normalize(String comparator) {
        String lowered = comparator.toLowerCase(Locale.ROOT);
        return ALIASES.getOrDefault(lowered, lowered);
    }
}
