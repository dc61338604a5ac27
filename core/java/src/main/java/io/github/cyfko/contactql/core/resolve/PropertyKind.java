package io.github.cyfko.contactql.core.resolve;

import io.github.cyfko.contactql.core.tree.Comparators;

import java.util.Set;

/**
 * What a query identifier resolves to, with the comparators each kind accepts.
 *
 * @since 1.0.0
 */
public enum PropertyKind {
    NAME("contact properties", Set.of(Comparators.EQ, Comparators.CONTAINS, Comparators.NEQ)),
    UUID("contact properties", Set.of(Comparators.EQ, Comparators.NEQ)),
    LANGUAGE("contact properties", Set.of(Comparators.EQ, Comparators.NEQ)),
    CREATED_ON("contact properties", Comparators.ORDERED_EQ),
    ID("contact properties", Set.of(Comparators.EQ)),
    URN("contact URNs", Set.of(Comparators.EQ, Comparators.CONTAINS, Comparators.NEQ)),
    SCHEME("contact URNs", Set.of(Comparators.EQ, Comparators.CONTAINS, Comparators.NEQ)),
    TEXT_FIELD("text fields", Set.of(Comparators.EQ, Comparators.NEQ)),
    DECIMAL_FIELD("decimal fields", Set.of(Comparators.EQ, Comparators.NEQ, Comparators.LT,
            Comparators.LTE, Comparators.GT, Comparators.GTE)),
    DATETIME_FIELD("date fields", Comparators.ORDERED_EQ),
    LOCATION_FIELD("location fields", Set.of(Comparators.EQ, Comparators.CONTAINS, Comparators.NEQ));

    private final String description;
    private final Set<String> comparators;

    PropertyKind(String description, Set<String> comparators) {
        this.description = description;
        this.comparators = comparators;
    }

    /**
     * @return the plural description used in error messages, e.g. {@code "decimal fields"}
     */
    public String description() {
        return description;
    }

    public Set<String> comparators() {
        return comparators;
    }

    public boolean supports(String comparator) {
        return comparators.contains(comparator);
    }

    public boolean isAttribute() {
        return this == NAME || this == UUID || this == LANGUAGE || this == CREATED_ON || this == ID;
    }

    public boolean isUrn() {
        return this == URN || this == SCHEME;
    }

    public boolean isField() {
        return this == TEXT_FIELD || this == DECIMAL_FIELD || this == DATETIME_FIELD || this == LOCATION_FIELD;
    }
}
