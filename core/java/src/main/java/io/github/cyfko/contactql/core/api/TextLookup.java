package io.github.cyfko.contactql.core.api;

/**
 * How a string value is matched against a query literal. Both lookups ignore case.
 *
 * @since 1.0.0
 */
public enum TextLookup {
    /** Whole value equality. */
    IEXACT,
    /** The literal appears anywhere in the value. */
    ICONTAINS
}
