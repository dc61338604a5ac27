package io.github.cyfko.contactql.core.resolve;

import io.github.cyfko.contactql.core.exception.SearchException;
import io.github.cyfko.contactql.core.model.ContactField;

import java.util.Objects;

/**
 * A query identifier resolved against an organization.
 *
 * @param identifier the identifier as used in the query, lower-cased
 * @param kind       what the identifier designates
 * @param field      the custom field, for field kinds only
 * @since 1.0.0
 */
public record ResolvedProperty(String identifier, PropertyKind kind, ContactField field) {

    public ResolvedProperty {
        Objects.requireNonNull(identifier, "identifier cannot be null");
        Objects.requireNonNull(kind, "kind cannot be null");
        if (kind.isField() && field == null) {
            throw new IllegalArgumentException("A field property requires its field definition: " + identifier);
        }
    }

    /**
     * @return the URN scheme to match, or {@code null} when any scheme matches
     */
    public String scheme() {
        return kind == PropertyKind.SCHEME ? identifier : null;
    }

    /**
     * Checks that a comparator can be applied to this property.
     *
     * @param comparator the normalized comparator
     * @throws SearchException if the property kind does not support it
     */
    public void requireComparator(String comparator) {
        if (!kind.supports(comparator)) {
            throw new SearchException("Can't query " + kind.description() + " with " + comparator);
        }
    }
}
