package io.github.cyfko.contactql.core.model;

import java.util.Locale;
import java.util.Objects;

/**
 * A custom contact field defined by an organization.
 *
 * @param key       the identifier used in queries, always lower-case
 * @param label     the display label
 * @param valueType the declared value kind
 * @since 1.0.0
 */
public record ContactField(String key, String label, ValueType valueType) {

    public ContactField {
        Objects.requireNonNull(key, "key cannot be null");
        Objects.requireNonNull(valueType, "valueType cannot be null");
        if (key.isBlank()) {
            throw new IllegalArgumentException("Field key cannot be blank");
        }
        key = key.toLowerCase(Locale.ROOT);
        if (label == null) {
            label = key;
        }
    }

    public static ContactField of(String key, ValueType valueType) {
        return new ContactField(key, key, valueType);
    }
}
