package io.github.cyfko.contactql.core.model;

import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Read-only view of the organization a query runs in.
 * <p>
 * Supplies everything query resolution depends on: the active custom fields, the timezone and
 * date order used to interpret date literals, and whether the organization is anonymous (in which
 * case URN values may only be tested for presence).
 * </p>
 *
 * <pre>{@code
 * Org org = Org.builder()
 *     .id(1L)
 *     .timezone(ZoneId.of("Africa/Kigali"))
 *     .dayFirst(true)
 *     .field(ContactField.of("age", ValueType.DECIMAL))
 *     .build();
 * }</pre>
 *
 * @param id       the organization id, used by store adapters to scope searches
 * @param timezone the timezone date literals are interpreted in
 * @param dayFirst whether dates are written day-first ({@code 31-01-2014}) or month-first
 * @param anon     whether URN values must never be exposed or queried
 * @param fields   active custom fields by key
 * @since 1.0.0
 */
public record Org(Long id, ZoneId timezone, boolean dayFirst, boolean anon, Map<String, ContactField> fields) {

    public Org {
        Objects.requireNonNull(timezone, "timezone cannot be null");
        fields = fields == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    public Optional<ContactField> field(String key) {
        return Optional.ofNullable(fields.get(key));
    }

    /**
     * @return a copy of this organization with the anonymous flag changed
     */
    public Org withAnon(boolean anon) {
        return new Org(id, timezone, dayFirst, anon, fields);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private Long _id;
        private ZoneId _timezone = ZoneOffset.UTC;
        private boolean _dayFirst = true;
        private boolean _anon = false;
        private final Map<String, ContactField> _fields = new LinkedHashMap<>();

        private Builder() {}

        public Org build() {
            return new Org(_id, _timezone, _dayFirst, _anon, _fields);
        }

        public Builder id(Long id) { this._id = id; return this; }
        public Builder timezone(ZoneId timezone) { this._timezone = timezone; return this; }
        public Builder dayFirst(boolean dayFirst) { this._dayFirst = dayFirst; return this; }
        public Builder anon(boolean anon) { this._anon = anon; return this; }
        public Builder field(ContactField field) { this._fields.put(field.key(), field); return this; }

        public Builder fields(Collection<ContactField> fields) {
            fields.forEach(this::field);
            return this;
        }
    }
}
