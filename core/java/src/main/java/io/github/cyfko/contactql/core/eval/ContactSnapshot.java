package io.github.cyfko.contactql.core.eval;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * The values of one contact that queries can test, as read from the contact JSON format:
 * <pre>{@code
 * {
 *   "uuid": "c7d2...",
 *   "id": 42,
 *   "name": "Trey Anastasio",
 *   "language": "eng",
 *   "created_on": "2014-01-02T10:00:00Z",
 *   "urns": ["tel:+250788382000", "twitter:tweep_1"],
 *   "fields": {"age": "23", "home": "Rwanda > Eastern Province > Gatsibo"}
 * }
 * }</pre>
 * Field values are kept as the raw strings they were set to; they are interpreted according to the
 * field's declared type when evaluated. Field keys are lower-cased, and {@code null} or empty
 * values are dropped since they mean "not set".
 *
 * @param uuid      the contact uuid
 * @param id        the contact id
 * @param name      the name, may be {@code null}
 * @param language  the ISO-639-3 language code, may be {@code null}
 * @param createdOn the creation instant
 * @param urns      URNs as {@code scheme:path} strings
 * @param fields    raw custom field values by field key
 * @since 1.0.0
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ContactSnapshot(
        String uuid,
        Long id,
        String name,
        String language,
        @JsonProperty("created_on") Instant createdOn,
        List<String> urns,
        Map<String, String> fields
) {
    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    public ContactSnapshot {
        urns = urns == null ? List.of() : List.copyOf(urns);
        Map<String, String> normalized = new LinkedHashMap<>();
        if (fields != null) {
            fields.forEach((key, value) -> {
                if (value != null && !value.isEmpty()) {
                    normalized.put(key.toLowerCase(Locale.ROOT), value);
                }
            });
        }
        fields = Map.copyOf(normalized);
    }

    /**
     * Reads a snapshot from contact JSON.
     *
     * @param json the JSON document
     * @return the snapshot
     * @throws IllegalArgumentException if the document is not a valid contact
     */
    public static ContactSnapshot fromJson(String json) {
        try {
            return OBJECT_MAPPER.readValue(json, ContactSnapshot.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid contact JSON: " + e.getOriginalMessage(), e);
        }
    }

    public String toJson() {
        try {
            return OBJECT_MAPPER.writeValueAsString(this);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unable to serialize contact " + uuid, e);
        }
    }

    public Optional<String> field(String key) {
        return Optional.ofNullable(fields.get(key));
    }

    /**
     * @return the URNs split into scheme and path; values without a scheme are ignored
     */
    public List<Urn> parsedUrns() {
        List<Urn> parsed = new ArrayList<>();
        for (String urn : urns) {
            int colon = urn.indexOf(':');
            if (colon > 0) {
                parsed.add(new Urn(urn.substring(0, colon).toLowerCase(Locale.ROOT), urn.substring(colon + 1)));
            }
        }
        return parsed;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @param scheme the lower-cased scheme
     * @param path   the scheme-specific path, e.g. a phone number
     */
    public record Urn(String scheme, String path) {}

    public static class Builder {
        private String _uuid;
        private Long _id;
        private String _name;
        private String _language;
        private Instant _createdOn;
        private final List<String> _urns = new ArrayList<>();
        private final Map<String, String> _fields = new LinkedHashMap<>();

        private Builder() {}

        public ContactSnapshot build() {
            return new ContactSnapshot(_uuid, _id, _name, _language, _createdOn, _urns, _fields);
        }

        public Builder uuid(String uuid) { this._uuid = uuid; return this; }
        public Builder id(Long id) { this._id = id; return this; }
        public Builder name(String name) { this._name = name; return this; }
        public Builder language(String language) { this._language = language; return this; }
        public Builder createdOn(Instant createdOn) { this._createdOn = createdOn; return this; }
        public Builder urn(String scheme, String path) { this._urns.add(scheme + ":" + path); return this; }
        public Builder field(String key, String value) { this._fields.put(key, value); return this; }
    }
}
