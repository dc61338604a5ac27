package io.github.cyfko.contactql.core.group;

import io.github.cyfko.contactql.core.exception.SearchException;
import io.github.cyfko.contactql.core.model.ContactField;
import io.github.cyfko.contactql.core.tree.ContactQuery;

import java.util.List;
import java.util.Objects;

/**
 * A contact group whose members are the contacts matching a saved query.
 * <p>
 * The query is stored in its canonical text form, and the custom fields it references are
 * recorded so that a change to one of them only re-evaluates the groups depending on it.
 * Queries on {@code name} or {@code id} are rejected.
 * </p>
 *
 * @param name   the group name
 * @param query  the parsed, optimized query
 * @param fields the custom fields the query references
 * @since 1.0.0
 */
public record DynamicGroup(String name, ContactQuery query, List<ContactField> fields) {

    public DynamicGroup {
        Objects.requireNonNull(name, "name cannot be null");
        Objects.requireNonNull(query, "query cannot be null");
        if (name.isBlank()) {
            throw new IllegalArgumentException("Group name cannot be blank");
        }
        if (!query.canBeDynamicGroup()) {
            throw new SearchException("Cannot use query '" + query.asText() + "' as a dynamic group");
        }
        fields = fields == null ? List.of() : List.copyOf(fields);
    }

    /**
     * @return the canonical text of the query, as stored
     */
    public String queryText() {
        return query.asText();
    }

    /**
     * @param fieldKey a custom field key
     * @return whether a change to that field can change this group's membership
     */
    public boolean dependsOn(String fieldKey) {
        return fields.stream().anyMatch(field -> field.key().equals(fieldKey));
    }

    /**
     * A contact that was just created has URNs and perhaps a name but no field values yet, so it
     * can only join groups that test for a URN or for an unset value.
     *
     * @return whether this group can match a newly created contact
     */
    public boolean canMatchNewContact() {
        return query.hasIsNotSetCondition() || query.hasUrnCondition();
    }
}
