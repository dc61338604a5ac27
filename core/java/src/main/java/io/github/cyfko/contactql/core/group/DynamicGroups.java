package io.github.cyfko.contactql.core.group;

import io.github.cyfko.contactql.core.eval.ContactSnapshot;
import io.github.cyfko.contactql.core.eval.QueryEvaluator;
import io.github.cyfko.contactql.core.exception.SearchException;
import io.github.cyfko.contactql.core.model.Org;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * In-memory re-evaluation of dynamic group membership for a single contact.
 *
 * @since 1.0.0
 */
public final class DynamicGroups {

    private static final Logger log = Logger.getLogger(DynamicGroups.class.getName());

    private DynamicGroups() {}

    /**
     * Returns the groups a contact belongs to.
     * <p>
     * A group whose query no longer applies to the organization (a referenced field was deleted,
     * for instance) has no members; the failure is logged.
     * </p>
     *
     * @param org     the organization
     * @param groups  the dynamic groups to check
     * @param contact the contact
     * @param isNew   whether the contact was just created, in which case only groups that
     *                {@linkplain DynamicGroup#canMatchNewContact() can match a new contact} are evaluated
     * @return the groups the contact belongs to, in the given order
     */
    public static List<DynamicGroup> memberships(Org org, Collection<DynamicGroup> groups, ContactSnapshot contact, boolean isNew) {
        List<DynamicGroup> members = new ArrayList<>();
        for (DynamicGroup group : groups) {
            if (isNew && !group.canMatchNewContact()) {
                continue;
            }
            if (isMember(org, group, contact)) {
                members.add(group);
            }
        }

        log.fine(() -> String.format("Contact %s belongs to %d of %d dynamic groups", contact.uuid(), members.size(), groups.size()));
        return members;
    }

    public static List<DynamicGroup> memberships(Org org, Collection<DynamicGroup> groups, ContactSnapshot contact) {
        return memberships(org, groups, contact, false);
    }

    /**
     * @param groups   the dynamic groups
     * @param fieldKey the key of a changed field
     * @return the groups whose membership may change when that field changes
     */
    public static List<DynamicGroup> affectedBy(Collection<DynamicGroup> groups, String fieldKey) {
        return groups.stream().filter(group -> group.dependsOn(fieldKey)).toList();
    }

    private static boolean isMember(Org org, DynamicGroup group, ContactSnapshot contact) {
        try {
            return QueryEvaluator.evaluate(group.query(), org, contact);
        } catch (SearchException e) {
            log.log(Level.WARNING, String.format("Unable to evaluate dynamic group '%s': %s", group.name(), e.getMessage()), e);
            return false;
        }
    }
}
