package io.github.cyfko.contactql.core.resolve;

import io.github.cyfko.contactql.core.exception.SearchException;
import io.github.cyfko.contactql.core.model.ContactField;
import io.github.cyfko.contactql.core.model.Org;
import io.github.cyfko.contactql.core.model.UrnScheme;
import io.github.cyfko.contactql.core.tree.IsSetCondition;
import io.github.cyfko.contactql.core.tree.PropertyCondition;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Maps query identifiers to the contact property they designate.
 * <p>
 * Lookup order is: reserved attributes ({@code name}, {@code uuid}, {@code language},
 * {@code created_on}, and {@code id} in anonymous organizations only), the generic {@code urn}
 * property, the registered URN schemes, and finally the organization's active custom fields.
 * A custom field can therefore never shadow an attribute or a scheme.
 * </p>
 *
 * @since 1.0.0
 */
public final class PropertyResolver {

    private static final Map<String, PropertyKind> ATTRIBUTES = Map.of(
            "name", PropertyKind.NAME,
            "uuid", PropertyKind.UUID,
            "language", PropertyKind.LANGUAGE,
            "created_on", PropertyKind.CREATED_ON
    );

    private PropertyResolver() {}

    /**
     * Resolves an identifier.
     *
     * @param org        the organization providing custom fields
     * @param identifier the identifier, matched case-insensitively
     * @return the resolved property
     * @throws SearchException if nothing matches the identifier
     */
    public static ResolvedProperty resolve(Org org, String identifier) {
        String key = identifier.toLowerCase(Locale.ROOT);

        PropertyKind attribute = ATTRIBUTES.get(key);
        if (attribute != null) {
            return new ResolvedProperty(key, attribute, null);
        }
        if ("id".equals(key) && org.anon()) {
            return new ResolvedProperty(key, PropertyKind.ID, null);
        }
        if (UrnScheme.ANY.equals(key)) {
            return new ResolvedProperty(key, PropertyKind.URN, null);
        }
        if (UrnScheme.isRegistered(key)) {
            return new ResolvedProperty(key, PropertyKind.SCHEME, null);
        }

        Optional<ContactField> field = org.field(key);
        if (field.isPresent()) {
            return new ResolvedProperty(key, fieldKind(field.get()), field.get());
        }

        throw new SearchException("Unrecognized contact field identifier " + identifier);
    }

    /**
     * Resolves the property of a condition and checks the condition can be applied to it.
     * <p>
     * Presence checks are legal on every property. Value comparisons must use a comparator
     * of the property's kind, and may not target URNs in anonymous organizations.
     * </p>
     *
     * @param org       the organization
     * @param condition the condition
     * @return the resolved property
     * @throws SearchException if the identifier is unknown or the comparison is not allowed
     */
    public static ResolvedProperty resolveFor(Org org, PropertyCondition condition) {
        ResolvedProperty property = resolve(org, condition.prop());
        if (condition instanceof IsSetCondition isSet) {
            isSet.isSet(); // rejects anything but = and !=
            return property;
        }
        if (org.anon() && property.kind().isUrn()) {
            throw new SearchException("Can't query contact URNs in an anonymous organization");
        }
        property.requireComparator(condition.comparator());
        return property;
    }

    static PropertyKind fieldKind(ContactField field) {
        return switch (field.valueType()) {
            case TEXT -> PropertyKind.TEXT_FIELD;
            case DECIMAL -> PropertyKind.DECIMAL_FIELD;
            case DATETIME -> PropertyKind.DATETIME_FIELD;
            case STATE, DISTRICT, WARD -> PropertyKind.LOCATION_FIELD;
        };
    }
}
