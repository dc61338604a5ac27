package io.github.cyfko.contactql.core.eval;

import io.github.cyfko.contactql.core.api.FilterCondition;
import io.github.cyfko.contactql.core.api.FilterContext;
import io.github.cyfko.contactql.core.api.TextLookup;
import io.github.cyfko.contactql.core.model.ContactField;
import io.github.cyfko.contactql.core.model.Org;
import io.github.cyfko.contactql.core.resolve.PropertyKind;
import io.github.cyfko.contactql.core.utils.DateUtils;
import io.github.cyfko.contactql.core.utils.ValueUtils;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;

/**
 * {@link FilterContext} evaluating primitives against an in-memory {@link ContactSnapshot}.
 * <p>
 * Stored field values are raw strings and are converted to the field's type on every test; a
 * value that doesn't convert is treated as missing, just as a store only holds typed values that
 * converted when they were set.
 * </p>
 *
 * @since 1.0.0
 */
public class SnapshotFilterContext implements FilterContext {

    private final Org org;

    public SnapshotFilterContext(Org org) {
        this.org = Objects.requireNonNull(org, "org cannot be null");
    }

    @Override
    public FilterCondition attribute(PropertyKind attribute, TextLookup lookup, String value) {
        Function<ContactSnapshot, String> getter = attributeGetter(attribute);
        return new SnapshotCondition(contact -> {
            String actual = getter.apply(contact);
            return actual != null && matches(lookup, actual, value);
        });
    }

    @Override
    public FilterCondition attributeSet(PropertyKind attribute) {
        Function<ContactSnapshot, String> getter = attributeGetter(attribute);
        return new SnapshotCondition(contact -> {
            String actual = getter.apply(contact);
            return actual != null && !actual.isEmpty();
        });
    }

    @Override
    public FilterCondition createdOn(Instant from, Instant to) {
        DateUtils.UtcRange range = new DateUtils.UtcRange(from, to);
        return new SnapshotCondition(contact -> contact.createdOn() != null && range.contains(contact.createdOn()));
    }

    @Override
    public FilterCondition idEquals(long id) {
        return new SnapshotCondition(contact -> contact.id() != null && contact.id() == id);
    }

    @Override
    public FilterCondition urn(String scheme, TextLookup lookup, String value) {
        return new SnapshotCondition(contact -> contact.parsedUrns().stream()
                .anyMatch(urn -> (scheme == null || scheme.equals(urn.scheme())) && matches(lookup, urn.path(), value)));
    }

    @Override
    public FilterCondition urnSet(String scheme) {
        return new SnapshotCondition(contact -> contact.parsedUrns().stream()
                .anyMatch(urn -> scheme == null || scheme.equals(urn.scheme())));
    }

    @Override
    public FilterCondition textFieldIn(ContactField field, Collection<String> keys) {
        Set<String> accepted = Set.copyOf(keys);
        return new SnapshotCondition(contact -> contact.field(field.key())
                .map(ValueUtils::textKey)
                .filter(accepted::contains)
                .isPresent());
    }

    @Override
    public FilterCondition decimalField(ContactField field, String comparator, BigDecimal value) {
        return new SnapshotCondition(contact -> decimalValue(contact, field)
                .map(actual -> compare(actual.compareTo(value), comparator))
                .orElse(false));
    }

    @Override
    public FilterCondition decimalFieldIn(ContactField field, Collection<BigDecimal> values) {
        List<BigDecimal> accepted = List.copyOf(values);
        return new SnapshotCondition(contact -> decimalValue(contact, field)
                .map(actual -> accepted.stream().anyMatch(v -> v.compareTo(actual) == 0))
                .orElse(false));
    }

    @Override
    public FilterCondition datetimeField(ContactField field, Instant from, Instant to) {
        DateUtils.UtcRange range = new DateUtils.UtcRange(from, to);
        return new SnapshotCondition(contact -> datetimeValue(contact, field).map(range::contains).orElse(false));
    }

    @Override
    public FilterCondition locationField(ContactField field, TextLookup lookup, Collection<String> names) {
        List<String> accepted = List.copyOf(names);
        return new SnapshotCondition(contact -> locationValue(contact, field)
                .map(actual -> accepted.stream().anyMatch(name -> matches(lookup, actual, name)))
                .orElse(false));
    }

    @Override
    public FilterCondition fieldSet(ContactField field) {
        return new SnapshotCondition(contact -> switch (field.valueType()) {
            case TEXT -> contact.field(field.key()).isPresent();
            case DECIMAL -> decimalValue(contact, field).isPresent();
            case DATETIME -> datetimeValue(contact, field).isPresent();
            case STATE, DISTRICT, WARD -> locationValue(contact, field).isPresent();
        });
    }

    @Override
    public FilterCondition none() {
        return new SnapshotCondition(contact -> false);
    }

    private Optional<BigDecimal> decimalValue(ContactSnapshot contact, ContactField field) {
        return contact.field(field.key()).flatMap(ValueUtils::toDecimal);
    }

    private Optional<Instant> datetimeValue(ContactSnapshot contact, ContactField field) {
        return contact.field(field.key()).flatMap(v -> DateUtils.parseInstant(v, org.timezone(), org.dayFirst()));
    }

    private Optional<String> locationValue(ContactSnapshot contact, ContactField field) {
        return contact.field(field.key()).flatMap(v -> ValueUtils.boundaryName(v, field.valueType().boundaryLevel()));
    }

    private static Function<ContactSnapshot, String> attributeGetter(PropertyKind attribute) {
        return switch (attribute) {
            case NAME -> ContactSnapshot::name;
            case UUID -> ContactSnapshot::uuid;
            case LANGUAGE -> ContactSnapshot::language;
            default -> throw new IllegalArgumentException("Not a string attribute: " + attribute);
        };
    }

    private static boolean matches(TextLookup lookup, String actual, String value) {
        return lookup == TextLookup.ICONTAINS
                ? ValueUtils.containsIgnoreCase(actual, value)
                : ValueUtils.equalsIgnoreCase(actual, value);
    }

    private static boolean compare(int comparison, String comparator) {
        return switch (comparator) {
            case "=" -> comparison == 0;
            case "<" -> comparison < 0;
            case "<=" -> comparison <= 0;
            case ">" -> comparison > 0;
            case ">=" -> comparison >= 0;
            default -> throw new IllegalArgumentException("Not a decimal comparator: " + comparator);
        };
    }
}
