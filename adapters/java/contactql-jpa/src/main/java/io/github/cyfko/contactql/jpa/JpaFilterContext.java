package io.github.cyfko.contactql.jpa;

import io.github.cyfko.contactql.core.api.FilterCondition;
import io.github.cyfko.contactql.core.api.FilterContext;
import io.github.cyfko.contactql.core.api.TextLookup;
import io.github.cyfko.contactql.core.model.ContactField;
import io.github.cyfko.contactql.core.resolve.PropertyKind;
import io.github.cyfko.contactql.core.utils.ValueUtils;
import io.github.cyfko.contactql.jpa.model.AdminBoundary;
import io.github.cyfko.contactql.jpa.model.Contact;
import io.github.cyfko.contactql.jpa.model.ContactFieldValue;
import io.github.cyfko.contactql.jpa.model.ContactUrn;
import jakarta.persistence.criteria.CriteriaBuilder;
import jakarta.persistence.criteria.Expression;
import jakarta.persistence.criteria.Join;
import jakarta.persistence.criteria.Path;
import jakarta.persistence.criteria.Predicate;
import jakarta.persistence.criteria.Root;
import jakarta.persistence.criteria.Subquery;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.function.BiFunction;

/**
 * JPA Criteria implementation of {@link FilterContext} over the {@link Contact} store.
 * <p>
 * Attribute primitives test columns of the contact row. URN and field primitives are
 * {@code EXISTS} subqueries on {@link ContactUrn} and {@link ContactFieldValue} correlated with
 * the contact, which keeps every primitive a plain boolean over contacts: negating one with
 * {@code NOT} includes the contacts that have no value at all.
 * </p>
 *
 * <h2>Null handling</h2>
 * <p>
 * SQL comparisons against {@code NULL} are unknown rather than false, and {@code NOT(unknown)}
 * stays unknown. Attribute primitives are therefore guarded with {@code IS NOT NULL}, so that
 * {@code name != "trey"} matches contacts without a name.
 * </p>
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * JpaFilterCondition<Contact> condition = (JpaFilterCondition<Contact>)
 *     QueryCompiler.compile(query, org, new JpaFilterContext());
 *
 * CriteriaQuery<Contact> cq = cb.createQuery(Contact.class);
 * Root<Contact> root = cq.from(Contact.class);
 * cq.where(condition.resolver().resolve(root, cq, cb));
 * }</pre>
 *
 * <p>The context holds no state and can be shared.</p>
 *
 * @since 1.0.0
 */
public class JpaFilterContext implements FilterContext {

    private static final char LIKE_ESCAPE = '\\';

    @Override
    public FilterCondition attribute(PropertyKind attribute, TextLookup lookup, String value) {
        String column = attributeColumn(attribute);
        return condition((root, query, cb) -> {
            Path<String> path = root.get(column);
            return cb.and(cb.isNotNull(path), matches(cb, path, lookup, value));
        });
    }

    @Override
    public FilterCondition attributeSet(PropertyKind attribute) {
        String column = attributeColumn(attribute);
        return condition((root, query, cb) -> {
            Path<String> path = root.get(column);
            return cb.and(cb.isNotNull(path), cb.notEqual(path, ""));
        });
    }

    @Override
    public FilterCondition createdOn(Instant from, Instant to) {
        return condition((root, query, cb) -> window(cb, root.get("createdOn"), from, to));
    }

    @Override
    public FilterCondition idEquals(long id) {
        return condition((root, query, cb) -> cb.equal(root.get("id"), id));
    }

    @Override
    public FilterCondition urn(String scheme, TextLookup lookup, String value) {
        return urnExists(scheme, (urn, cb) -> matches(cb, urn.get("path"), lookup, value));
    }

    @Override
    public FilterCondition urnSet(String scheme) {
        return urnExists(scheme, null);
    }

    @Override
    public FilterCondition textFieldIn(ContactField field, Collection<String> keys) {
        List<String> accepted = List.copyOf(keys);
        return valueExists(field, (value, cb) -> {
            Expression<String> key = cb.upper(cb.substring(value.get("stringValue"), 1,
                    ValueUtils.STRING_VALUE_COMPARISON_LIMIT));
            return key.in(accepted);
        });
    }

    @Override
    public FilterCondition decimalField(ContactField field, String comparator, BigDecimal operand) {
        return valueExists(field, (value, cb) -> {
            Path<BigDecimal> path = value.get("decimalValue");
            return switch (comparator) {
                case "=" -> cb.equal(path, operand);
                case "<" -> cb.lessThan(path, operand);
                case "<=" -> cb.lessThanOrEqualTo(path, operand);
                case ">" -> cb.greaterThan(path, operand);
                case ">=" -> cb.greaterThanOrEqualTo(path, operand);
                default -> throw new IllegalArgumentException("Not a decimal comparator: " + comparator);
            };
        });
    }

    @Override
    public FilterCondition decimalFieldIn(ContactField field, Collection<BigDecimal> values) {
        List<BigDecimal> accepted = List.copyOf(values);
        return valueExists(field, (value, cb) -> value.<BigDecimal>get("decimalValue").in(accepted));
    }

    @Override
    public FilterCondition datetimeField(ContactField field, Instant from, Instant to) {
        return valueExists(field, (value, cb) -> window(cb, value.get("datetimeValue"), from, to));
    }

    @Override
    public FilterCondition locationField(ContactField field, TextLookup lookup, Collection<String> names) {
        List<String> accepted = List.copyOf(names);
        int level = field.valueType().boundaryLevel();
        return valueExists(field, (value, cb) -> {
            Join<ContactFieldValue, AdminBoundary> boundary = value.join("locationValue");
            Predicate[] nameMatches = accepted.stream()
                    .map(name -> matches(cb, boundary.get("name"), lookup, name))
                    .toArray(Predicate[]::new);
            return cb.and(cb.equal(boundary.get("level"), level), cb.or(nameMatches));
        });
    }

    @Override
    public FilterCondition fieldSet(ContactField field) {
        String column = switch (field.valueType()) {
            case TEXT -> "stringValue";
            case DECIMAL -> "decimalValue";
            case DATETIME -> "datetimeValue";
            case STATE, DISTRICT, WARD -> "locationValue";
        };
        return valueExists(field, (value, cb) -> cb.isNotNull(value.get(column)));
    }

    @Override
    public FilterCondition none() {
        // ids are never null; unlike an empty disjunction this negates cleanly
        return condition((root, query, cb) -> cb.isNull(root.get("id")));
    }

    private static JpaFilterCondition<Contact> condition(PredicateResolver<Contact> resolver) {
        return new JpaFilterCondition<>(resolver);
    }

    private static JpaFilterCondition<Contact> urnExists(String scheme, BiFunction<Root<ContactUrn>, CriteriaBuilder, Predicate> pathPredicate) {
        return condition((root, query, cb) -> {
            Subquery<Long> subquery = query.subquery(Long.class);
            Root<ContactUrn> urn = subquery.from(ContactUrn.class);

            List<Predicate> where = new ArrayList<>();
            where.add(cb.equal(urn.get("contact"), root));
            if (scheme != null) {
                where.add(cb.equal(urn.get("scheme"), scheme));
            }
            if (pathPredicate != null) {
                where.add(pathPredicate.apply(urn, cb));
            }

            subquery.select(urn.get("id")).where(where.toArray(new Predicate[0]));
            return cb.exists(subquery);
        });
    }

    private static JpaFilterCondition<Contact> valueExists(ContactField field, BiFunction<Root<ContactFieldValue>, CriteriaBuilder, Predicate> valuePredicate) {
        String key = field.key();
        return condition((root, query, cb) -> {
            Subquery<Long> subquery = query.subquery(Long.class);
            Root<ContactFieldValue> value = subquery.from(ContactFieldValue.class);
            subquery.select(value.get("id")).where(
                    cb.equal(value.get("contact"), root),
                    cb.equal(value.get("fieldKey"), key),
                    valuePredicate.apply(value, cb)
            );
            return cb.exists(subquery);
        });
    }

    private static Predicate window(CriteriaBuilder cb, Path<Instant> path, Instant from, Instant to) {
        List<Predicate> bounds = new ArrayList<>();
        bounds.add(cb.isNotNull(path));
        if (from != null) {
            bounds.add(cb.greaterThanOrEqualTo(path, from));
        }
        if (to != null) {
            bounds.add(cb.lessThan(path, to));
        }
        return cb.and(bounds.toArray(new Predicate[0]));
    }

    private static Predicate matches(CriteriaBuilder cb, Expression<String> expression, TextLookup lookup, String value) {
        String lowered = value.toLowerCase(Locale.ROOT);
        if (lookup == TextLookup.ICONTAINS) {
            return cb.like(cb.lower(expression), "%" + escapeLike(lowered) + "%", LIKE_ESCAPE);
        }
        return cb.equal(cb.lower(expression), lowered);
    }

    static String escapeLike(String value) {
        StringBuilder escaped = new StringBuilder(value.length());
        for (char c : value.toCharArray()) {
            if (c == LIKE_ESCAPE || c == '%' || c == '_') {
                escaped.append(LIKE_ESCAPE);
            }
            escaped.append(c);
        }
        return escaped.toString();
    }

    private static String attributeColumn(PropertyKind attribute) {
        return switch (attribute) {
            case NAME -> "name";
            case UUID -> "uuid";
            case LANGUAGE -> "language";
            default -> throw new IllegalArgumentException("Not a string attribute: " + attribute);
        };
    }
}
