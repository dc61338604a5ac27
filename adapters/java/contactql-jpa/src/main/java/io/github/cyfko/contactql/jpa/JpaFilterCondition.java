package io.github.cyfko.contactql.jpa;

import io.github.cyfko.contactql.core.api.FilterCondition;

import java.util.Objects;

/**
 * JPA Criteria implementation of {@link FilterCondition}.
 * <p>
 * Wraps a {@link PredicateResolver}; boolean operations compose resolvers and return new
 * instances, so predicates are only built when a query is executed.
 * </p>
 *
 * <pre>{@code
 * JpaFilterCondition<Contact> trey = new JpaFilterCondition<>((root, query, cb) ->
 *     cb.equal(cb.lower(root.get("name")), "trey"));
 * JpaFilterCondition<Contact> recent = new JpaFilterCondition<>((root, query, cb) ->
 *     cb.greaterThanOrEqualTo(root.get("createdOn"), since));
 *
 * // name = trey AND NOT(created_on >= since)
 * FilterCondition combined = trey.and(recent.not());
 * }</pre>
 *
 * @param <T>      the entity type filtered
 * @param resolver the wrapped resolver
 * @since 1.0.0
 * @see JpaFilterContext
 */
public record JpaFilterCondition<T>(PredicateResolver<T> resolver) implements FilterCondition {

    public JpaFilterCondition {
        Objects.requireNonNull(resolver, "resolver cannot be null");
    }

    /**
     * @throws IllegalArgumentException if the other condition is not a JPA condition
     */
    @Override
    public FilterCondition and(FilterCondition other) {
        JpaFilterCondition<T> otherCond = cast(other);
        return new JpaFilterCondition<T>((r, q, cb) -> cb.and(
                this.resolver.resolve(r, q, cb),
                otherCond.resolver.resolve(r, q, cb)
        ));
    }

    /**
     * @throws IllegalArgumentException if the other condition is not a JPA condition
     */
    @Override
    public FilterCondition or(FilterCondition other) {
        JpaFilterCondition<T> otherCond = cast(other);
        return new JpaFilterCondition<T>((r, q, cb) -> cb.or(
                this.resolver.resolve(r, q, cb),
                otherCond.resolver.resolve(r, q, cb)
        ));
    }

    @Override
    public FilterCondition not() {
        return new JpaFilterCondition<T>((r, q, cb) -> cb.not(this.resolver.resolve(r, q, cb)));
    }

    @SuppressWarnings("unchecked")
    private JpaFilterCondition<T> cast(FilterCondition other) {
        if (!(other instanceof JpaFilterCondition<?>)) {
            throw new IllegalArgumentException("Cannot combine with non-JPA condition");
        }
        return (JpaFilterCondition<T>) other;
    }
}
