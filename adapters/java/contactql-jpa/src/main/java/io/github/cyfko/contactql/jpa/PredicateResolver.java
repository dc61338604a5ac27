package io.github.cyfko.contactql.jpa;

import jakarta.persistence.criteria.CriteriaBuilder;
import jakarta.persistence.criteria.CriteriaQuery;
import jakarta.persistence.criteria.Predicate;
import jakarta.persistence.criteria.Root;

/**
 * Deferred generator of JPA Criteria predicates.
 * <p>
 * A resolver captures how to build a predicate, not the predicate itself: it is invoked once per
 * criteria query with that query's root and builder, so the same resolver can be reused across
 * queries and threads. Resolvers needing subqueries create them from the given {@code query}.
 * </p>
 *
 * <pre>{@code
 * PredicateResolver<Contact> named = (root, query, cb) ->
 *     cb.equal(cb.lower(root.get("name")), "trey");
 *
 * CriteriaQuery<Contact> query = cb.createQuery(Contact.class);
 * Root<Contact> root = query.from(Contact.class);
 * query.where(named.resolve(root, query, cb));
 * }</pre>
 *
 * @param <E> the entity type predicates apply to
 * @author Frank KOSSI
 * @since 1.0.0
 */
@FunctionalInterface
public interface PredicateResolver<E> {

    /**
     * @param root  the root of the criteria query
     * @param query the criteria query being built, used to create subqueries
     * @param cb    the criteria builder
     * @return the predicate
     */
    Predicate resolve(Root<E> root, CriteriaQuery<?> query, CriteriaBuilder cb);
}
