package io.github.cyfko.contactql.jpa;

import io.github.cyfko.contactql.core.api.QueryParser;
import io.github.cyfko.contactql.core.compile.QueryCompiler;
import io.github.cyfko.contactql.core.exception.SearchException;
import io.github.cyfko.contactql.core.impl.BasicQueryParser;
import io.github.cyfko.contactql.core.model.Org;
import io.github.cyfko.contactql.core.tree.ContactQuery;
import io.github.cyfko.contactql.jpa.model.Contact;
import jakarta.persistence.EntityManager;
import jakarta.persistence.criteria.CriteriaBuilder;
import jakarta.persistence.criteria.CriteriaQuery;
import jakarta.persistence.criteria.Predicate;
import jakarta.persistence.criteria.Root;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Runs contact queries against the JPA contact store.
 * <p>
 * Results are always restricted to the organization's contacts and, when a base set of contact
 * ids is given, to those contacts. Restricting to a base set is how a single contact's dynamic
 * group membership is checked in the store.
 * </p>
 *
 * <pre>{@code
 * JpaContactSearch search = new JpaContactSearch();
 *
 * List<Contact> farmers = search.search(em, org, "profession = farmer");
 * long adults = search.count(em, org, "age >= 18");
 * boolean member = search.count(em, org, group.queryText(), List.of(contact.getId())) > 0;
 * }</pre>
 *
 * @since 1.0.0
 */
public class JpaContactSearch {

    private static final Logger logger = Logger.getLogger(JpaContactSearch.class.getName());

    private final QueryParser parser;
    private final JpaFilterContext context = new JpaFilterContext();

    public JpaContactSearch() {
        this(new BasicQueryParser());
    }

    public JpaContactSearch(QueryParser parser) {
        this.parser = Objects.requireNonNull(parser, "parser cannot be null");
    }

    public List<Contact> search(EntityManager em, Org org, String text) {
        return search(em, org, text, null);
    }

    /**
     * Finds the contacts matching a query, ordered by id.
     *
     * @param em      the entity manager
     * @param org     the organization searched
     * @param text    the query text
     * @param baseSet ids of the only contacts to consider, or {@code null} for all
     * @return the matching contacts
     * @throws SearchException if the query is invalid or cannot be applied in the organization
     */
    public List<Contact> search(EntityManager em, Org org, String text, Collection<Long> baseSet) {
        long startTime = System.nanoTime();
        PredicateResolver<Contact> resolver = resolver(org, text);

        CriteriaBuilder cb = em.getCriteriaBuilder();
        CriteriaQuery<Contact> query = cb.createQuery(Contact.class);
        Root<Contact> root = query.from(Contact.class);
        query.select(root)
                .where(scoped(root, query, cb, org, baseSet, resolver))
                .orderBy(cb.asc(root.get("id")));

        List<Contact> contacts = em.createQuery(query).getResultList();

        long durationMs = (System.nanoTime() - startTime) / 1_000_000;
        logger.info(() -> String.format("Contact search completed in %dms: %d matches", durationMs, contacts.size()));
        return contacts;
    }

    public long count(EntityManager em, Org org, String text) {
        return count(em, org, text, null);
    }

    /**
     * Counts the contacts matching a query.
     *
     * @param em      the entity manager
     * @param org     the organization searched
     * @param text    the query text
     * @param baseSet ids of the only contacts to consider, or {@code null} for all
     * @return the number of matching contacts
     * @throws SearchException if the query is invalid or cannot be applied in the organization
     */
    public long count(EntityManager em, Org org, String text, Collection<Long> baseSet) {
        long startTime = System.nanoTime();
        PredicateResolver<Contact> resolver = resolver(org, text);

        CriteriaBuilder cb = em.getCriteriaBuilder();
        CriteriaQuery<Long> query = cb.createQuery(Long.class);
        Root<Contact> root = query.from(Contact.class);
        query.select(cb.count(root)).where(scoped(root, query, cb, org, baseSet, resolver));

        Long count = em.createQuery(query).getSingleResult();

        long durationMs = (System.nanoTime() - startTime) / 1_000_000;
        logger.info(() -> String.format("Contact count completed in %dms: %d matches", durationMs, count));
        return count;
    }

    private PredicateResolver<Contact> resolver(Org org, String text) {
        Objects.requireNonNull(org, "org cannot be null");
        if (org.id() == null) {
            throw new IllegalStateException("Searching the contact store requires an organization id");
        }

        ContactQuery parsed = parser.parse(text, org.anon());
        logger.fine(() -> String.format("Searching org %d for: %s", org.id(), parsed.asText()));

        @SuppressWarnings("unchecked")
        JpaFilterCondition<Contact> condition = (JpaFilterCondition<Contact>) QueryCompiler.compile(parsed, org, context);
        return condition.resolver();
    }

    private static Predicate scoped(Root<Contact> root, CriteriaQuery<?> query, CriteriaBuilder cb,
                                    Org org, Collection<Long> baseSet, PredicateResolver<Contact> resolver) {
        List<Predicate> predicates = new ArrayList<>();
        predicates.add(cb.equal(root.get("orgId"), org.id()));
        if (baseSet != null) {
            if (baseSet.isEmpty()) {
                predicates.add(cb.isNull(root.get("id")));
            } else {
                predicates.add(root.get("id").in(baseSet));
            }
        }
        predicates.add(resolver.resolve(root, query, cb));
        return cb.and(predicates.toArray(new Predicate[0]));
    }
}
