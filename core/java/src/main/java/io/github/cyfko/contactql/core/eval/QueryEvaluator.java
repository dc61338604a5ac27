package io.github.cyfko.contactql.core.eval;

import io.github.cyfko.contactql.core.compile.QueryCompiler;
import io.github.cyfko.contactql.core.exception.SearchException;
import io.github.cyfko.contactql.core.model.Org;
import io.github.cyfko.contactql.core.tree.ContactQuery;

import java.util.Objects;

/**
 * Tests whether a single contact matches a query, without a store.
 * <p>
 * Evaluation goes through the {@link QueryCompiler} with a {@link SnapshotFilterContext}, so a
 * query accepts, rejects and interprets exactly the same things in memory as against a store.
 * </p>
 *
 * @since 1.0.0
 */
public final class QueryEvaluator {

    private QueryEvaluator() {}

    /**
     * @param query    the parsed query
     * @param org      the organization
     * @param snapshot the contact
     * @return whether the contact matches
     * @throws SearchException if the query cannot be applied in this organization
     */
    public static boolean evaluate(ContactQuery query, Org org, ContactSnapshot snapshot) {
        Objects.requireNonNull(snapshot, "snapshot cannot be null");
        SnapshotCondition condition = (SnapshotCondition) QueryCompiler.compile(query, org, new SnapshotFilterContext(org));
        return condition.test(snapshot);
    }
}
