package io.github.cyfko.contactql.core.tree;

import io.github.cyfko.contactql.core.model.UrnScheme;
import io.github.cyfko.contactql.core.parsing.QueryOptimizer;

import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * A parsed contact query: the root of a tree of conditions and boolean combinations.
 * <p>
 * The same instance is consumed by both the query compiler (which lowers it to a store
 * predicate) and the in-memory evaluator (which tests a single contact snapshot).
 * </p>
 *
 * @param root the root node
 * @since 1.0.0
 */
public record ContactQuery(QueryNode root) {

    private static final Set<String> NOT_ALLOWED_IN_GROUPS = Set.of("name", "id");

    public ContactQuery {
        Objects.requireNonNull(root, "root cannot be null");
    }

    /**
     * @return an equivalent query with same-operator chains flattened and same-property
     *         conditions folded
     */
    public ContactQuery optimized() {
        return new ContactQuery(QueryOptimizer.optimize(root));
    }

    public String asText() {
        return root.asText();
    }

    /**
     * @return the distinct property names referenced, in order of first appearance
     */
    public Set<String> propNames() {
        return new LinkedHashSet<>(root.propNames());
    }

    /**
     * Dynamic groups are re-evaluated as contact data changes, which rules out properties a
     * contact can't meaningfully change into.
     *
     * @return {@code false} if the query references {@code name} or {@code id}
     */
    public boolean canBeDynamicGroup() {
        return propNames().stream().noneMatch(NOT_ALLOWED_IN_GROUPS::contains);
    }

    public boolean hasIsNotSetCondition() {
        return root.propComparators().contains("NOTSET");
    }

    public boolean hasUrnCondition() {
        return propNames().stream().anyMatch(p -> UrnScheme.ANY.equals(p) || UrnScheme.isRegistered(p));
    }

    @Override
    public String toString() {
        return root.toString();
    }
}
