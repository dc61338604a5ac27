package io.github.cyfko.contactql.core.tree;

import java.util.List;

/**
 * A node of a parsed contact query: either a condition on a single property or a boolean
 * combination of other nodes.
 * <p>
 * Nodes are immutable and compare structurally, so two parses of the same text are
 * {@code equal}. They carry no organization or backend state: identifiers are resolved later by
 * whichever consumer walks the tree.
 * </p>
 *
 * @since 1.0.0
 */
public interface QueryNode {

    /**
     * Renders this node as canonical query text which parses back to an equivalent tree.
     *
     * @return the canonical text
     */
    String asText();

    /**
     * @return the property names referenced by this node, in order of appearance, duplicates included
     */
    List<String> propNames();

    /**
     * @return the comparators used by this node, with presence checks reported as {@code SET} or
     *         {@code NOTSET}
     */
    List<String> propComparators();
}
