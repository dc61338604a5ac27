package io.github.cyfko.contactql.core.tree;

import java.util.List;

/**
 * A leaf node comparing one property against one literal.
 *
 * @since 1.0.0
 */
public interface PropertyCondition extends QueryNode {

    String prop();

    String comparator();

    /**
     * @return the literal compared against, the empty string for presence checks
     */
    String value();

    @Override
    default List<String> propNames() {
        return List.of(prop());
    }
}
