package io.github.cyfko.contactql.core.tree;

/**
 * Boolean operator joining the children of a combination.
 *
 * @since 1.0.0
 */
public enum BoolOp {
    AND,
    OR
}
