package io.github.cyfko.contactql.core.tree;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * A combination of two or more nodes with AND or OR.
 * <p>
 * The parser only builds binary, left-associative combinations ({@code a or b or c} is
 * {@code OR(OR(a, b), c)}); optimization flattens same-operator chains into one n-ary node.
 * </p>
 *
 * @param op       the boolean operator
 * @param children the combined nodes, at least two
 * @since 1.0.0
 */
public record BoolCombination(BoolOp op, List<QueryNode> children) implements QueryNode {

    public BoolCombination {
        Objects.requireNonNull(op, "op cannot be null");
        children = List.copyOf(children);
        if (children.size() < 2) {
            throw new IllegalArgumentException("A combination needs at least two children, got " + children.size());
        }
    }

    public static BoolCombination of(BoolOp op, QueryNode... children) {
        return new BoolCombination(op, List.of(children));
    }

    public static BoolCombination and(QueryNode left, QueryNode right) {
        return of(BoolOp.AND, left, right);
    }

    public static BoolCombination or(QueryNode left, QueryNode right) {
        return of(BoolOp.OR, left, right);
    }

    @Override
    public List<String> propNames() {
        List<String> names = new ArrayList<>();
        children.forEach(child -> names.addAll(child.propNames()));
        return names;
    }

    @Override
    public List<String> propComparators() {
        List<String> comparators = new ArrayList<>();
        children.forEach(child -> comparators.addAll(child.propComparators()));
        return comparators;
    }

    @Override
    public String asText() {
        return joinAsText(op, children);
    }

    static String joinAsText(BoolOp op, List<? extends QueryNode> children) {
        return children.stream()
                .map(child -> child instanceof PropertyCondition ? child.asText() : "(" + child.asText() + ")")
                .collect(Collectors.joining(" " + op.name() + " "));
    }

    @Override
    public String toString() {
        return op.name() + children.stream().map(Object::toString).collect(Collectors.joining(", ", "(", ")"));
    }
}
