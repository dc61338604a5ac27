package io.github.cyfko.contactql.core.tree;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * A combination whose conditions all target the same property with the same operator, e.g.
 * {@code name ~ "will" OR name ~ "felix" OR name ~ "matt"}.
 * <p>
 * Evaluates exactly like the equivalent {@link BoolCombination}; it exists so that backends can
 * query the property once (an OR of equalities becomes a single IN lookup).
 * </p>
 *
 * @param prop       the shared property
 * @param op         the boolean operator
 * @param children   the conditions, at least two, all on {@code prop}
 * @since 1.0.0
 */
public record SinglePropCombination(String prop, BoolOp op, List<PropertyCondition> children) implements QueryNode {

    public SinglePropCombination {
        Objects.requireNonNull(prop, "prop cannot be null");
        Objects.requireNonNull(op, "op cannot be null");
        children = List.copyOf(children);
        if (children.size() < 2) {
            throw new IllegalArgumentException("A combination needs at least two children, got " + children.size());
        }
        for (PropertyCondition child : children) {
            if (!prop.equals(child.prop())) {
                throw new IllegalArgumentException("Condition on '" + child.prop() + "' cannot join a combination on '" + prop + "'");
            }
        }
    }

    public static SinglePropCombination of(String prop, BoolOp op, PropertyCondition... children) {
        return new SinglePropCombination(prop, op, List.of(children));
    }

    @Override
    public List<String> propNames() {
        List<String> names = new ArrayList<>();
        children.forEach(child -> names.add(child.prop()));
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
        return BoolCombination.joinAsText(op, children);
    }

    @Override
    public String toString() {
        return op.name() + "[" + prop + "]" + children.stream()
                .map(c -> c.comparator() + c.value())
                .collect(Collectors.joining(", ", "(", ")"));
    }
}
