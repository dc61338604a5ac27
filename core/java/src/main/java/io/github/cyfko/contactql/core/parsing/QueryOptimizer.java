package io.github.cyfko.contactql.core.parsing;

import io.github.cyfko.contactql.core.tree.BoolCombination;
import io.github.cyfko.contactql.core.tree.BoolOp;
import io.github.cyfko.contactql.core.tree.PropertyCondition;
import io.github.cyfko.contactql.core.tree.QueryNode;
import io.github.cyfko.contactql.core.tree.SinglePropCombination;

import java.util.ArrayList;
import java.util.List;

/**
 * Rewrites a raw query tree into its canonical optimized form.
 * <p>
 * Two bottom-up passes:
 * </p>
 * <ol>
 *   <li><strong>Flatten:</strong> {@code OR(OR(x, y), z)} becomes {@code OR(x, y, z)}. A child
 *       combined with a different operator is kept as a single child, so explicit grouping such
 *       as {@code (a or b) and c} survives.</li>
 *   <li><strong>Fold:</strong> consecutive conditions on the same property become one
 *       {@link SinglePropCombination}. Conditions are never moved across a condition on another
 *       property, and a combination left with one child is replaced by that child.</li>
 * </ol>
 * The result evaluates exactly like the input and optimizing it again changes nothing.
 *
 * @since 1.0.0
 */
public final class QueryOptimizer {

    private QueryOptimizer() {}

    public static QueryNode optimize(QueryNode root) {
        return fold(flatten(root));
    }

    static QueryNode flatten(QueryNode node) {
        if (!(node instanceof BoolCombination combination)) {
            return node;
        }

        List<QueryNode> children = new ArrayList<>();
        for (QueryNode child : combination.children()) {
            QueryNode flat = flatten(child);
            if (flat instanceof BoolCombination inner && inner.op() == combination.op()) {
                children.addAll(inner.children());
            } else if (flat instanceof SinglePropCombination inner && inner.op() == combination.op()) {
                children.addAll(inner.children());
            } else {
                children.add(flat);
            }
        }
        return new BoolCombination(combination.op(), children);
    }

    static QueryNode fold(QueryNode node) {
        if (!(node instanceof BoolCombination combination)) {
            return node;
        }

        List<QueryNode> folded = new ArrayList<>();
        List<PropertyCondition> run = new ArrayList<>();

        for (QueryNode child : combination.children()) {
            QueryNode current = fold(child);
            if (current instanceof PropertyCondition condition) {
                if (!run.isEmpty() && !run.get(0).prop().equals(condition.prop())) {
                    flush(run, combination.op(), folded);
                }
                run.add(condition);
            } else {
                flush(run, combination.op(), folded);
                folded.add(current);
            }
        }
        flush(run, combination.op(), folded);

        if (folded.size() == 1) {
            return folded.get(0);
        }
        return new BoolCombination(combination.op(), folded);
    }

    private static void flush(List<PropertyCondition> run, BoolOp op, List<QueryNode> out) {
        if (run.size() > 1) {
            out.add(new SinglePropCombination(run.get(0).prop(), op, run));
        } else if (run.size() == 1) {
            out.add(run.get(0));
        }
        run.clear();
    }
}
