package io.github.cyfko.contactql.core.eval;

import io.github.cyfko.contactql.core.api.FilterCondition;

import java.util.Objects;
import java.util.function.Predicate;

/**
 * {@link FilterCondition} backed by a predicate over a single contact snapshot.
 *
 * @param predicate the test
 * @since 1.0.0
 */
public record SnapshotCondition(Predicate<ContactSnapshot> predicate) implements FilterCondition {

    public SnapshotCondition {
        Objects.requireNonNull(predicate, "predicate cannot be null");
    }

    public boolean test(ContactSnapshot snapshot) {
        return predicate.test(snapshot);
    }

    @Override
    public FilterCondition and(FilterCondition other) {
        return new SnapshotCondition(predicate.and(unwrap(other).predicate));
    }

    @Override
    public FilterCondition or(FilterCondition other) {
        return new SnapshotCondition(predicate.or(unwrap(other).predicate));
    }

    @Override
    public FilterCondition not() {
        return new SnapshotCondition(predicate.negate());
    }

    private static SnapshotCondition unwrap(FilterCondition other) {
        if (other instanceof SnapshotCondition snapshotCondition) {
            return snapshotCondition;
        }
        throw new IllegalArgumentException("Cannot combine with a condition of another backend: " + other.getClass().getName());
    }
}
