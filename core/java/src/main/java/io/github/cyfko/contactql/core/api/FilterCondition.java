package io.github.cyfko.contactql.core.api;

/**
 * Backend-agnostic, composable predicate over contacts.
 * <p>
 * Instances are produced by a {@link FilterContext} and combined by the query compiler. They
 * follow the composite pattern: every operation returns a new condition and leaves its operands
 * unchanged, so conditions are immutable and can be shared between threads.
 * </p>
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * FilterCondition young = context.decimalField(age, Comparators.LT, new BigDecimal("18"));
 * FilterCondition male = context.textFieldIn(gender, List.of("MALE"));
 *
 * // age < 18 AND NOT(gender = male)
 * FilterCondition combined = young.and(male.not());
 * }</pre>
 *
 * @see FilterContext
 * @author Frank KOSSI
 * @since 1.0.0
 */
public interface FilterCondition {

    /**
     * @param other the other condition
     * @return a condition satisfied when both this and {@code other} are
     */
    FilterCondition and(FilterCondition other);

    /**
     * @param other the other condition
     * @return a condition satisfied when this or {@code other} is
     */
    FilterCondition or(FilterCondition other);

    /**
     * Negation is total: a contact lacking the tested value satisfies the negated condition.
     *
     * @return a condition satisfied exactly when this one is not
     */
    FilterCondition not();
}
