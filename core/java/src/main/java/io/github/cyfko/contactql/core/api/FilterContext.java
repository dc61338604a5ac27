package io.github.cyfko.contactql.core.api;

import io.github.cyfko.contactql.core.model.ContactField;
import io.github.cyfko.contactql.core.resolve.PropertyKind;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Collection;

/**
 * Backend bridge creating the primitive {@link FilterCondition}s a contact query is compiled into.
 * <p>
 * The query compiler resolves identifiers, checks comparators and converts literals before
 * calling into the context, so implementations only translate already-validated, typed requests
 * into their own predicate language. Every primitive is positive; the compiler obtains
 * {@code !=} and "not set" through {@link FilterCondition#not()}.
 * </p>
 *
 * <h2>Contract</h2>
 * <ul>
 *   <li>A contact without the tested value never satisfies a primitive, so that its negation
 *       includes it.</li>
 *   <li>Field primitives only consider values stored with the field's declared type: a text
 *       stored in a decimal field is not a decimal value.</li>
 *   <li>Half-open datetime windows use inclusive lower and exclusive upper bounds; a
 *       {@code null} bound is unbounded.</li>
 * </ul>
 *
 * <h2>Thread Safety</h2>
 * <p>
 * A context may be bound to per-query backend state (a criteria query, for instance). Use one
 * context per compilation unless the implementation documents otherwise.
 * </p>
 *
 * @see FilterCondition
 * @see io.github.cyfko.contactql.core.compile.QueryCompiler
 * @author Frank KOSSI
 * @since 1.0.0
 */
public interface FilterContext {

    /**
     * Matches a string attribute ({@link PropertyKind#NAME}, {@link PropertyKind#UUID} or
     * {@link PropertyKind#LANGUAGE}).
     *
     * @param attribute the attribute
     * @param lookup    how to match
     * @param value     the literal
     * @return the condition
     */
    FilterCondition attribute(PropertyKind attribute, TextLookup lookup, String value);

    /**
     * Matches contacts whose string attribute is neither null nor empty.
     *
     * @param attribute the attribute
     * @return the condition
     */
    FilterCondition attributeSet(PropertyKind attribute);

    /**
     * Matches contacts created within {@code [from, to)}.
     *
     * @param from inclusive lower bound, or {@code null}
     * @param to   exclusive upper bound, or {@code null}
     * @return the condition
     */
    FilterCondition createdOn(Instant from, Instant to);

    /**
     * @param id the contact id
     * @return a condition matching that single contact
     */
    FilterCondition idEquals(long id);

    /**
     * Matches contacts having a URN whose path matches the literal.
     *
     * @param scheme the scheme, or {@code null} for any scheme
     * @param lookup how to match the path
     * @param value  the literal
     * @return the condition
     */
    FilterCondition urn(String scheme, TextLookup lookup, String value);

    /**
     * @param scheme the scheme, or {@code null} for any scheme
     * @return a condition matching contacts having at least one such URN
     */
    FilterCondition urnSet(String scheme);

    /**
     * Matches text field values by comparison key (see
     * {@link io.github.cyfko.contactql.core.utils.ValueUtils#textKey(String)}).
     *
     * @param field the text field
     * @param keys  the accepted keys, already normalized
     * @return the condition
     */
    FilterCondition textFieldIn(ContactField field, Collection<String> keys);

    /**
     * @param field      the decimal field
     * @param comparator one of {@code = < <= > >=}
     * @param value      the operand
     * @return the condition
     */
    FilterCondition decimalField(ContactField field, String comparator, BigDecimal value);

    /**
     * @param field  the decimal field
     * @param values the accepted values
     * @return the condition
     */
    FilterCondition decimalFieldIn(ContactField field, Collection<BigDecimal> values);

    /**
     * Matches datetime field values within {@code [from, to)}.
     *
     * @param field the datetime field
     * @param from  inclusive lower bound, or {@code null}
     * @param to    exclusive upper bound, or {@code null}
     * @return the condition
     */
    FilterCondition datetimeField(ContactField field, Instant from, Instant to);

    /**
     * Matches location field values pointing to a boundary at the field's level whose name
     * matches any of the given names.
     *
     * @param field  the location field
     * @param lookup how to match boundary names
     * @param names  the literals
     * @return the condition
     */
    FilterCondition locationField(ContactField field, TextLookup lookup, Collection<String> names);

    /**
     * @param field the field
     * @return a condition matching contacts having a value of the field's type
     */
    FilterCondition fieldSet(ContactField field);

    /**
     * @return a condition no contact satisfies
     */
    FilterCondition none();
}
