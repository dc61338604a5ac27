package io.github.cyfko.contactql.core.compile;

import io.github.cyfko.contactql.core.api.FilterCondition;
import io.github.cyfko.contactql.core.api.FilterContext;
import io.github.cyfko.contactql.core.api.TextLookup;
import io.github.cyfko.contactql.core.exception.SearchException;
import io.github.cyfko.contactql.core.model.Org;
import io.github.cyfko.contactql.core.resolve.PropertyKind;
import io.github.cyfko.contactql.core.resolve.PropertyResolver;
import io.github.cyfko.contactql.core.resolve.ResolvedProperty;
import io.github.cyfko.contactql.core.tree.BoolCombination;
import io.github.cyfko.contactql.core.tree.BoolOp;
import io.github.cyfko.contactql.core.tree.Comparators;
import io.github.cyfko.contactql.core.tree.ContactQuery;
import io.github.cyfko.contactql.core.tree.IsSetCondition;
import io.github.cyfko.contactql.core.tree.PropertyCondition;
import io.github.cyfko.contactql.core.tree.QueryNode;
import io.github.cyfko.contactql.core.tree.SinglePropCombination;
import io.github.cyfko.contactql.core.utils.DateUtils;
import io.github.cyfko.contactql.core.utils.ValueUtils;

import java.time.LocalDate;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Lowers a parsed contact query to a backend predicate.
 * <p>
 * The compiler walks the tree once. For every leaf it resolves the property against the
 * organization, checks the comparator, converts the literal to the property's type and asks the
 * {@link FilterContext} for the matching primitive. Combinations fold their children with
 * {@link FilterCondition#and} / {@link FilterCondition#or}; {@code !=} and "not set" negate the
 * positive primitive.
 * </p>
 *
 * <h2>IN lookups</h2>
 * <p>
 * A {@link SinglePropCombination} ORing only {@code =} conditions on a text, decimal or location
 * field is compiled to a single primitive over all its values, e.g.
 * {@code profession = doctor or profession = farmer} queries the field once.
 * </p>
 *
 * <pre>{@code
 * ContactQuery query = parser.parse("age > 18 and gender = male", org.anon());
 * FilterCondition condition = QueryCompiler.compile(query, org, new JpaFilterContext());
 * }</pre>
 *
 * @see io.github.cyfko.contactql.core.eval.QueryEvaluator
 * @since 1.0.0
 */
public final class QueryCompiler {

    private static final Logger log = Logger.getLogger(QueryCompiler.class.getName());

    private static final Pattern INTEGER = Pattern.compile("^[+-]?\\d+$");

    private final Org org;
    private final FilterContext context;

    private QueryCompiler(Org org, FilterContext context) {
        this.org = org;
        this.context = context;
    }

    /**
     * Compiles a query.
     *
     * @param query   the parsed query
     * @param org     the organization properties are resolved against
     * @param context the backend creating primitives
     * @return the combined condition
     * @throws SearchException if a property is unknown, a comparator is not allowed or a literal
     *                         cannot be converted
     */
    public static FilterCondition compile(ContactQuery query, Org org, FilterContext context) {
        Objects.requireNonNull(query, "query cannot be null");
        Objects.requireNonNull(org, "org cannot be null");
        Objects.requireNonNull(context, "context cannot be null");

        log.fine(() -> String.format("Compiling contact query: %s", query));
        return new QueryCompiler(org, context).compileNode(query.root());
    }

    private FilterCondition compileNode(QueryNode node) {
        if (node instanceof BoolCombination combination) {
            return fold(combination.op(), combination.children().stream().map(this::compileNode).toList());
        }
        if (node instanceof SinglePropCombination combination) {
            return compileSingleProp(combination);
        }
        if (node instanceof PropertyCondition condition) {
            return compileCondition(condition);
        }
        throw new IllegalStateException("Unsupported query node: " + node.getClass().getName());
    }

    private FilterCondition compileSingleProp(SinglePropCombination combination) {
        List<ResolvedProperty> properties = combination.children().stream()
                .map(child -> PropertyResolver.resolveFor(org, child))
                .toList();
        ResolvedProperty property = properties.get(0);

        if (isInLookupCandidate(combination, property)) {
            List<String> values = combination.children().stream().map(PropertyCondition::value).toList();
            log.fine(() -> String.format("Using IN lookup on '%s' for %d values", property.identifier(), values.size()));
            return switch (property.kind()) {
                case TEXT_FIELD -> context.textFieldIn(property.field(),
                        values.stream().map(ValueUtils::textKey).collect(Collectors.toList()));
                case DECIMAL_FIELD -> context.decimalFieldIn(property.field(),
                        values.stream().map(ValueUtils::parseDecimal).collect(Collectors.toList()));
                default -> context.locationField(property.field(), TextLookup.IEXACT, values);
            };
        }

        return fold(combination.op(), combination.children().stream().map(this::compileCondition).toList());
    }

    private static boolean isInLookupCandidate(SinglePropCombination combination, ResolvedProperty property) {
        if (combination.op() != BoolOp.OR) {
            return false;
        }
        PropertyKind kind = property.kind();
        if (kind != PropertyKind.TEXT_FIELD && kind != PropertyKind.DECIMAL_FIELD && kind != PropertyKind.LOCATION_FIELD) {
            return false;
        }
        return combination.children().stream()
                .allMatch(child -> !(child instanceof IsSetCondition) && Comparators.EQ.equals(child.comparator()));
    }

    private FilterCondition compileCondition(PropertyCondition condition) {
        ResolvedProperty property = PropertyResolver.resolveFor(org, condition);

        if (condition instanceof IsSetCondition isSetCondition) {
            FilterCondition present = presence(property);
            return isSetCondition.isSet() ? present : present.not();
        }

        String comparator = condition.comparator();
        if (Comparators.NEQ.equals(comparator)) {
            return positive(property, Comparators.EQ, condition.value()).not();
        }
        return positive(property, comparator, condition.value());
    }

    private FilterCondition presence(ResolvedProperty property) {
        PropertyKind kind = property.kind();
        if (kind.isUrn()) {
            return context.urnSet(property.scheme());
        }
        if (kind.isField()) {
            return context.fieldSet(property.field());
        }
        return switch (kind) {
            case CREATED_ON -> context.createdOn(null, null);
            // contact ids always exist
            case ID -> context.none().not();
            default -> context.attributeSet(kind);
        };
    }

    private FilterCondition positive(ResolvedProperty property, String comparator, String value) {
        return switch (property.kind()) {
            case NAME, UUID, LANGUAGE -> context.attribute(property.kind(), lookup(comparator), value);
            case ID -> parseId(value).map(context::idEquals).orElseGet(context::none);
            case CREATED_ON -> datetime(null, comparator, value);
            case URN, SCHEME -> context.urn(property.scheme(), lookup(comparator), value);
            case TEXT_FIELD -> context.textFieldIn(property.field(), List.of(ValueUtils.textKey(value)));
            case DECIMAL_FIELD -> context.decimalField(property.field(), comparator, ValueUtils.parseDecimal(value));
            case DATETIME_FIELD -> datetime(property, comparator, value);
            case LOCATION_FIELD -> context.locationField(property.field(), lookup(comparator), List.of(value));
        };
    }

    /**
     * @param field the datetime field, or {@code null} for the creation date
     */
    private FilterCondition datetime(ResolvedProperty field, String comparator, String value) {
        Optional<LocalDate> date = DateUtils.parseDate(value, org.timezone(), org.dayFirst());
        if (date.isEmpty()) {
            if (Comparators.EQ.equals(comparator)) {
                log.fine(() -> String.format("Unparseable date '%s' compared with =, matching nothing", value));
                return context.none();
            }
            throw new SearchException("Unable to parse the date " + value);
        }

        DateUtils.UtcRange range = DateUtils.utcRange(date.get(), org.timezone());
        DateUtils.UtcRange bounds = DatetimeBounds.forComparator(comparator, range);
        return field == null
                ? context.createdOn(bounds.start(), bounds.end())
                : context.datetimeField(field.field(), bounds.start(), bounds.end());
    }

    private static TextLookup lookup(String comparator) {
        return Comparators.CONTAINS.equals(comparator) ? TextLookup.ICONTAINS : TextLookup.IEXACT;
    }

    /**
     * @return the id, or empty for an integer too large to be one
     */
    private static Optional<Long> parseId(String value) {
        try {
            return Optional.of(Long.parseLong(value));
        } catch (NumberFormatException e) {
            if (INTEGER.matcher(value).matches()) {
                log.fine(() -> String.format("Id %s out of range, matching nothing", value));
                return Optional.empty();
            }
            throw new SearchException(value + " isn't a valid contact id", e);
        }
    }

    private static FilterCondition fold(BoolOp op, List<FilterCondition> conditions) {
        FilterCondition result = conditions.get(0);
        for (int i = 1; i < conditions.size(); i++) {
            result = op == BoolOp.AND ? result.and(conditions.get(i)) : result.or(conditions.get(i));
        }
        return result;
    }
}
