package io.github.cyfko.contactql.core;

import io.github.cyfko.contactql.core.api.FilterCondition;
import io.github.cyfko.contactql.core.api.FilterContext;
import io.github.cyfko.contactql.core.api.QueryParser;
import io.github.cyfko.contactql.core.compile.QueryCompiler;
import io.github.cyfko.contactql.core.eval.ContactSnapshot;
import io.github.cyfko.contactql.core.eval.QueryEvaluator;
import io.github.cyfko.contactql.core.eval.SnapshotFilterContext;
import io.github.cyfko.contactql.core.exception.SearchException;
import io.github.cyfko.contactql.core.group.DynamicGroup;
import io.github.cyfko.contactql.core.impl.BasicQueryParser;
import io.github.cyfko.contactql.core.model.ContactField;
import io.github.cyfko.contactql.core.model.Org;
import io.github.cyfko.contactql.core.resolve.PropertyResolver;
import io.github.cyfko.contactql.core.resolve.ResolvedProperty;
import io.github.cyfko.contactql.core.tree.ContactQuery;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Entry point tying the parser, compiler and evaluator to an organization.
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * ContactQL contactQL = ContactQL.create();
 *
 * ContactQuery query = contactQL.parse(org, "age > 18 and gender = male");
 * boolean matches = contactQL.evaluate(org, "age > 18", contactJson);
 * FilterCondition condition = contactQL.compile(org, "age > 18", new JpaFilterContext(...));
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class ContactQL {

    private final QueryParser parser;

    public ContactQL(QueryParser parser) {
        this.parser = Objects.requireNonNull(parser, "parser cannot be null");
    }

    public static ContactQL create() {
        return new ContactQL(new BasicQueryParser());
    }

    /**
     * Parses and optimizes a query, interpreting bare terms as the organization requires.
     *
     * @param org  the organization
     * @param text the query text
     * @return the query
     * @throws SearchException if the text is not a valid query
     */
    public ContactQuery parse(Org org, String text) {
        return parser.parse(text, org.anon());
    }

    /**
     * Parses a query and compiles it to a backend predicate.
     *
     * @param org     the organization
     * @param text    the query text
     * @param context the backend
     * @return the predicate
     * @throws SearchException if the query is invalid or cannot be applied in the organization
     */
    public FilterCondition compile(Org org, String text, FilterContext context) {
        return QueryCompiler.compile(parse(org, text), org, context);
    }

    public boolean evaluate(Org org, String text, ContactSnapshot contact) {
        return QueryEvaluator.evaluate(parse(org, text), org, contact);
    }

    /**
     * Evaluates a query against a contact given in the contact JSON format.
     *
     * @param org         the organization
     * @param text        the query text
     * @param contactJson the contact
     * @return whether the contact matches
     * @throws SearchException          if the query is invalid or cannot be applied
     * @throws IllegalArgumentException if the JSON is not a valid contact
     */
    public boolean evaluate(Org org, String text, String contactJson) {
        return evaluate(org, text, ContactSnapshot.fromJson(contactJson));
    }

    /**
     * Returns the custom fields a query references, each once, in order of first appearance.
     *
     * @param org  the organization
     * @param text the query text
     * @return the referenced fields
     * @throws SearchException if the query is invalid or references an unknown identifier
     */
    public List<ContactField> extractFields(Org org, String text) {
        return extractFields(org, parse(org, text));
    }

    /**
     * Creates a dynamic group, checking its query applies to the organization.
     *
     * @param org  the organization
     * @param name the group name
     * @param text the query text
     * @return the group
     * @throws SearchException if the query is invalid, cannot be applied in the organization or
     *                         references {@code name} or {@code id}
     */
    public DynamicGroup createDynamicGroup(Org org, String name, String text) {
        ContactQuery query = parse(org, text);
        QueryCompiler.compile(query, org, new SnapshotFilterContext(org));
        return new DynamicGroup(name, query, extractFields(org, query));
    }

    public QueryParser getParser() {
        return parser;
    }

    private static List<ContactField> extractFields(Org org, ContactQuery query) {
        List<ContactField> fields = new ArrayList<>();
        for (String prop : query.propNames()) {
            ResolvedProperty property = PropertyResolver.resolve(org, prop);
            if (property.kind().isField()) {
                fields.add(property.field());
            }
        }
        return fields;
    }
}
