package io.github.cyfko.contactql.core.api;

import io.github.cyfko.contactql.core.exception.SearchException;
import io.github.cyfko.contactql.core.tree.ContactQuery;

/**
 * Parses contact query text into a {@link ContactQuery}.
 * <p>
 * Parsing does not depend on any organization: identifiers are kept as written (lower-cased)
 * and only resolved when the query is compiled or evaluated. The one organization trait that
 * affects parsing is anonymity, which changes how bare terms are interpreted.
 * </p>
 *
 * <p><strong>Valid Query Examples:</strong></p>
 * <pre>{@code
 * parser.parse("will felix");                        // name ~ will AND name ~ felix
 * parser.parse("(will or felix) and matt");          // grouping
 * parser.parse("age > 18 and gender = \"male\"");    // field comparisons
 * parser.parse("twitter != \"\"");                   // presence check
 * parser.parse("1234", true);                        // id = 1234 in an anonymous organization
 * }</pre>
 *
 * <p><strong>Invalid Query Examples:</strong></p>
 * <pre>{@code
 * parser.parse("((");                  // Invalid query syntax
 * parser.parse("name = \"trey");       // Invalid character "
 * parser.parse("data=not empty,");     // Invalid character ,
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public interface QueryParser {

    /**
     * Parses and optimizes a query for a non-anonymous organization.
     *
     * @param text the query text
     * @return the optimized query
     * @throws SearchException if the text is not a valid query
     */
    default ContactQuery parse(String text) throws SearchException {
        return parse(text, false);
    }

    /**
     * Parses and optimizes a query.
     *
     * @param text   the query text
     * @param asAnon whether the query runs in an anonymous organization
     * @return the optimized query
     * @throws SearchException if the text is not a valid query
     */
    default ContactQuery parse(String text, boolean asAnon) throws SearchException {
        return parse(text, asAnon, true);
    }

    /**
     * Parses a query.
     *
     * @param text     the query text
     * @param asAnon   whether the query runs in an anonymous organization
     * @param optimize whether same-property conditions are folded together
     * @return the query
     * @throws SearchException if the text is not a valid query
     * @throws NullPointerException if text is null
     */
    ContactQuery parse(String text, boolean asAnon, boolean optimize) throws SearchException;
}
