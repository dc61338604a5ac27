package io.github.cyfko.contactql.core.exception;

/**
 * Exception thrown for any contact query that cannot be parsed, resolved, compiled or evaluated.
 * <p>
 * A single exception kind covers every failure category of the query language:
 * </p>
 * <ul>
 *   <li><strong>Lexical:</strong> a character that cannot start any token ({@code Invalid character ,})</li>
 *   <li><strong>Syntactic:</strong> unexpected or missing tokens ({@code Invalid query syntax at 'and'})</li>
 *   <li><strong>Semantic:</strong> unknown identifiers, comparators not allowed for a property,
 *       literals that cannot be parsed for the comparison, URN comparisons in anonymous organizations</li>
 * </ul>
 * <p>
 * Messages are meant to be shown to end users as-is. Callers decide whether to present them or to
 * fall back to a simpler search mode.
 * </p>
 *
 * <p><strong>Handling example:</strong></p>
 * <pre>{@code
 * try {
 *     ContactQuery query = parser.parse(text, org.anon());
 *     boolean member = QueryEvaluator.evaluate(query, org, snapshot);
 * } catch (SearchException e) {
 *     return ResponseEntity.badRequest().body("Invalid query: " + e.getMessage());
 * }
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class SearchException extends RuntimeException {

    /**
     * Creates an exception with a user-facing message.
     *
     * @param message the description of the problem, including the offending token or value
     */
    public SearchException(String message) {
        super(message);
    }

    /**
     * Creates an exception with a user-facing message and an underlying cause.
     *
     * @param message the description of the problem
     * @param cause   the original failure (e.g. a {@link NumberFormatException})
     */
    public SearchException(String message, Throwable cause) {
        super(message, cause);
    }
}
