package io.github.cyfko.contactql.core.parsing;

import io.github.cyfko.contactql.core.exception.SearchException;
import io.github.cyfko.contactql.core.model.UrnScheme;
import io.github.cyfko.contactql.core.tree.BoolCombination;
import io.github.cyfko.contactql.core.tree.Comparators;
import io.github.cyfko.contactql.core.tree.Condition;
import io.github.cyfko.contactql.core.tree.IsSetCondition;
import io.github.cyfko.contactql.core.tree.QueryNode;

import java.math.BigInteger;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Recursive descent parser building the raw (unoptimized) tree of a contact query.
 * <pre>
 * query      := expression EOF
 * expression := andExpr (OR andExpr)*
 * andExpr    := term ((AND)? term)*
 * term       := '(' expression ')' | TEXT COMPARATOR literal | TEXT
 * literal    := TEXT | STRING
 * </pre>
 * AND binds tighter than OR and both associate to the left. Two adjacent terms with no operator
 * between them are ANDed. A bare {@code TEXT} term is an implicit condition on the contact's
 * name, phone number or (in anonymous organizations) id.
 * <p>
 * Each call to {@link #parse(String, boolean)} works on its own instance, so parsing is re-entrant.
 * </p>
 *
 * @since 1.0.0
 */
public final class QueryGrammar {

    static final Pattern TEL_VALUE = Pattern.compile("^[+ \\d\\-()]+$");
    private static final Pattern CONTACT_ID = Pattern.compile("^[+-]?\\d+$");

    private final List<Token> tokens;
    private final boolean asAnon;
    private int pos;

    private QueryGrammar(List<Token> tokens, boolean asAnon) {
        this.tokens = tokens;
        this.asAnon = asAnon;
    }

    /**
     * Parses query text into a raw tree of binary combinations.
     *
     * @param text   the query text
     * @param asAnon whether implicit integer terms should match contact ids
     * @return the root node
     * @throws SearchException on lexical or syntax errors
     */
    public static QueryNode parse(String text, boolean asAnon) {
        return new QueryGrammar(QueryLexer.tokenize(text), asAnon).parseQuery();
    }

    private QueryNode parseQuery() {
        QueryNode root = parseExpression();
        if (current().kind() != TokenKind.EOF) {
            throw syntaxError(current());
        }
        return root;
    }

    private QueryNode parseExpression() {
        QueryNode left = parseAnd();
        while (match(TokenKind.OR)) {
            left = BoolCombination.or(left, parseAnd());
        }
        return left;
    }

    private QueryNode parseAnd() {
        QueryNode left = parseTerm();
        while (true) {
            if (match(TokenKind.AND)) {
                left = BoolCombination.and(left, parseTerm());
            } else if (startsTerm(current())) {
                left = BoolCombination.and(left, parseTerm());
            } else {
                return left;
            }
        }
    }

    private QueryNode parseTerm() {
        Token token = current();

        if (token.kind() == TokenKind.LPAREN) {
            advance();
            QueryNode grouped = parseExpression();
            if (current().kind() != TokenKind.RPAREN) {
                throw syntaxError(current());
            }
            advance();
            return grouped;
        }

        if (token.kind() == TokenKind.TEXT) {
            advance();
            if (current().kind() != TokenKind.COMPARATOR) {
                return implicitCondition(token.value());
            }
            Token comparator = advance();
            Token literal = current();
            if (literal.kind() != TokenKind.TEXT && literal.kind() != TokenKind.STRING) {
                throw syntaxError(literal);
            }
            advance();
            return condition(token.value(), comparator.value(), literal.value());
        }

        throw syntaxError(token);
    }

    private static QueryNode condition(String prop, String comparator, String value) {
        String key = prop.toLowerCase(Locale.ROOT);
        if (value.isEmpty()) {
            return new IsSetCondition(key, comparator);
        }
        return new Condition(key, comparator, value);
    }

    private QueryNode implicitCondition(String value) {
        if (asAnon) {
            if (CONTACT_ID.matcher(value).matches()) {
                return new Condition("id", Comparators.EQ, new BigInteger(value).toString());
            }
        } else if (TEL_VALUE.matcher(value).matches()) {
            return new Condition(UrnScheme.TEL, Comparators.CONTAINS, value);
        }
        return new Condition("name", Comparators.CONTAINS, value);
    }

    private static boolean startsTerm(Token token) {
        return token.kind() == TokenKind.TEXT || token.kind() == TokenKind.LPAREN;
    }

    private Token current() {
        return tokens.get(pos);
    }

    private Token advance() {
        Token token = tokens.get(pos);
        if (token.kind() != TokenKind.EOF) {
            pos++;
        }
        return token;
    }

    private boolean match(TokenKind kind) {
        if (current().kind() == kind) {
            advance();
            return true;
        }
        return false;
    }

    private static SearchException syntaxError(Token token) {
        if (token.kind() == TokenKind.EOF) {
            return new SearchException("Invalid query syntax");
        }
        return new SearchException("Invalid query syntax at '" + token.value() + "'");
    }
}
