package io.github.cyfko.contactql.core.parsing;

import io.github.cyfko.contactql.core.exception.SearchException;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Splits a contact query into tokens.
 * <p>
 * Rules are applied left to right, the longest match winning:
 * </p>
 * <ul>
 *   <li>spaces and tabs are skipped</li>
 *   <li>{@code (} and {@code )} are single-character tokens</li>
 *   <li>comparators: {@code != <= >= ~~ = ~ < >}</li>
 *   <li>strings: {@code "..."}, with {@code ""} inside standing for one quote character</li>
 *   <li>words: runs of letters, digits, {@code _ . + - /}; the words {@code and}, {@code or},
 *       {@code is} and {@code has} (any case) become operator or comparator tokens</li>
 * </ul>
 * Anything else fails with {@link SearchException}.
 *
 * @since 1.0.0
 */
public final class QueryLexer {

    private static final Map<String, TokenKind> RESERVED = Map.of(
            "and", TokenKind.AND,
            "or", TokenKind.OR,
            "is", TokenKind.COMPARATOR,
            "has", TokenKind.COMPARATOR
    );

    private static final String[] COMPARATORS = {"!=", "<=", ">=", "~~", "=", "~", "<", ">"};

    private QueryLexer() {}

    /**
     * Tokenizes the given query. The returned list always ends with an {@link TokenKind#EOF} token.
     *
     * @param query the raw query text
     * @return the tokens
     * @throws SearchException on a character that can't start a token, including an unterminated string
     */
    public static List<Token> tokenize(String query) {
        List<Token> tokens = new ArrayList<>();
        int index = 0;

        while (index < query.length()) {
            char c = query.charAt(index);

            if (c == ' ' || c == '\t') {
                index++;
                continue;
            }
            if (c == '(') {
                tokens.add(new Token(TokenKind.LPAREN, "(", index++));
                continue;
            }
            if (c == ')') {
                tokens.add(new Token(TokenKind.RPAREN, ")", index++));
                continue;
            }

            String comparator = matchComparator(query, index);
            if (comparator != null) {
                tokens.add(new Token(TokenKind.COMPARATOR, comparator, index));
                index += comparator.length();
                continue;
            }

            if (c == '"') {
                index = readString(query, index, tokens);
                continue;
            }

            if (isWordChar(c)) {
                int start = index;
                while (index < query.length() && isWordChar(query.charAt(index))) {
                    index++;
                }
                String word = query.substring(start, index);
                String lowered = word.toLowerCase(Locale.ROOT);
                TokenKind kind = RESERVED.get(lowered);
                tokens.add(kind == null ? new Token(TokenKind.TEXT, word, start) : new Token(kind, lowered, start));
                continue;
            }

            throw invalidCharacter(c);
        }

        tokens.add(new Token(TokenKind.EOF, "", query.length()));
        return tokens;
    }

    private static String matchComparator(String query, int index) {
        for (String comparator : COMPARATORS) {
            if (query.startsWith(comparator, index)) {
                return comparator;
            }
        }
        return null;
    }

    private static int readString(String query, int quoteIndex, List<Token> tokens) {
        StringBuilder value = new StringBuilder();
        int index = quoteIndex + 1;

        while (index < query.length()) {
            char c = query.charAt(index);
            if (c == '"') {
                if (index + 1 < query.length() && query.charAt(index + 1) == '"') {
                    value.append('"');
                    index += 2;
                    continue;
                }
                tokens.add(new Token(TokenKind.STRING, value.toString(), quoteIndex));
                return index + 1;
            }
            value.append(c);
            index++;
        }

        throw invalidCharacter('"');
    }

    static boolean isWordChar(char c) {
        if (Character.isLetterOrDigit(c)) {
            return true;
        }
        int type = Character.getType(c);
        if (type == Character.NON_SPACING_MARK || type == Character.COMBINING_SPACING_MARK
                || type == Character.CONNECTOR_PUNCTUATION) {
            return true;
        }
        return c == '.' || c == '+' || c == '-' || c == '/';
    }

    private static SearchException invalidCharacter(char c) {
        return new SearchException("Invalid character " + c);
    }
}
