package io.github.cyfko.contactql.core.parsing;

/**
 * Kinds of lexical tokens of the query language.
 *
 * @since 1.0.0
 */
public enum TokenKind {
    TEXT,
    STRING,
    COMPARATOR,
    AND,
    OR,
    LPAREN,
    RPAREN,
    EOF
}
