package io.github.cyfko.contactql.core.parsing;

/**
 * A lexical token.
 *
 * @param kind     the token kind
 * @param value    the token text; string literals are unquoted, reserved words lower-cased
 * @param position offset of the token's first character in the query
 * @since 1.0.0
 */
public record Token(TokenKind kind, String value, int position) {
}
