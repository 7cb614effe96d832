package org.pragmatica.ebnf.lexer;

import org.pragmatica.ebnf.tree.SourceLocation;
import org.pragmatica.ebnf.tree.SourceSpan;

import java.util.Objects;

/**
 * Immutable token produced by a lexer: kind, text and start position.
 */
public record Token(TokenKind kind, String text, SourceLocation location) {

    public Token {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(text, "text");
        Objects.requireNonNull(location, "location");
    }

    public static Token of(String text, SourceLocation location) {
        return new Token(TokenKind.classify(text), text, location);
    }

    public SourceSpan span() {
        return SourceSpan.of(location, location.after(text));
    }

    @Override
    public String toString() {
        return "'" + text + "'@" + location;
    }
}
