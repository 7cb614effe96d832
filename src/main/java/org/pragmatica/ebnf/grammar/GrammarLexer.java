package org.pragmatica.ebnf.grammar;

import org.pragmatica.ebnf.tree.SourceLocation;
import org.pragmatica.ebnf.tree.SourceSpan;

import java.util.ArrayList;
import java.util.List;

/**
 * Lexer for EBNF grammar syntax.
 *
 * <p>Comments are {@code (* ... *)} and nest. Literals are quoted with {@code "} or {@code '},
 * stay on one line and have no escapes. Lexing stops at the first {@link GrammarToken.Error}.
 */
public final class GrammarLexer {
    private static final int MAX_INPUT_SIZE = 1_000_000;
    private static final int DEFAULT_TOKEN_CAPACITY = 32;

    private final String input;
    private int pos;
    private int line;
    private int column;

    private GrammarLexer(String input) {
        this.input = input;
        this.pos = 0;
        this.line = 1;
        this.column = 1;
    }

    public static List<GrammarToken> tokenize(String input) {
        if (input.length() > MAX_INPUT_SIZE) {
            throw new IllegalArgumentException(
            "Grammar input exceeds maximum size of " + MAX_INPUT_SIZE + " characters");
        }
        return new GrammarLexer(input).tokenizeAll();
    }

    private List<GrammarToken> tokenizeAll() {
        var tokens = new ArrayList<GrammarToken>();
        while (true) {
            var skipped = skipWhitespaceAndComments();
            if (skipped != null) {
                tokens.add(skipped);
                break;
            }
            if (isAtEnd()) {
                break;
            }
            var token = nextToken();
            tokens.add(token);
            if (token instanceof GrammarToken.Error) {
                break;
            }
        }
        tokens.add(new GrammarToken.Eof(currentSpan()));
        return tokens;
    }

    private GrammarToken nextToken() {
        var start = currentLocation();
        char c = peek();
        if (isIdentifierStart(c)) {
            return scanIdentifier(start);
        }
        if (c == '"' || c == '\'') {
            return scanLiteral(start);
        }
        return scanOperator(start);
    }

    private GrammarToken scanIdentifier(SourceLocation start) {
        var sb = new StringBuilder(DEFAULT_TOKEN_CAPACITY);
        while (!isAtEnd() && isIdentifierPart(peek())) {
            sb.append(advance());
        }
        return new GrammarToken.Identifier(span(start), sb.toString());
    }

    private GrammarToken scanLiteral(SourceLocation start) {
        char quote = advance();
        var sb = new StringBuilder(DEFAULT_TOKEN_CAPACITY);
        while (!isAtEnd() && peek() != quote && peek() != '\n') {
            sb.append(advance());
        }
        if (isAtEnd() || peek() == '\n') {
            return new GrammarToken.Error(span(start), "closing " + quote, isAtEnd()
                                                                          ? "end of input"
                                                                          : "end of line");
        }
        advance();
        // closing quote
        if (sb.isEmpty()) {
            return new GrammarToken.Error(span(start), "non-empty literal", "empty literal");
        }
        return new GrammarToken.Literal(span(start), sb.toString());
    }

    private GrammarToken scanOperator(SourceLocation start) {
        char c = advance();
        return switch (c) {
            case '=' -> new GrammarToken.Equals(span(start));
            case ',' -> new GrammarToken.Comma(span(start));
            case '|' -> new GrammarToken.Pipe(span(start));
            case ';' -> new GrammarToken.Semicolon(span(start));
            case '-' -> new GrammarToken.Minus(span(start));
            case '(' -> new GrammarToken.LParen(span(start));
            case ')' -> new GrammarToken.RParen(span(start));
            case '[' -> new GrammarToken.LBracket(span(start));
            case ']' -> new GrammarToken.RBracket(span(start));
            case '{' -> new GrammarToken.LBrace(span(start));
            case '}' -> new GrammarToken.RBrace(span(start));
            default -> new GrammarToken.Error(span(start), "grammar symbol", "'" + c + "'");
        };
    }

    /**
     * Skip whitespace and comments. Returns an error token for an unterminated comment, otherwise null.
     */
    private GrammarToken skipWhitespaceAndComments() {
        while (!isAtEnd()) {
            char c = peek();
            if (Character.isWhitespace(c)) {
                advance();
            } else if (c == '(' && peekAhead(1) == '*') {
                var start = currentLocation();
                if (!skipComment()) {
                    return new GrammarToken.Error(span(start), "'*)'", "end of input");
                }
            } else {
                break;
            }
        }
        return null;
    }

    private boolean skipComment() {
        int depth = 0;
        while (!isAtEnd()) {
            if (peek() == '(' && peekAhead(1) == '*') {
                advance();
                advance();
                depth++;
            } else if (peek() == '*' && peekAhead(1) == ')') {
                advance();
                advance();
                depth--;
                if (depth == 0) {
                    return true;
                }
            } else {
                advance();
            }
        }
        return false;
    }

    private boolean isAtEnd() {
        return pos >= input.length();
    }

    private char peek() {
        return input.charAt(pos);
    }

    private char peekAhead(int offset) {
        return pos + offset < input.length()
               ? input.charAt(pos + offset)
               : '\0';
    }

    private char advance() {
        char c = input.charAt(pos++);
        if (c == '\n') {
            line++;
            column = 1;
        } else {
            column++;
        }
        return c;
    }

    private SourceLocation currentLocation() {
        return SourceLocation.at(line, column, pos);
    }

    private SourceSpan currentSpan() {
        return SourceSpan.at(currentLocation());
    }

    private SourceSpan span(SourceLocation start) {
        return SourceSpan.of(start, currentLocation());
    }

    private boolean isIdentifierStart(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
    }

    private boolean isIdentifierPart(char c) {
        return isIdentifierStart(c) || (c >= '0' && c <= '9');
    }
}
