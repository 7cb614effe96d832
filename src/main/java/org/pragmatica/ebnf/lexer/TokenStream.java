package org.pragmatica.ebnf.lexer;

import io.vavr.control.Option;
import org.pragmatica.ebnf.tree.SourceLocation;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;

/**
 * Immutable, finite sequence of tokens plus the location just past the last one.
 * Parsers address it by index; it is never consumed, so one stream can be parsed many times.
 */
public record TokenStream(List<Token> tokens, SourceLocation end) {

    public TokenStream {
        tokens = List.copyOf(tokens);
        Objects.requireNonNull(end, "end");
    }

    public static TokenStream of(List<Token> tokens) {
        var end = tokens.isEmpty()
                  ? SourceLocation.START
                  : tokens.get(tokens.size() - 1).span().end();
        return new TokenStream(tokens, end);
    }

    /**
     * Drain a forward-only token source.
     */
    public static TokenStream from(Iterator<Token> source) {
        var tokens = new ArrayList<Token>();
        source.forEachRemaining(tokens::add);
        return of(tokens);
    }

    /**
     * Build a stream from bare token texts, laid out on one line separated by single spaces.
     */
    public static TokenStream ofTexts(List<String> texts) {
        var tokens = new ArrayList<Token>(texts.size());
        var location = SourceLocation.START;
        for (var text : texts) {
            if (!tokens.isEmpty()) {
                location = location.next(' ');
            }
            tokens.add(Token.of(text, location));
            location = location.after(text);
        }
        return new TokenStream(tokens, location);
    }

    public static TokenStream ofTexts(String... texts) {
        return ofTexts(List.of(texts));
    }

    public int size() {
        return tokens.size();
    }

    public boolean isEmpty() {
        return tokens.isEmpty();
    }

    public Token get(int index) {
        return tokens.get(index);
    }

    public Option<Token> at(int index) {
        return index >= 0 && index < tokens.size()
               ? Option.some(tokens.get(index))
               : Option.none();
    }

    /**
     * Location of the token at the index, or the end location past the last token.
     */
    public SourceLocation locationAt(int index) {
        return index < tokens.size()
               ? tokens.get(index).location()
               : end;
    }

    public List<String> texts() {
        return tokens.stream()
                     .map(Token::text)
                     .toList();
    }
}
