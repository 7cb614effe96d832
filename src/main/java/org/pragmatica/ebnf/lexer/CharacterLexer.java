package org.pragmatica.ebnf.lexer;

import org.pragmatica.ebnf.tree.SourceLocation;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;

/**
 * Minimal grammar-driven lexer for character-level grammars.
 *
 * <p>Whitespace separates tokens and is dropped. At each position the longest multi-character
 * grammar literal wins; literals that begin or end with a word character only match on a word
 * boundary, so {@code val} is a keyword in {@code val x} but not in {@code value}. Anything else
 * becomes a single-character token.
 */
public final class CharacterLexer {

    private final List<String> words;

    private CharacterLexer(List<String> words) {
        this.words = words;
    }

    public static CharacterLexer forLiterals(Collection<String> literals) {
        var words = literals.stream()
                            .filter(literal -> literal.length() > 1)
                            .distinct()
                            .sorted(Comparator.comparingInt(String::length)
                                              .reversed()
                                              .thenComparing(Comparator.naturalOrder()))
                            .toList();
        return new CharacterLexer(words);
    }

    public List<String> words() {
        return words;
    }

    public TokenStream tokenize(String input) {
        var tokens = new ArrayList<Token>();
        var location = SourceLocation.START;
        int pos = 0;

        while (pos < input.length()) {
            char c = input.charAt(pos);
            if (Character.isWhitespace(c)) {
                location = location.next(c);
                pos++;
                continue;
            }
            var text = matchWord(input, pos);
            tokens.add(Token.of(text, location));
            location = location.after(text);
            pos += text.length();
        }
        return new TokenStream(tokens, location);
    }

    private String matchWord(String input, int pos) {
        for (var word : words) {
            if (input.startsWith(word, pos) && onBoundary(input, pos, word)) {
                return word;
            }
        }
        return String.valueOf(input.charAt(pos));
    }

    private static boolean onBoundary(String input, int pos, String word) {
        int end = pos + word.length();
        if (TokenKind.isWordChar(word.charAt(0)) && pos > 0 && TokenKind.isWordChar(input.charAt(pos - 1))) {
            return false;
        }
        return !(TokenKind.isWordChar(word.charAt(word.length() - 1))
                 && end < input.length()
                 && TokenKind.isWordChar(input.charAt(end)));
    }
}
