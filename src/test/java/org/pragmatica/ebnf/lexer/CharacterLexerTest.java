package org.pragmatica.ebnf.lexer;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class CharacterLexerTest {

    private static final CharacterLexer LEXER = CharacterLexer.forLiterals(List.of("val", "value", "->", "-", "x", "=", "=="));

    @Test
    void forLiterals_keepsOnlyMultiCharacterLiterals_longestFirst() {
        assertEquals(List.of("value", "val", "->", "=="), LEXER.words());
    }

    @Test
    void tokenize_splitsUnknownTextIntoCharacters() {
        assertEquals(List.of("a", "b", "1"), LEXER.tokenize("ab1").texts());
    }

    @Test
    void tokenize_prefersLongestLiteral() {
        assertEquals(List.of("value", "==", "-", "4"), LEXER.tokenize("value == -4").texts());
        assertEquals(List.of("->", "x"), LEXER.tokenize("->x").texts());
    }

    @Test
    void tokenize_wordLiteral_requiresWordBoundary() {
        assertEquals(List.of("v", "a", "l", "u", "e", "s"), LEXER.tokenize("values").texts());
        assertEquals(List.of("val", "x"), LEXER.tokenize("val x").texts());
        assertEquals(List.of("a", "v", "a", "l"), LEXER.tokenize("aval").texts());
    }

    @Test
    void tokenize_tracksLocationsAcrossLines() {
        var tokens = LEXER.tokenize("val\n  x");

        assertEquals(2, tokens.size());
        assertEquals(2, tokens.get(1).location().line());
        assertEquals(3, tokens.get(1).location().column());
        assertEquals(6, tokens.get(1).location().offset());
        assertEquals(4, tokens.end().column());
    }

    @Test
    void tokenize_classifiesTokens() {
        var tokens = LEXER.tokenize("val -> x").tokens();

        assertThat(tokens).extracting(Token::kind)
                          .containsExactly(TokenKind.KEYWORD, TokenKind.SYMBOL, TokenKind.CHARACTER);
    }

    @Test
    void tokenize_blankInput_isEmpty() {
        var tokens = LEXER.tokenize(" \t\n ");

        assertTrue(tokens.isEmpty());
        assertTrue(tokens.at(0).isEmpty());
        assertEquals(tokens.end(), tokens.locationAt(0));
    }
}
