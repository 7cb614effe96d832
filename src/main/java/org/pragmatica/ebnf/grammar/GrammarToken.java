package org.pragmatica.ebnf.grammar;

import org.pragmatica.ebnf.tree.SourceSpan;

/**
 * Token types for the EBNF grammar lexer.
 */
public sealed interface GrammarToken {
    SourceSpan span();

    record Identifier(SourceSpan span, String name) implements GrammarToken {}

    record Literal(SourceSpan span, String text) implements GrammarToken {}

    // =
    record Equals(SourceSpan span) implements GrammarToken {}

    // ,
    record Comma(SourceSpan span) implements GrammarToken {}

    // |
    record Pipe(SourceSpan span) implements GrammarToken {}

    // ;
    record Semicolon(SourceSpan span) implements GrammarToken {}

    // -
    record Minus(SourceSpan span) implements GrammarToken {}

    record LParen(SourceSpan span) implements GrammarToken {}

    record RParen(SourceSpan span) implements GrammarToken {}

    record LBracket(SourceSpan span) implements GrammarToken {}

    record RBracket(SourceSpan span) implements GrammarToken {}

    record LBrace(SourceSpan span) implements GrammarToken {}

    record RBrace(SourceSpan span) implements GrammarToken {}

    record Eof(SourceSpan span) implements GrammarToken {}

    record Error(SourceSpan span, String expected, String found) implements GrammarToken {}
}
