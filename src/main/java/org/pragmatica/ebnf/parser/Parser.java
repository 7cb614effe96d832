package org.pragmatica.ebnf.parser;

import io.vavr.control.Either;
import io.vavr.control.Option;
import org.pragmatica.ebnf.error.ParseError;
import org.pragmatica.ebnf.lexer.TokenStream;
import org.pragmatica.ebnf.tree.SyntaxNode;

import java.util.List;

/**
 * Compiled parser - immutable and safe to share between threads. Each call owns its cursor and its tree.
 */
public interface Parser {

    String entryRule();

    /**
     * Rule names in declaration order.
     */
    List<String> ruleNames();

    /**
     * The parsing procedure of the named rule.
     */
    Option<RuleProcedure> procedure(String ruleName);

    RuleProcedure entry();

    /**
     * Parse a token stream with the entry rule.
     */
    Either<ParseError, SyntaxNode> parse(TokenStream tokens);

    /**
     * Parse a token stream starting from a specific rule.
     */
    Either<ParseError, SyntaxNode> parse(TokenStream tokens, String startRule);

    /**
     * Tokenize text with the grammar's character lexer and parse it with the entry rule.
     */
    Either<ParseError, SyntaxNode> parse(String input);

    /**
     * Tokenize text with the grammar's character lexer and parse it starting from a specific rule.
     */
    Either<ParseError, SyntaxNode> parse(String input, String startRule);

    TokenStream tokenize(String input);
}
