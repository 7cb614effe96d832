package org.pragmatica.ebnf.parser;

import io.vavr.control.Either;
import org.pragmatica.ebnf.error.ParseError;
import org.pragmatica.ebnf.lexer.TokenStream;
import org.pragmatica.ebnf.tree.SyntaxNode;

/**
 * Callable parsing procedure of one rule. Parses a whole token stream starting from that rule.
 */
public record RuleProcedure(String ruleName, int index, RuleTable rules, ParserConfig config) {

    public Either<ParseError, SyntaxNode> parse(TokenStream tokens) {
        return ParseEngine.parse(rules, config, tokens, index);
    }

    @Override
    public String toString() {
        return "RuleProcedure[" + ruleName + "]";
    }
}
