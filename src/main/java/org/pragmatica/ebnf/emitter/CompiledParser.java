package org.pragmatica.ebnf.emitter;

import io.vavr.control.Either;
import io.vavr.control.Option;
import org.pragmatica.ebnf.error.ParseError;
import org.pragmatica.ebnf.lexer.CharacterLexer;
import org.pragmatica.ebnf.lexer.TokenStream;
import org.pragmatica.ebnf.parser.ParseEngine;
import org.pragmatica.ebnf.parser.Parser;
import org.pragmatica.ebnf.parser.ParserConfig;
import org.pragmatica.ebnf.parser.RuleProcedure;
import org.pragmatica.ebnf.parser.RuleTable;
import org.pragmatica.ebnf.tree.SyntaxNode;

import java.util.List;

/**
 * Parser produced by {@link ParserEmitter}. Holds only immutable state.
 */
public final class CompiledParser implements Parser {

    private final String entryRule;
    private final RuleTable rules;
    private final ParserConfig config;
    private final CharacterLexer lexer;

    CompiledParser(String entryRule, RuleTable rules, ParserConfig config, CharacterLexer lexer) {
        this.entryRule = entryRule;
        this.rules = rules;
        this.config = config;
        this.lexer = lexer;
    }

    @Override
    public String entryRule() {
        return entryRule;
    }

    @Override
    public List<String> ruleNames() {
        return rules.names();
    }

    @Override
    public Option<RuleProcedure> procedure(String ruleName) {
        return rules.indexOf(ruleName)
                    .map(index -> new RuleProcedure(ruleName, index, rules, config));
    }

    @Override
    public RuleProcedure entry() {
        return procedure(entryRule).get();
    }

    @Override
    public Either<ParseError, SyntaxNode> parse(TokenStream tokens) {
        return parse(tokens, entryRule);
    }

    @Override
    public Either<ParseError, SyntaxNode> parse(TokenStream tokens, String startRule) {
        return ParseEngine.parse(rules, config, tokens, startRule);
    }

    @Override
    public Either<ParseError, SyntaxNode> parse(String input) {
        return parse(tokenize(input), entryRule);
    }

    @Override
    public Either<ParseError, SyntaxNode> parse(String input, String startRule) {
        return parse(tokenize(input), startRule);
    }

    @Override
    public TokenStream tokenize(String input) {
        return lexer.tokenize(input);
    }

    public ParserConfig config() {
        return config;
    }

    @Override
    public String toString() {
        return "CompiledParser[entry=" + entryRule + ", rules=" + rules.names() + "]";
    }
}
