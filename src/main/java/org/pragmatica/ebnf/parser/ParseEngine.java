package org.pragmatica.ebnf.parser;

import io.vavr.control.Either;
import org.pragmatica.ebnf.analysis.GrammarAnalysis;
import org.pragmatica.ebnf.error.ParseError;
import org.pragmatica.ebnf.lexer.TokenStream;
import org.pragmatica.ebnf.tree.SyntaxElement;
import org.pragmatica.ebnf.tree.SyntaxNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Set;

/**
 * Runs compiled rule procedures against a token stream.
 *
 * <p>Failures are explained by the furthest position any attempt reached ("furthest-fail") and
 * the texts expected there. A failed parse returns only an error, never a partial tree.
 */
public final class ParseEngine {
    private static final Logger log = LoggerFactory.getLogger(ParseEngine.class);

    private ParseEngine() {}

    public static Either<ParseError, SyntaxNode> parse(RuleTable rules, ParserConfig config, TokenStream tokens, String rule) {
        var index = rules.indexOf(rule);
        if (index.isEmpty()) {
            return Either.left(new ParseError.UnknownRuleError(rule));
        }
        return parse(rules, config, tokens, index.get());
    }

    /**
     * Parse the whole stream with the rule at the index. Tokens left over after a successful match are an error.
     *
     * <p>The thread stack bounds nesting as well: when it runs out before {@code maxRecursionDepth} is reached,
     * the call fails with a {@link ParseError.RecursionDepthExceededError} carrying the depth actually reached.
     */
    public static Either<ParseError, SyntaxNode> parse(RuleTable rules, ParserConfig config, TokenStream tokens, int ruleIndex) {
        var ctx = ParsingContext.create(tokens, rules, config);
        ParseResult result;
        try {
            result = invoke(ctx, ruleIndex);
        } catch (StackOverflowError e) {
            log.warn("Stack exhausted at rule depth {} (configured limit {})", ctx.peakDepth(), config.maxRecursionDepth());
            result = new ParseResult.Abort(new ParseError.RecursionDepthExceededError(ctx.peakDepth(),
                                                                                      rules.name(ctx.innermostRule()),
                                                                                      ctx.location()));
        }

        Either<ParseError, SyntaxNode> outcome;
        if (result instanceof ParseResult.Abort abort) {
            outcome = Either.left(abort.error());
        } else if (result instanceof ParseResult.Success success) {
            outcome = ctx.isAtEnd()
                      ? Either.right((SyntaxNode) success.element())
                      : Either.left(trailingInput(ctx));
        } else {
            outcome = Either.left(syntaxError(ctx));
        }
        if (outcome.isLeft()) {
            log.debug("Parse with rule '{}' failed: {}", rules.name(ruleIndex), outcome.getLeft().message());
        }
        return outcome;
    }

    /**
     * Invoke a rule: depth guard, packrat lookup, body, node construction.
     */
    public static ParseResult invoke(ParsingContext ctx, int ruleIndex) {
        var rules = ctx.rules();
        int start = ctx.pos();

        var memo = ctx.cached(ruleIndex, start);
        if (memo.isDefined()) {
            ctx.setPos(memo.get().end());
            return memo.get().result();
        }

        int limit = ctx.config().maxRecursionDepth();
        if (ctx.depth() >= limit) {
            return new ParseResult.Abort(new ParseError.RecursionDepthExceededError(limit,
                                                                                    rules.name(ruleIndex),
                                                                                    ctx.location()));
        }

        ParseResult result;
        ctx.enterRule(ruleIndex);
        try {
            result = rules.body(ruleIndex)
                          .parse(ctx);
        } finally {
            ctx.exitRule();
        }

        if (result instanceof ParseResult.Abort) {
            return result;
        }
        if (result instanceof ParseResult.Success success) {
            result = ParseResult.success(new SyntaxNode(rules.name(ruleIndex),
                                                        children(success.element()),
                                                        ctx.spanFrom(start)));
        } else {
            ctx.setPos(start);
        }
        ctx.cache(ruleIndex, start, result, ctx.pos());
        return result;
    }

    // The matched alternative's elements become the node's children.
    private static List<SyntaxElement> children(SyntaxElement element) {
        return element instanceof SyntaxElement.SequenceMatch sequence
               ? sequence.items()
               : List.of(element);
    }

    private static ParseError syntaxError(ParsingContext ctx) {
        return new ParseError.ParseSyntaxError(ctx.furthestExpected(), ctx.furthestToken(), ctx.furthestLocation());
    }

    // A failure past the end of the match explains more than the leftover token does.
    private static ParseError trailingInput(ParsingContext ctx) {
        if (ctx.furthestPos() > ctx.pos()) {
            return syntaxError(ctx);
        }
        var expected = ctx.furthestPos() == ctx.pos() && !ctx.furthestExpected()
                                                               .isEmpty()
                       ? ctx.furthestExpected()
                       : Set.of(GrammarAnalysis.END_OF_INPUT);
        return new ParseError.TrailingInputError(ctx.peek()
                                                    .get(), expected);
    }
}
