package org.pragmatica.ebnf.emitter;

import io.vavr.control.Option;
import org.pragmatica.ebnf.lexer.CharacterLexer;
import org.pragmatica.ebnf.model.DecisionPlan;
import org.pragmatica.ebnf.model.Operation;
import org.pragmatica.ebnf.model.ParserModel;
import org.pragmatica.ebnf.parser.ParseEngine;
import org.pragmatica.ebnf.parser.ParseResult;
import org.pragmatica.ebnf.parser.ParserConfig;
import org.pragmatica.ebnf.parser.Procedure;
import org.pragmatica.ebnf.parser.RuleTable;
import org.pragmatica.ebnf.tree.SyntaxElement;
import org.pragmatica.ebnf.tree.SyntaxElement.OptionalMatch;
import org.pragmatica.ebnf.tree.SyntaxElement.Repeated;
import org.pragmatica.ebnf.tree.SyntaxElement.SequenceMatch;
import org.pragmatica.ebnf.tree.SyntaxElement.TokenLeaf;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Compiles a {@link ParserModel} into immutable procedures, one per rule.
 *
 * <p>Each operation becomes a closure over its already compiled parts; rule references become
 * lookups in the rule table by index.
 */
public final class ParserEmitter {
    private static final Logger log = LoggerFactory.getLogger(ParserEmitter.class);

    private ParserEmitter() {}

    public static CompiledParser emit(ParserModel model) {
        return emit(model, ParserConfig.DEFAULT);
    }

    public static CompiledParser emit(ParserModel model, ParserConfig config) {
        var bodies = model.rules()
                          .stream()
                          .map(rule -> compile(rule.body()))
                          .toList();
        var table = new RuleTable(model.ruleNames(), bodies);
        var lexer = CharacterLexer.forLiterals(model.literals());
        log.debug("Emitted {} rule procedures, entry rule '{}'", table.size(), model.entryRule());
        return new CompiledParser(model.entryRule(), table, config, lexer);
    }

    static Procedure compile(Operation operation) {
        if (operation instanceof Operation.Match match) {
            return literal(match.text());
        }
        if (operation instanceof Operation.Invoke invoke) {
            int index = invoke.index();
            return ctx -> ParseEngine.invoke(ctx, index);
        }
        if (operation instanceof Operation.Chain chain) {
            return sequence(chain.steps()
                                 .stream()
                                 .map(ParserEmitter::compile)
                                 .toList());
        }
        if (operation instanceof Operation.Select select) {
            var alternatives = select.alternatives()
                                     .stream()
                                     .map(ParserEmitter::compile)
                                     .toList();
            if (select.plan() instanceof DecisionPlan.Predictive predictive) {
                return predictiveChoice(select, predictive, alternatives);
            }
            return orderedChoice(select.alternatives(), alternatives);
        }
        if (operation instanceof Operation.Loop loop) {
            return repetition(loop.body()
                                  .first(), compile(loop.body()), loop.allowEmpty());
        }
        if (operation instanceof Operation.Attempt attempt) {
            return optional(attempt.body(), compile(attempt.body()));
        }
        var exclude = (Operation.Exclude) operation;
        return exception(compile(exclude.base()), compile(exclude.excluded()));
    }

    // === Literal ===

    private static Procedure literal(String text) {
        return ctx -> {
            if (ctx.nextIs(text)) {
                return ParseResult.success(new TokenLeaf(ctx.advance()));
            }
            ctx.expected(text);
            return ParseResult.failure(ctx.pos());
        };
    }

    // === Sequence ===

    private static Procedure sequence(List<Procedure> steps) {
        return ctx -> {
            int start = ctx.pos();
            var items = new ArrayList<SyntaxElement>(steps.size());
            for (var step : steps) {
                var result = step.parse(ctx);
                if (result instanceof ParseResult.Success success) {
                    items.add(success.element());
                    continue;
                }
                if (result instanceof ParseResult.Failure) {
                    ctx.setPos(start);
                    return ParseResult.failure(start);
                }
                return result;
            }
            return ParseResult.success(new SequenceMatch(items));
        };
    }

    // === Choice ===

    private static Procedure predictiveChoice(Operation.Select select,
                                              DecisionPlan.Predictive plan,
                                              List<Procedure> alternatives) {
        var first = select.first();
        var fallback = plan.fallback()
                           .map(alternatives::get);
        return ctx -> {
            int start = ctx.pos();
            var selected = ctx.peek()
                              .flatMap(token -> Option.of(plan.dispatch()
                                                              .get(token.text())));
            if (selected.isDefined()) {
                var result = alternatives.get(selected.get())
                                         .parse(ctx);
                if (!(result instanceof ParseResult.Failure)) {
                    return result;
                }
                ctx.setPos(start);
            } else {
                ctx.expected(first);
            }
            if (fallback.isDefined() && !selected.equals(plan.fallback())) {
                return fallback.get()
                               .parse(ctx);
            }
            return ParseResult.failure(start);
        };
    }

    private static Procedure orderedChoice(List<Operation> operations, List<Procedure> alternatives) {
        return ctx -> {
            int start = ctx.pos();
            for (int i = 0; i < alternatives.size(); i++) {
                var operation = operations.get(i);
                if (!operation.nullable() && !ctx.nextIn(operation.first())) {
                    ctx.expected(operation.first());
                    continue;
                }
                var result = alternatives.get(i)
                                         .parse(ctx);
                if (!(result instanceof ParseResult.Failure)) {
                    return result;
                }
                ctx.setPos(start);
            }
            return ParseResult.failure(start);
        };
    }

    // === Repetition ===

    private static Procedure repetition(Set<String> first, Procedure body, boolean allowEmpty) {
        return ctx -> {
            var items = new ArrayList<SyntaxElement>();
            while (true) {
                if (!ctx.nextIn(first)) {
                    ctx.expected(first);
                    break;
                }
                int start = ctx.pos();
                var result = body.parse(ctx);
                if (result instanceof ParseResult.Abort) {
                    return result;
                }
                if (result instanceof ParseResult.Failure || ctx.pos() == start) {
                    ctx.setPos(start);
                    break;
                }
                items.add(((ParseResult.Success) result).element());
            }
            if (!allowEmpty && items.isEmpty()) {
                return ParseResult.failure(ctx.pos());
            }
            return ParseResult.success(new Repeated(items));
        };
    }

    // === Optional ===

    private static Procedure optional(Operation operation, Procedure body) {
        return ctx -> {
            if (!operation.nullable() && !ctx.nextIn(operation.first())) {
                ctx.expected(operation.first());
                return ParseResult.success(OptionalMatch.absent());
            }
            int start = ctx.pos();
            var result = body.parse(ctx);
            if (result instanceof ParseResult.Success success) {
                return ParseResult.success(OptionalMatch.present(success.element()));
            }
            if (result instanceof ParseResult.Abort) {
                return result;
            }
            ctx.setPos(start);
            return ParseResult.success(OptionalMatch.absent());
        };
    }

    // === Exception ===

    private static Procedure exception(Procedure base, Procedure excluded) {
        return ctx -> {
            int start = ctx.pos();
            var result = base.parse(ctx);
            if (!(result instanceof ParseResult.Success)) {
                return result;
            }
            int end = ctx.pos();
            ctx.setPos(start);
            var probe = ctx.probe(excluded);
            if (probe instanceof ParseResult.Abort) {
                return probe;
            }
            boolean sameMatch = probe.isSuccess() && ctx.pos() == end;
            if (sameMatch) {
                ctx.setPos(start);
                return ParseResult.failure(start);
            }
            ctx.setPos(end);
            return result;
        };
    }
}
