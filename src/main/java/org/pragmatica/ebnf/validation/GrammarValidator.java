package org.pragmatica.ebnf.validation;

import io.vavr.control.Either;
import io.vavr.control.Option;
import org.pragmatica.ebnf.analysis.GrammarAnalysis;
import org.pragmatica.ebnf.error.GrammarError;
import org.pragmatica.ebnf.error.GrammarWarning;
import org.pragmatica.ebnf.grammar.Alternative;
import org.pragmatica.ebnf.grammar.Grammar;
import org.pragmatica.ebnf.grammar.GrammarRule;
import org.pragmatica.ebnf.grammar.Term;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Consumer;

/**
 * Structural checks over a loaded grammar, run in this order:
 * <ol>
 *     <li>unique rule names</li>
 *     <li>every reference and the entry rule resolve</li>
 *     <li>reachability from the entry rule (warning)</li>
 *     <li>no left-recursion cycle</li>
 *     <li>no repetition whose body can match empty input</li>
 *     <li>FIRST-set overlap between alternatives of one choice (warning)</li>
 * </ol>
 * The first fatal error aborts validation.
 */
public final class GrammarValidator {
    private static final Logger log = LoggerFactory.getLogger(GrammarValidator.class);

    private final Grammar grammar;
    private final Map<String, GrammarRule> rules;
    private final List<GrammarWarning> warnings = new ArrayList<>();
    private GrammarAnalysis analysis;

    private GrammarValidator(Grammar grammar) {
        this.grammar = grammar;
        this.rules = grammar.ruleMap();
    }

    public static Either<GrammarError, ValidationReport> validate(Grammar grammar) {
        return new GrammarValidator(grammar).run();
    }

    private Either<GrammarError, ValidationReport> run() {
        var error = checkDuplicates()
            .orElse(this::checkReferences)
            .orElse(() -> {
                checkReachability();
                analysis = GrammarAnalysis.analyze(grammar);
                return checkLeftRecursion();
            })
            .orElse(this::checkRepetitions);
        if (error.isDefined()) {
            log.debug("Grammar rejected: {}", error.get().message());
            return Either.left(error.get());
        }
        checkAmbiguity();
        log.debug("Validated {} rules with {} warnings", grammar.rules().size(), warnings.size());
        return Either.right(new ValidationReport(grammar, analysis, warnings));
    }

    // === 1. Uniqueness ===

    private Option<GrammarError> checkDuplicates() {
        var seen = new HashSet<String>();
        for (var rule : grammar.rules()) {
            if (!seen.add(rule.name())) {
                return Option.some(new GrammarError.DuplicateRuleError(rule.name(), rule.span()));
            }
        }
        return Option.none();
    }

    // === 2. Reference resolution ===

    private Option<GrammarError> checkReferences() {
        for (var rule : grammar.rules()) {
            var undefined = new ArrayList<Term.NonterminalRef>();
            forEachTerm(rule, term -> {
                if (term instanceof Term.NonterminalRef ref && !rules.containsKey(ref.name())) {
                    undefined.add(ref);
                }
            });
            if (!undefined.isEmpty()) {
                var ref = undefined.get(0);
                return Option.some(new GrammarError.UndefinedRuleError(ref.name(), rule.name(), ref.span()));
            }
        }
        var entry = grammar.effectiveEntryRule();
        if (entry.isEmpty()) {
            return Option.some(new GrammarError.MissingEntryRuleError("<none>"));
        }
        if (!rules.containsKey(entry.get())) {
            return Option.some(new GrammarError.MissingEntryRuleError(entry.get()));
        }
        return Option.none();
    }

    // === 3. Reachability ===

    private void checkReachability() {
        var reached = new HashSet<String>();
        var pending = new ArrayDeque<String>();
        var entry = grammar.effectiveEntryRule()
                           .get();
        reached.add(entry);
        pending.add(entry);

        while (!pending.isEmpty()) {
            forEachTerm(rules.get(pending.poll()), term -> {
                if (term instanceof Term.NonterminalRef ref && reached.add(ref.name())) {
                    pending.add(ref.name());
                }
            });
        }
        for (var rule : grammar.rules()) {
            if (!reached.contains(rule.name())) {
                warnings.add(new GrammarWarning.UnreachableRuleWarning(rule.name(), rule.span()));
            }
        }
    }

    // === 4. Left recursion ===

    private Option<GrammarError> checkLeftRecursion() {
        var finished = new HashSet<String>();
        for (var rule : grammar.rules()) {
            var cycle = findCycle(rule.name(), new ArrayList<>(), finished);
            if (cycle.isDefined()) {
                var start = rules.get(cycle.get().get(0));
                return Option.some(new GrammarError.LeftRecursionError(cycle.get(), start.span()));
            }
        }
        return Option.none();
    }

    private Option<List<String>> findCycle(String rule, List<String> path, Set<String> finished) {
        int index = path.indexOf(rule);
        if (index >= 0) {
            var cycle = new ArrayList<>(path.subList(index, path.size()));
            cycle.add(rule);
            return Option.some(cycle);
        }
        if (finished.contains(rule)) {
            return Option.none();
        }
        path.add(rule);
        for (var next : analysis.leftReferences(rule)) {
            var cycle = findCycle(next, path, finished);
            if (cycle.isDefined()) {
                return cycle;
            }
        }
        path.remove(path.size() - 1);
        finished.add(rule);
        return Option.none();
    }

    // === 5. Repetitions that cannot terminate ===

    private Option<GrammarError> checkRepetitions() {
        for (var rule : grammar.rules()) {
            var offending = new ArrayList<Term.Repetition>();
            forEachTerm(rule, term -> {
                if (term instanceof Term.Repetition repetition && analysis.nullable(repetition.term())) {
                    offending.add(repetition);
                }
            });
            if (!offending.isEmpty()) {
                return Option.some(new GrammarError.InfiniteLoopError(rule.name(), offending.get(0).span()));
            }
        }
        return Option.none();
    }

    // === 6. Ambiguity ===

    private void checkAmbiguity() {
        for (var rule : grammar.rules()) {
            checkChoice(rule, rule.alternatives());
            forEachTerm(rule, term -> {
                if (term instanceof Term.Choice choice) {
                    checkChoice(rule, choice.alternatives());
                }
            });
        }
    }

    private void checkChoice(GrammarRule rule, List<Alternative> alternatives) {
        for (int i = 0; i < alternatives.size(); i++) {
            for (int j = i + 1; j < alternatives.size(); j++) {
                var overlap = new LinkedHashSet<>(analysis.first(alternatives.get(i)));
                overlap.retainAll(analysis.first(alternatives.get(j)));
                if (!overlap.isEmpty()) {
                    var span = alternatives.get(i)
                                           .span()
                                           .merge(alternatives.get(j)
                                                              .span());
                    warnings.add(new GrammarWarning.AmbiguityWarning(rule.name(), List.of(i, j), overlap, span));
                }
            }
        }
    }

    // === Traversal ===

    private static void forEachTerm(GrammarRule rule, Consumer<Term> action) {
        rule.alternatives()
            .forEach(alternative -> forEachTerm(alternative.terms(), action));
    }

    private static void forEachTerm(List<Term> terms, Consumer<Term> action) {
        for (var term : terms) {
            action.accept(term);
            if (term instanceof Term.Sequence sequence) {
                forEachTerm(sequence.terms(), action);
            } else if (term instanceof Term.Choice choice) {
                choice.alternatives()
                      .forEach(alternative -> forEachTerm(alternative.terms(), action));
            } else if (term instanceof Term.Repetition repetition) {
                forEachTerm(List.of(repetition.term()), action);
            } else if (term instanceof Term.Optional optional) {
                forEachTerm(List.of(optional.term()), action);
            } else if (term instanceof Term.Exception exception) {
                forEachTerm(List.of(exception.base(), exception.excluded()), action);
            }
        }
    }
}
