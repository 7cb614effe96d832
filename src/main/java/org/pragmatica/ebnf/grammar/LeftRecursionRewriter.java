package org.pragmatica.ebnf.grammar;

import org.pragmatica.ebnf.analysis.GrammarAnalysis;
import org.pragmatica.ebnf.tree.SourceSpan;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Rewrites directly left-recursive rules into iteration:
 * {@code r = s1 | s2 | r , t1 | r , t2 ;} becomes {@code r = ( s1 | s2 ) , { t1 | t2 } ;}.
 *
 * <p>Leading groups are looked through, so {@code typ = var | ( typ , "->" , typ ) ;} becomes
 * {@code typ = var , { "->" , typ } ;}, which parses {@code a -> b -> c} as {@code a -> (b -> c)}.
 * Rules without a non-recursive alternative, with a tail that can match empty input, or that are
 * only indirectly left-recursive are left as they are for the validator to reject.
 */
public final class LeftRecursionRewriter {
    private static final Logger log = LoggerFactory.getLogger(LeftRecursionRewriter.class);

    private final GrammarAnalysis analysis;

    private LeftRecursionRewriter(GrammarAnalysis analysis) {
        this.analysis = analysis;
    }

    public static Grammar rewrite(Grammar grammar) {
        var rewriter = new LeftRecursionRewriter(GrammarAnalysis.analyze(grammar));
        var rules = grammar.rules()
                           .stream()
                           .map(rewriter::rewrite)
                           .toList();
        return grammar.withRules(rules);
    }

    private GrammarRule rewrite(GrammarRule rule) {
        var flattened = flatten(rule.alternatives());
        var seeds = new ArrayList<Alternative>();
        var tails = new ArrayList<Alternative>();

        for (var alternative : flattened) {
            if (isSelfReference(alternative.first(), rule.name())) {
                if (alternative.terms()
                               .size() == 1) {
                    return rule;
                }
                var tail = alternative.terms()
                                      .subList(1, alternative.terms()
                                                             .size());
                if (analysis.nullable(tail)) {
                    return rule;
                }
                tails.add(new Alternative(spanOfTerms(tail), tail));
            } else {
                seeds.add(alternative);
            }
        }
        if (tails.isEmpty() || seeds.isEmpty()) {
            return rule;
        }

        var seed = Term.group(spanOfAlternatives(seeds), seeds);
        var tail = Term.group(spanOfAlternatives(tails), tails);
        var loop = new Term.Repetition(tail.span(), tail, true);
        var rewritten = rule.withAlternatives(List.of(new Alternative(rule.span(), List.of(seed, loop))));

        log.info("Rewrote left-recursive rule '{}' as: {}", rule.name(), GrammarPrinter.print(rewritten));
        return rewritten;
    }

    /**
     * Expand alternatives that consist of a single grouped choice, and splice a leading grouped
     * sequence into its alternative.
     */
    private static List<Alternative> flatten(List<Alternative> alternatives) {
        var result = new ArrayList<Alternative>();
        for (var alternative : alternatives) {
            var head = alternative.first();
            if (alternative.terms()
                           .size() == 1 && head instanceof Term.Choice choice) {
                result.addAll(flatten(choice.alternatives()));
            } else if (head instanceof Term.Sequence sequence) {
                var terms = new ArrayList<>(sequence.terms());
                terms.addAll(alternative.terms()
                                        .subList(1, alternative.terms()
                                                               .size()));
                result.addAll(flatten(List.of(new Alternative(alternative.span(), terms))));
            } else {
                result.add(alternative);
            }
        }
        return result;
    }

    private static boolean isSelfReference(Term term, String name) {
        return term instanceof Term.NonterminalRef ref && ref.name()
                                                             .equals(name);
    }

    private static SourceSpan spanOfTerms(List<Term> terms) {
        return terms.get(0)
                    .span()
                    .merge(terms.get(terms.size() - 1)
                                .span());
    }

    private static SourceSpan spanOfAlternatives(List<Alternative> alternatives) {
        return alternatives.get(0)
                           .span()
                           .merge(alternatives.get(alternatives.size() - 1)
                                              .span());
    }
}
