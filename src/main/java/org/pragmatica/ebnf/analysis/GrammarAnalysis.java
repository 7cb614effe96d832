package org.pragmatica.ebnf.analysis;

import org.pragmatica.ebnf.grammar.Alternative;
import org.pragmatica.ebnf.grammar.Grammar;
import org.pragmatica.ebnf.grammar.GrammarRule;
import org.pragmatica.ebnf.grammar.Term;

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Nullability, FIRST and FOLLOW sets of a grammar, computed by fixed-point iteration.
 *
 * <p>Sets hold token texts. FOLLOW sets use {@link #END_OF_INPUT} for the end of the token stream.
 * References to undefined rules are treated as non-nullable with an empty FIRST set.
 */
public final class GrammarAnalysis {

    public static final String END_OF_INPUT = "<EOF>";

    private final Map<String, GrammarRule> rules;
    private final Map<String, Boolean> nullable = new HashMap<>();
    private final Map<String, Set<String>> first = new HashMap<>();
    private final Map<String, Set<String>> follow = new HashMap<>();
    private int firstPasses;
    private int followPasses;
    private boolean changed;

    private GrammarAnalysis(Grammar grammar) {
        this.rules = grammar.ruleMap();
        rules.keySet()
             .forEach(name -> {
                 nullable.put(name, false);
                 first.put(name, new LinkedHashSet<>());
                 follow.put(name, new LinkedHashSet<>());
             });
    }

    public static GrammarAnalysis analyze(Grammar grammar) {
        var analysis = new GrammarAnalysis(grammar);
        analysis.computeFirst();
        grammar.effectiveEntryRule()
               .filter(analysis.rules::containsKey)
               .forEach(entry -> analysis.follow.get(entry)
                                                .add(END_OF_INPUT));
        analysis.computeFollow();
        return analysis;
    }

    private void computeFirst() {
        do {
            changed = false;
            firstPasses++;
            for (var rule : rules.values()) {
                boolean ruleNullable = rule.alternatives()
                                           .stream()
                                           .anyMatch(this::nullable);
                if (ruleNullable && !nullable.get(rule.name())) {
                    nullable.put(rule.name(), true);
                    changed = true;
                }
                var ruleFirst = first.get(rule.name());
                for (var alternative : rule.alternatives()) {
                    changed |= ruleFirst.addAll(first(alternative));
                }
            }
        } while (changed);
    }

    private void computeFollow() {
        do {
            changed = false;
            followPasses++;
            for (var rule : rules.values()) {
                var ruleFollow = Set.copyOf(follow.get(rule.name()));
                for (var alternative : rule.alternatives()) {
                    propagate(alternative.terms(), ruleFollow);
                }
            }
        } while (changed);
    }

    // Walk right to left, carrying what may follow each term.
    private void propagate(List<Term> sequence, Set<String> after) {
        var trailer = new LinkedHashSet<>(after);
        for (int i = sequence.size() - 1; i >= 0; i--) {
            var term = sequence.get(i);
            visit(term, trailer);
            var next = new LinkedHashSet<>(first(term));
            if (nullable(term)) {
                next.addAll(trailer);
            }
            trailer = next;
        }
    }

    private void visit(Term term, Set<String> after) {
        if (term instanceof Term.NonterminalRef ref) {
            var target = follow.get(ref.name());
            if (target != null) {
                changed |= target.addAll(after);
            }
        } else if (term instanceof Term.Sequence sequence) {
            propagate(sequence.terms(), after);
        } else if (term instanceof Term.Choice choice) {
            choice.alternatives()
                  .forEach(alternative -> propagate(alternative.terms(), after));
        } else if (term instanceof Term.Repetition repetition) {
            var loopAfter = new LinkedHashSet<>(first(repetition.term()));
            loopAfter.addAll(after);
            visit(repetition.term(), loopAfter);
        } else if (term instanceof Term.Optional optional) {
            visit(optional.term(), after);
        } else if (term instanceof Term.Exception exception) {
            visit(exception.base(), after);
        }
    }

    // === Queries ===

    public boolean nullable(String rule) {
        return nullable.getOrDefault(rule, false);
    }

    public boolean nullable(Alternative alternative) {
        return nullable(alternative.terms());
    }

    public boolean nullable(List<Term> sequence) {
        return sequence.stream()
                       .allMatch(this::nullable);
    }

    public boolean nullable(Term term) {
        if (term instanceof Term.Literal) {
            return false;
        }
        if (term instanceof Term.NonterminalRef ref) {
            return nullable(ref.name());
        }
        if (term instanceof Term.Sequence sequence) {
            return nullable(sequence.terms());
        }
        if (term instanceof Term.Choice choice) {
            return choice.alternatives()
                         .stream()
                         .anyMatch(this::nullable);
        }
        if (term instanceof Term.Repetition repetition) {
            return repetition.allowEmpty() || nullable(repetition.term());
        }
        if (term instanceof Term.Optional) {
            return true;
        }
        return nullable(((Term.Exception) term).base());
    }

    public Set<String> first(String rule) {
        return Collections.unmodifiableSet(first.getOrDefault(rule, Set.of()));
    }

    public Set<String> first(Alternative alternative) {
        return first(alternative.terms());
    }

    public Set<String> first(List<Term> sequence) {
        var result = new LinkedHashSet<String>();
        for (var term : sequence) {
            result.addAll(first(term));
            if (!nullable(term)) {
                break;
            }
        }
        return result;
    }

    public Set<String> first(Term term) {
        if (term instanceof Term.Literal literal) {
            return Set.of(literal.text());
        }
        if (term instanceof Term.NonterminalRef ref) {
            return first(ref.name());
        }
        if (term instanceof Term.Sequence sequence) {
            return first(sequence.terms());
        }
        if (term instanceof Term.Choice choice) {
            var result = new LinkedHashSet<String>();
            choice.alternatives()
                  .forEach(alternative -> result.addAll(first(alternative)));
            return result;
        }
        if (term instanceof Term.Repetition repetition) {
            return first(repetition.term());
        }
        if (term instanceof Term.Optional optional) {
            return first(optional.term());
        }
        return first(((Term.Exception) term).base());
    }

    public Set<String> follow(String rule) {
        return Collections.unmodifiableSet(follow.getOrDefault(rule, Set.of()));
    }

    /**
     * Rules that may be invoked at the current position before any token is consumed, in order of appearance.
     */
    public Set<String> leftReferences(String rule) {
        var result = new LinkedHashSet<String>();
        var definition = rules.get(rule);
        if (definition != null) {
            definition.alternatives()
                      .forEach(alternative -> leftReferences(alternative.terms(), result));
        }
        return result;
    }

    private void leftReferences(List<Term> sequence, Set<String> result) {
        for (var term : sequence) {
            leftReferences(term, result);
            if (!nullable(term)) {
                return;
            }
        }
    }

    private void leftReferences(Term term, Set<String> result) {
        if (term instanceof Term.NonterminalRef ref) {
            result.add(ref.name());
        } else if (term instanceof Term.Sequence sequence) {
            leftReferences(sequence.terms(), result);
        } else if (term instanceof Term.Choice choice) {
            choice.alternatives()
                  .forEach(alternative -> leftReferences(alternative.terms(), result));
        } else if (term instanceof Term.Repetition repetition) {
            leftReferences(repetition.term(), result);
        } else if (term instanceof Term.Optional optional) {
            leftReferences(optional.term(), result);
        } else if (term instanceof Term.Exception exception) {
            // the excluded term is probed at the same position
            leftReferences(exception.base(), result);
            leftReferences(exception.excluded(), result);
        }
    }

    public int firstPasses() {
        return firstPasses;
    }

    public int followPasses() {
        return followPasses;
    }
}
