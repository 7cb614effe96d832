package org.pragmatica.ebnf.grammar;

import io.vavr.control.Option;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * A complete EBNF grammar - rules in declaration order plus an optional explicit entry rule.
 * Uniqueness of names and presence of the entry rule are checked by the validator, not here.
 */
public record Grammar(List<GrammarRule> rules, Option<String> entryRule) {

    public Grammar {
        rules = List.copyOf(rules);
    }

    public static Grammar of(List<GrammarRule> rules) {
        return new Grammar(rules, Option.none());
    }

    /**
     * Get rule by name (the first one when names are duplicated).
     */
    public Option<GrammarRule> rule(String name) {
        return Option.ofOptional(rules.stream()
                                      .filter(r -> r.name()
                                                    .equals(name))
                                      .findFirst());
    }

    /**
     * Explicit entry rule, or the first rule.
     */
    public Option<String> effectiveEntryRule() {
        if (entryRule.isDefined()) {
            return entryRule;
        }
        return rules.isEmpty()
               ? Option.none()
               : Option.some(rules.get(0).name());
    }

    public Grammar withEntryRule(String name) {
        return new Grammar(rules, Option.some(name));
    }

    public Grammar withRules(List<GrammarRule> newRules) {
        return new Grammar(newRules, entryRule);
    }

    /**
     * Build a lookup map for efficient rule access. The first definition wins.
     */
    public Map<String, GrammarRule> ruleMap() {
        var map = new LinkedHashMap<String, GrammarRule>();
        rules.forEach(rule -> map.putIfAbsent(rule.name(), rule));
        return map;
    }

    /**
     * All literal texts used anywhere in the grammar, in order of first appearance.
     */
    public Set<String> literals() {
        var literals = new LinkedHashSet<String>();
        for (var rule : rules) {
            for (var alternative : rule.alternatives()) {
                alternative.terms()
                           .forEach(term -> collectLiterals(term, literals));
            }
        }
        return literals;
    }

    private static void collectLiterals(Term term, Set<String> literals) {
        if (term instanceof Term.Literal literal) {
            literals.add(literal.text());
        } else if (term instanceof Term.Sequence sequence) {
            sequence.terms()
                    .forEach(t -> collectLiterals(t, literals));
        } else if (term instanceof Term.Choice choice) {
            choice.alternatives()
                  .forEach(alt -> alt.terms()
                                     .forEach(t -> collectLiterals(t, literals)));
        } else if (term instanceof Term.Repetition repetition) {
            collectLiterals(repetition.term(), literals);
        } else if (term instanceof Term.Optional optional) {
            collectLiterals(optional.term(), literals);
        } else if (term instanceof Term.Exception exception) {
            collectLiterals(exception.base(), literals);
            collectLiterals(exception.excluded(), literals);
        }
    }
}
