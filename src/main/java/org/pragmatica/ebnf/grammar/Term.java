package org.pragmatica.ebnf.grammar;

import org.pragmatica.ebnf.tree.SourceSpan;

import java.util.List;

/**
 * Right-hand-side building block of a grammar rule. Rules reference each other by name only,
 * so a term tree never owns another rule.
 */
public sealed interface Term {
    SourceSpan span();

    /**
     * Quoted terminal, matched against token text.
     */
    record Literal(SourceSpan span, String text) implements Term {}

    record NonterminalRef(SourceSpan span, String name) implements Term {}

    /**
     * Grouped sequence, {@code ( a , b )}.
     */
    record Sequence(SourceSpan span, List<Term> terms) implements Term {
        public Sequence {
            terms = List.copyOf(terms);
        }
    }

    /**
     * Grouped alternation, {@code ( a | b )}. Order is significant.
     */
    record Choice(SourceSpan span, List<Alternative> alternatives) implements Term {
        public Choice {
            alternatives = List.copyOf(alternatives);
        }
    }

    /**
     * {@code { x }} when {@code allowEmpty}, {@code { x }-} (one or more) otherwise.
     */
    record Repetition(SourceSpan span, Term term, boolean allowEmpty) implements Term {}

    /**
     * {@code [ x ]}.
     */
    record Optional(SourceSpan span, Term term) implements Term {}

    /**
     * {@code base - excluded}: matches what {@code base} matches unless {@code excluded} matches the same tokens.
     */
    record Exception(SourceSpan span, Term base, Term excluded) implements Term {}

    /**
     * Collapse a parsed group to the simplest term: one term stays as is, one alternative becomes
     * a sequence, several become a choice.
     */
    static Term group(SourceSpan span, List<Alternative> alternatives) {
        if (alternatives.size() == 1) {
            var terms = alternatives.get(0).terms();
            return terms.size() == 1
                   ? terms.get(0)
                   : new Sequence(span, terms);
        }
        return new Choice(span, alternatives);
    }
}
