package org.pragmatica.ebnf.grammar;

import org.pragmatica.ebnf.tree.SourceSpan;

import java.util.List;

/**
 * A grammar rule: name and ordered alternatives.
 */
public record GrammarRule(SourceSpan span, String name, List<Alternative> alternatives) {

    public GrammarRule {
        alternatives = List.copyOf(alternatives);
    }

    public GrammarRule withAlternatives(List<Alternative> newAlternatives) {
        return new GrammarRule(span, name, newAlternatives);
    }
}
