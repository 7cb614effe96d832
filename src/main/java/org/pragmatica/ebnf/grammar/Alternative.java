package org.pragmatica.ebnf.grammar;

import org.pragmatica.ebnf.tree.SourceSpan;

import java.util.List;

/**
 * Ordered, non-empty sequence of terms separated by {@code ,}.
 */
public record Alternative(SourceSpan span, List<Term> terms) {

    public Alternative {
        terms = List.copyOf(terms);
        if (terms.isEmpty()) {
            throw new IllegalArgumentException("Alternative must contain at least one term");
        }
    }

    public static Alternative of(Term... terms) {
        var list = List.of(terms);
        return new Alternative(list.get(0).span().merge(list.get(list.size() - 1).span()), list);
    }

    public Term first() {
        return terms.get(0);
    }
}
