package org.pragmatica.ebnf.validation;

import org.pragmatica.ebnf.analysis.GrammarAnalysis;
import org.pragmatica.ebnf.error.GrammarWarning;
import org.pragmatica.ebnf.grammar.Grammar;

import java.util.List;

/**
 * Outcome of a successful validation: the grammar, its analysis and accumulated warnings.
 */
public record ValidationReport(Grammar grammar, GrammarAnalysis analysis, List<GrammarWarning> warnings) {

    public ValidationReport {
        warnings = List.copyOf(warnings);
    }

    public String entryRule() {
        return grammar.effectiveEntryRule()
                      .get();
    }
}
