package org.pragmatica.ebnf;

import org.pragmatica.ebnf.error.GrammarWarning;
import org.pragmatica.ebnf.model.ParserModel;
import org.pragmatica.ebnf.parser.Parser;

import java.util.List;

/**
 * Result of compiling a grammar: the parser, the model it was emitted from, and the warnings
 * validation reported.
 */
public record Compilation(Parser parser, ParserModel model, List<GrammarWarning> warnings) {

    public Compilation {
        warnings = List.copyOf(warnings);
    }

    public boolean hasWarnings() {
        return !warnings.isEmpty();
    }
}
