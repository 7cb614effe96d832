package org.pragmatica.ebnf.grammar;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Renders a grammar back to EBNF text, one {@code name = rhs ;} line per rule.
 * Loading the printed text yields a grammar that prints identically.
 */
public final class GrammarPrinter {

    private GrammarPrinter() {}

    public static String print(Grammar grammar) {
        var sb = new StringBuilder();
        for (var rule : grammar.rules()) {
            sb.append(print(rule)).append("\n");
        }
        return sb.toString();
    }

    public static String print(GrammarRule rule) {
        return rule.name() + " = " + alternatives(rule.alternatives()) + " ;";
    }

    public static String print(Term term) {
        if (term instanceof Term.Literal literal) {
            return quote(literal.text());
        }
        if (term instanceof Term.NonterminalRef ref) {
            return ref.name();
        }
        if (term instanceof Term.Sequence sequence) {
            return "( " + terms(sequence.terms()) + " )";
        }
        if (term instanceof Term.Choice choice) {
            return "( " + alternatives(choice.alternatives()) + " )";
        }
        if (term instanceof Term.Repetition repetition) {
            return "{ " + body(repetition.term()) + " }" + (repetition.allowEmpty()
                                                              ? ""
                                                              : "-");
        }
        if (term instanceof Term.Optional optional) {
            return "[ " + body(optional.term()) + " ]";
        }
        var exception = (Term.Exception) term;
        return operand(exception.base()) + " - " + operand(exception.excluded());
    }

    private static String alternatives(List<Alternative> alternatives) {
        return alternatives.stream()
                           .map(alternative -> terms(alternative.terms()))
                           .collect(Collectors.joining(" | "));
    }

    private static String terms(List<Term> terms) {
        return terms.stream()
                    .map(GrammarPrinter::print)
                    .collect(Collectors.joining(" , "));
    }

    // brackets already group their content
    private static String body(Term term) {
        if (term instanceof Term.Sequence sequence) {
            return terms(sequence.terms());
        }
        if (term instanceof Term.Choice choice) {
            return alternatives(choice.alternatives());
        }
        return print(term);
    }

    // "{ x }- - y" would read back as a malformed exception
    private static String operand(Term term) {
        boolean needsGroup = term instanceof Term.Exception
                             || (term instanceof Term.Repetition repetition && !repetition.allowEmpty());
        return needsGroup
               ? "( " + print(term) + " )"
               : print(term);
    }

    private static String quote(String text) {
        return text.contains("\"")
               ? "'" + text + "'"
               : "\"" + text + "\"";
    }
}
