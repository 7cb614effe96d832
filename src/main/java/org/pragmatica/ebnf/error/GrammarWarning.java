package org.pragmatica.ebnf.error;

import org.pragmatica.ebnf.tree.SourceSpan;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Non-fatal grammar problem, returned alongside a successfully built parser.
 */
public sealed interface GrammarWarning extends Problem {

    SourceSpan span();

    record UnreachableRuleWarning(String name, SourceSpan span) implements GrammarWarning {
        @Override
        public String message() {
            return "Rule '" + name + "' is unreachable from the entry rule";
        }
    }

    /**
     * Two alternatives of one choice may start with the same token. Indices are 0-based in
     * declaration order; the earlier alternative always wins.
     */
    record AmbiguityWarning(String rule, List<Integer> alternatives, Set<String> overlap, SourceSpan span)
        implements GrammarWarning {

        public AmbiguityWarning {
            alternatives = List.copyOf(alternatives);
            overlap = Collections.unmodifiableSet(new LinkedHashSet<>(overlap));
        }

        @Override
        public String message() {
            return "Alternatives " + alternatives + " in rule '" + rule + "' overlap on "
                   + overlap.stream()
                            .sorted()
                            .map(text -> "'" + text + "'")
                            .collect(Collectors.joining(", "));
        }
    }
}
