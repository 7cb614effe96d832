package org.pragmatica.ebnf.model;

import org.pragmatica.ebnf.tree.SourceSpan;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * One rule of the parser model: its normalized body plus lookahead information.
 */
public record RuleModel(String name,
                        int index,
                        Operation body,
                        Set<String> first,
                        Set<String> follow,
                        boolean nullable,
                        SourceSpan span) {

    public RuleModel {
        first = Collections.unmodifiableSet(new LinkedHashSet<>(first));
        follow = Collections.unmodifiableSet(new LinkedHashSet<>(follow));
    }
}
