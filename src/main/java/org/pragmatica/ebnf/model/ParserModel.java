package org.pragmatica.ebnf.model;

import io.vavr.control.Option;
import org.pragmatica.ebnf.error.GrammarWarning;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Read-only operational model of a validated grammar. Rules form a flat table addressed by
 * name or by index; no rule owns another.
 */
public record ParserModel(List<RuleModel> rules, String entryRule, Set<String> literals, List<GrammarWarning> warnings) {

    public ParserModel {
        rules = List.copyOf(rules);
        literals = Collections.unmodifiableSet(new LinkedHashSet<>(literals));
        warnings = List.copyOf(warnings);
    }

    public Option<RuleModel> rule(String name) {
        return Option.ofOptional(rules.stream()
                                      .filter(rule -> rule.name()
                                                          .equals(name))
                                      .findFirst());
    }

    public RuleModel rule(int index) {
        return rules.get(index);
    }

    public RuleModel entry() {
        return rule(entryRule).get();
    }

    public List<String> ruleNames() {
        return rules.stream()
                    .map(RuleModel::name)
                    .toList();
    }
}
