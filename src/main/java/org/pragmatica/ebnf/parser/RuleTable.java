package org.pragmatica.ebnf.parser;

import io.vavr.control.Option;

import java.util.List;

/**
 * Rule bodies addressed by stable index. Rules invoke each other through this table,
 * never through direct references.
 */
public record RuleTable(List<String> names, List<Procedure> bodies) {

    public RuleTable {
        names = List.copyOf(names);
        bodies = List.copyOf(bodies);
        if (names.size() != bodies.size()) {
            throw new IllegalArgumentException("Rule names and bodies differ in size");
        }
    }

    public int size() {
        return names.size();
    }

    public String name(int index) {
        return names.get(index);
    }

    public Procedure body(int index) {
        return bodies.get(index);
    }

    public Option<Integer> indexOf(String name) {
        int index = names.indexOf(name);
        return index < 0
               ? Option.none()
               : Option.some(index);
    }
}
