package org.pragmatica.ebnf.model;

import io.vavr.control.Option;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * How a choice picks its alternative. Both plans give the same result as trying the alternatives
 * in declared order and committing to the first success.
 */
public sealed interface DecisionPlan {

    /**
     * Alternatives' FIRST sets are pairwise disjoint: the next token selects the only alternative
     * that can match. {@code fallback} is the trailing alternative that may match empty input.
     */
    record Predictive(Map<String, Integer> dispatch, Option<Integer> fallback) implements DecisionPlan {
        public Predictive {
            dispatch = Collections.unmodifiableMap(new LinkedHashMap<>(dispatch));
        }
    }

    /**
     * Ordered attempt with cursor restore; alternatives that cannot start with the next token are skipped.
     */
    record Backtracking() implements DecisionPlan {}

    /**
     * Pick the plan for the alternatives of one choice.
     */
    static DecisionPlan plan(List<Operation> alternatives, boolean predictiveAllowed) {
        if (!predictiveAllowed) {
            return new Backtracking();
        }
        var dispatch = new LinkedHashMap<String, Integer>();
        Option<Integer> fallback = Option.none();

        for (int i = 0; i < alternatives.size(); i++) {
            var alternative = alternatives.get(i);
            if (alternative.nullable()) {
                if (i != alternatives.size() - 1) {
                    return new Backtracking();
                }
                fallback = Option.some(i);
            }
            for (var text : alternative.first()) {
                if (dispatch.putIfAbsent(text, i) != null) {
                    return new Backtracking();
                }
            }
        }
        return new Predictive(dispatch, fallback);
    }
}
