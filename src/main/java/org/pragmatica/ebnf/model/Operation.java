package org.pragmatica.ebnf.model;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Normalized, executable form of a grammar term. Every operation knows its FIRST set and whether it
 * can succeed without consuming a token; rule references are resolved to stable rule indices.
 */
public sealed interface Operation {

    Set<String> first();

    boolean nullable();

    /**
     * Can this operation start with the given token text? Nullable operations can start anywhere.
     */
    default boolean canStartWith(String text) {
        return nullable() || first().contains(text);
    }

    private static Set<String> frozen(Set<String> texts) {
        return Collections.unmodifiableSet(new LinkedHashSet<>(texts));
    }

    /**
     * Literal.
     */
    record Match(String text) implements Operation {
        @Override
        public Set<String> first() {
            return Set.of(text);
        }

        @Override
        public boolean nullable() {
            return false;
        }
    }

    /**
     * Rule reference, addressed by index in the rule table.
     */
    record Invoke(String rule, int index, Set<String> first, boolean nullable) implements Operation {
        public Invoke {
            first = frozen(first);
        }
    }

    /**
     * Sequence; nested sequences are spliced in.
     */
    record Chain(List<Operation> steps, Set<String> first, boolean nullable) implements Operation {
        public Chain {
            steps = List.copyOf(steps);
            first = frozen(first);
        }

        public static Chain of(List<Operation> steps) {
            var first = new LinkedHashSet<String>();
            boolean nullable = true;
            for (var step : steps) {
                first.addAll(step.first());
                if (!step.nullable()) {
                    nullable = false;
                    break;
                }
            }
            return new Chain(steps, first, nullable);
        }
    }

    /**
     * Choice between alternatives, resolved by its decision plan.
     */
    record Select(List<Operation> alternatives, DecisionPlan plan, Set<String> first, boolean nullable)
        implements Operation {

        public Select {
            alternatives = List.copyOf(alternatives);
            first = frozen(first);
        }

        public static Select of(List<Operation> alternatives, DecisionPlan plan) {
            var first = new LinkedHashSet<String>();
            alternatives.forEach(alternative -> first.addAll(alternative.first()));
            boolean nullable = alternatives.stream()
                                           .anyMatch(Operation::nullable);
            return new Select(alternatives, plan, first, nullable);
        }
    }

    /**
     * Greedy repetition; {@code allowEmpty == false} requires at least one iteration.
     */
    record Loop(Operation body, boolean allowEmpty) implements Operation {
        @Override
        public Set<String> first() {
            return body.first();
        }

        @Override
        public boolean nullable() {
            return allowEmpty || body.nullable();
        }
    }

    /**
     * Optional; always succeeds.
     */
    record Attempt(Operation body) implements Operation {
        @Override
        public Set<String> first() {
            return body.first();
        }

        @Override
        public boolean nullable() {
            return true;
        }
    }

    /**
     * {@code base} unless {@code excluded} matches exactly the same tokens.
     */
    record Exclude(Operation base, Operation excluded) implements Operation {
        @Override
        public Set<String> first() {
            return base.first();
        }

        @Override
        public boolean nullable() {
            return base.nullable();
        }
    }
}
