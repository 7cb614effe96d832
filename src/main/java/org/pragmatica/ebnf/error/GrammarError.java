package org.pragmatica.ebnf.error;

import org.pragmatica.ebnf.tree.SourceLocation;
import org.pragmatica.ebnf.tree.SourceSpan;

import java.util.List;

/**
 * Fatal grammar problem. Any of these aborts parser construction.
 */
public sealed interface GrammarError extends Problem {

    /**
     * Where in the grammar text the problem was found.
     */
    SourceSpan span();

    /**
     * Malformed grammar text.
     */
    record GrammarSyntaxError(SourceLocation location, String expected, String found) implements GrammarError {
        public int line() {
            return location.line();
        }

        public int column() {
            return location.column();
        }

        @Override
        public SourceSpan span() {
            return SourceSpan.at(location);
        }

        @Override
        public String message() {
            return "Syntax error at " + location + ": expected " + expected + ", found " + found;
        }
    }

    record DuplicateRuleError(String name, SourceSpan span) implements GrammarError {
        @Override
        public String message() {
            return "Rule '" + name + "' is defined more than once";
        }
    }

    record UndefinedRuleError(String name, String referencingRule, SourceSpan span) implements GrammarError {
        @Override
        public String message() {
            return "Rule '" + referencingRule + "' references undefined rule '" + name + "'";
        }
    }

    /**
     * The explicitly requested entry rule does not exist.
     */
    record MissingEntryRuleError(String name) implements GrammarError {
        @Override
        public SourceSpan span() {
            return SourceSpan.EMPTY;
        }

        @Override
        public String message() {
            return "Entry rule '" + name + "' is not defined";
        }
    }

    /**
     * Rules that reach themselves without consuming input; the first name is repeated at the end.
     */
    record LeftRecursionError(List<String> cycle, SourceSpan span) implements GrammarError {
        public LeftRecursionError {
            cycle = List.copyOf(cycle);
        }

        @Override
        public String message() {
            return "Left recursion: " + String.join(" -> ", cycle);
        }
    }

    /**
     * Repetition whose body can match without consuming input.
     */
    record InfiniteLoopError(String rule, SourceSpan span) implements GrammarError {
        @Override
        public String message() {
            return "Repetition in rule '" + rule + "' can match empty input and would never terminate";
        }
    }
}
