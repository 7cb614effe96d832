package org.pragmatica.ebnf.error;

import io.vavr.control.Option;
import org.pragmatica.ebnf.lexer.Token;
import org.pragmatica.ebnf.tree.SourceLocation;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Parse error with location and context information.
 */
public sealed interface ParseError extends Problem {
    SourceLocation location();

    private static String describe(Set<String> expected) {
        if (expected.isEmpty()) {
            return "nothing";
        }
        return expected.stream()
                       .map(text -> "'" + text + "'")
                       .collect(Collectors.joining(" or "));
    }

    /**
     * No alternative matched. Reported at the furthest position any attempt reached.
     * {@code actual} is empty at end of input.
     */
    record ParseSyntaxError(Set<String> expected, Option<Token> actual, SourceLocation location) implements ParseError {
        public ParseSyntaxError {
            expected = Collections.unmodifiableSet(new LinkedHashSet<>(expected));
        }

        @Override
        public String message() {
            var found = actual.map(token -> "'" + token.text() + "'")
                              .getOrElse("end of input");
            return "Unexpected " + found + " at " + location + ", expected " + describe(expected);
        }
    }

    /**
     * The entry rule matched but tokens remain.
     */
    record TrailingInputError(Token token, Set<String> expected) implements ParseError {
        public TrailingInputError {
            expected = Collections.unmodifiableSet(new LinkedHashSet<>(expected));
        }

        @Override
        public SourceLocation location() {
            return token.location();
        }

        @Override
        public String message() {
            var base = "Unexpected trailing input '" + token.text() + "' at " + token.location();
            return expected.isEmpty()
                   ? base
                   : base + ", expected " + describe(expected);
        }
    }

    record RecursionDepthExceededError(int limit, String rule, SourceLocation location) implements ParseError {
        @Override
        public String message() {
            return "Recursion depth limit of " + limit + " exceeded in rule '" + rule + "' at " + location;
        }
    }

    /**
     * Parsing was requested from a rule the parser does not have.
     */
    record UnknownRuleError(String name) implements ParseError {
        @Override
        public SourceLocation location() {
            return SourceLocation.START;
        }

        @Override
        public String message() {
            return "Unknown rule '" + name + "'";
        }
    }
}
