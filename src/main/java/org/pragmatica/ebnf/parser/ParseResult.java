package org.pragmatica.ebnf.parser;

import org.pragmatica.ebnf.error.ParseError;
import org.pragmatica.ebnf.tree.SyntaxElement;

/**
 * Result of running one procedure - success with an element, failure, or an abort that
 * unwinds the whole parse.
 */
public sealed interface ParseResult {

    boolean isSuccess();

    static ParseResult success(SyntaxElement element) {
        return new Success(element);
    }

    static ParseResult failure(int position) {
        return new Failure(position);
    }

    /**
     * Successful match; the cursor has moved past the matched tokens.
     */
    record Success(SyntaxElement element) implements ParseResult {
        @Override
        public boolean isSuccess() {
            return true;
        }
    }

    /**
     * No match at {@code position}; the cursor is back at {@code position}. What was expected is
     * tracked by the furthest-failure state of the parsing context.
     */
    record Failure(int position) implements ParseResult {
        @Override
        public boolean isSuccess() {
            return false;
        }
    }

    /**
     * Unrecoverable error, e.g. recursion depth exceeded. Prevents trying other alternatives.
     */
    record Abort(ParseError error) implements ParseResult {
        @Override
        public boolean isSuccess() {
            return false;
        }
    }
}
