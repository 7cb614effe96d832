package org.pragmatica.ebnf.error;

/**
 * Base of all reported problems: compile-time errors, warnings and parse errors.
 */
public interface Problem {
    String message();
}
