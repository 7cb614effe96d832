package org.pragmatica.ebnf.parser;

/**
 * Compiled parsing step. Stateless; all per-parse state lives in the context.
 */
@FunctionalInterface
public interface Procedure {
    ParseResult parse(ParsingContext ctx);
}
