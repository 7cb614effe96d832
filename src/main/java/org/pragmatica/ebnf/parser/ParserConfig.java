package org.pragmatica.ebnf.parser;

/**
 * Parser configuration options.
 *
 * @param maxRecursionDepth    deepest allowed nesting of rule invocations in one parse
 * @param packratEnabled       memoize rule results per position within one parse
 * @param predictiveDispatch   select alternatives by lookahead where FIRST sets are disjoint
 * @param resolveLeftRecursion rewrite directly left-recursive rules into iteration before validation
 */
public record ParserConfig(
    int maxRecursionDepth,
    boolean packratEnabled,
    boolean predictiveDispatch,
    boolean resolveLeftRecursion
) {
    public static final ParserConfig DEFAULT = new ParserConfig(
        256,
        true,
        true,
        true
    );

    public ParserConfig {
        if (maxRecursionDepth < 1) {
            throw new IllegalArgumentException("maxRecursionDepth must be positive, got " + maxRecursionDepth);
        }
    }

    public ParserConfig withMaxRecursionDepth(int depth) {
        return new ParserConfig(depth, packratEnabled, predictiveDispatch, resolveLeftRecursion);
    }

    public ParserConfig withPackrat(boolean enabled) {
        return new ParserConfig(maxRecursionDepth, enabled, predictiveDispatch, resolveLeftRecursion);
    }

    public ParserConfig withPredictiveDispatch(boolean enabled) {
        return new ParserConfig(maxRecursionDepth, packratEnabled, enabled, resolveLeftRecursion);
    }

    public ParserConfig withLeftRecursionRewrite(boolean enabled) {
        return new ParserConfig(maxRecursionDepth, packratEnabled, predictiveDispatch, enabled);
    }
}
