package org.pragmatica.ebnf.parser;

import io.vavr.control.Option;
import org.pragmatica.ebnf.lexer.Token;
import org.pragmatica.ebnf.lexer.TokenStream;
import org.pragmatica.ebnf.tree.SourceLocation;
import org.pragmatica.ebnf.tree.SourceSpan;

import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Mutable state of one parse call: cursor, recursion depth, furthest failure and packrat cache.
 * Never shared between calls or threads.
 */
public final class ParsingContext {

    /**
     * Memoized rule outcome and the position after it.
     */
    public record Memo(ParseResult result, int end) {}

    private final TokenStream tokens;
    private final RuleTable rules;
    private final ParserConfig config;
    private final Map<Long, Memo> packratCache;

    private int pos;
    private int depth;
    private int peakDepth;
    private int innermostRule;
    private int furthestPos;
    private final Set<String> furthestExpected;
    private int muted;

    private ParsingContext(TokenStream tokens, RuleTable rules, ParserConfig config) {
        this.tokens = tokens;
        this.rules = rules;
        this.config = config;
        this.packratCache = config.packratEnabled() ? new HashMap<>() : null;
        this.furthestExpected = new LinkedHashSet<>();
        this.pos = 0;
        this.depth = 0;
        this.innermostRule = -1;
        this.furthestPos = 0;
    }

    public static ParsingContext create(TokenStream tokens, RuleTable rules, ParserConfig config) {
        return new ParsingContext(tokens, rules, config);
    }

    // === Position Management ===

    public int pos() {
        return pos;
    }

    public void setPos(int pos) {
        this.pos = pos;
    }

    public boolean isAtEnd() {
        return pos >= tokens.size();
    }

    public SourceLocation location() {
        return tokens.locationAt(pos);
    }

    // === Token Access ===

    public Option<Token> peek() {
        return tokens.at(pos);
    }

    public boolean nextIs(String text) {
        return !isAtEnd() && tokens.get(pos)
                                   .text()
                                   .equals(text);
    }

    /**
     * Is the next token one of the texts? False at end of input.
     */
    public boolean nextIn(Set<String> texts) {
        return !isAtEnd() && texts.contains(tokens.get(pos)
                                                  .text());
    }

    public Token advance() {
        return tokens.get(pos++);
    }

    /**
     * Span from the token at {@code start} to the end of the last consumed token.
     */
    public SourceSpan spanFrom(int start) {
        var startLocation = tokens.locationAt(start);
        if (pos <= start) {
            return SourceSpan.at(startLocation);
        }
        return SourceSpan.of(startLocation, tokens.get(pos - 1)
                                                  .span()
                                                  .end());
    }

    // === Recursion Depth ===

    public int depth() {
        return depth;
    }

    public void enterRule(int ruleIndex) {
        depth++;
        peakDepth = Math.max(peakDepth, depth);
        innermostRule = ruleIndex;
    }

    public void exitRule() {
        depth--;
    }

    /**
     * Deepest rule nesting reached so far in this call.
     */
    public int peakDepth() {
        return peakDepth;
    }

    /**
     * Index of the rule entered most recently, or -1 before the first rule.
     */
    public int innermostRule() {
        return innermostRule;
    }

    // === Error Tracking ===

    /**
     * Record that one of the texts was expected at the current position.
     * Only the furthest position reached keeps its expectations.
     */
    public void expected(Collection<String> texts) {
        if (muted > 0 || texts.isEmpty()) {
            return;
        }
        if (pos > furthestPos) {
            furthestPos = pos;
            furthestExpected.clear();
        }
        if (pos == furthestPos) {
            furthestExpected.addAll(texts);
        }
    }

    public void expected(String text) {
        expected(Set.of(text));
    }

    public int furthestPos() {
        return furthestPos;
    }

    /**
     * Expected texts recorded at the furthest position, in recording order.
     */
    public Set<String> furthestExpected() {
        return Collections.unmodifiableSet(new LinkedHashSet<>(furthestExpected));
    }

    public Option<Token> furthestToken() {
        return tokens.at(furthestPos);
    }

    public SourceLocation furthestLocation() {
        return tokens.locationAt(furthestPos);
    }

    /**
     * Run a lookahead procedure without recording expectations. The cursor is left where the
     * procedure stopped; callers restore it.
     */
    public ParseResult probe(Procedure procedure) {
        muted++;
        try {
            return procedure.parse(this);
        } finally {
            muted--;
        }
    }

    public boolean isProbing() {
        return muted > 0;
    }

    // === Packrat Cache ===

    public Option<Memo> cached(int ruleIndex, int position) {
        if (packratCache == null || muted > 0) {
            return Option.none();
        }
        return Option.of(packratCache.get(packratKey(ruleIndex, position)));
    }

    public void cache(int ruleIndex, int position, ParseResult result, int end) {
        if (packratCache != null && muted == 0) {
            packratCache.put(packratKey(ruleIndex, position), new Memo(result, end));
        }
    }

    private static long packratKey(int ruleIndex, int position) {
        return ((long) ruleIndex << 32) | (position & 0xFFFFFFFFL);
    }

    // === Accessors ===

    public TokenStream tokens() {
        return tokens;
    }

    public RuleTable rules() {
        return rules;
    }

    public ParserConfig config() {
        return config;
    }
}
