package org.pragmatica.ebnf.grammar;

import io.vavr.control.Either;
import org.pragmatica.ebnf.error.GrammarError;
import org.pragmatica.ebnf.error.GrammarError.GrammarSyntaxError;
import org.pragmatica.ebnf.tree.SourceLocation;
import org.pragmatica.ebnf.tree.SourceSpan;

import java.util.ArrayList;
import java.util.List;

/**
 * Recursive-descent loader for EBNF grammar text.
 *
 * <pre>
 * grammar     = rule , { rule } ;
 * rule        = identifier , "=" , rhs , ";" ;
 * rhs         = alternative , { "|" , alternative } ;
 * alternative = term , { "," , term } ;
 * term        = factor , [ "-" , factor ] ;
 * factor      = literal | identifier | "(" , rhs , ")" | "[" , rhs , "]" | "{" , rhs , "}" , [ "-" ] ;
 * </pre>
 *
 * The first malformed construct aborts loading; there is no recovery.
 */
public final class GrammarLoader {

    private final List<GrammarToken> tokens;
    private int pos;

    private GrammarLoader(List<GrammarToken> tokens) {
        this.tokens = tokens;
        this.pos = 0;
    }

    /**
     * Parse grammar text into a Grammar.
     */
    public static Either<GrammarError, Grammar> load(String grammarText) {
        var tokens = GrammarLexer.tokenize(grammarText);

        for (var token : tokens) {
            if (token instanceof GrammarToken.Error error) {
                return Either.left(new GrammarSyntaxError(error.span()
                                                               .start(),
                                                          error.expected(),
                                                          error.found()));
            }
        }
        return new GrammarLoader(tokens).loadGrammar();
    }

    private Either<GrammarError, Grammar> loadGrammar() {
        var rules = new ArrayList<GrammarRule>();

        while (!(peek() instanceof GrammarToken.Eof)) {
            var rule = loadRule();
            if (rule.isLeft()) {
                return Either.left(rule.getLeft());
            }
            rules.add(rule.get());
        }
        if (rules.isEmpty()) {
            return fail("rule definition");
        }
        return Either.right(Grammar.of(rules));
    }

    private Either<GrammarError, GrammarRule> loadRule() {
        var start = peek().span()
                          .start();
        if (!(peek() instanceof GrammarToken.Identifier id)) {
            return fail("rule name");
        }
        advance();

        if (!(peek() instanceof GrammarToken.Equals)) {
            return fail("'='");
        }
        advance();

        var rhs = loadRhs();
        if (rhs.isLeft()) {
            return Either.left(rhs.getLeft());
        }

        if (!(peek() instanceof GrammarToken.Semicolon)) {
            return fail("',', '|' or ';'");
        }
        advance();

        return Either.right(new GrammarRule(spanFrom(start), id.name(), rhs.get()));
    }

    private Either<GrammarError, List<Alternative>> loadRhs() {
        var alternatives = new ArrayList<Alternative>();

        var first = loadAlternative();
        if (first.isLeft()) {
            return Either.left(first.getLeft());
        }
        alternatives.add(first.get());

        while (peek() instanceof GrammarToken.Pipe) {
            advance();
            var next = loadAlternative();
            if (next.isLeft()) {
                return Either.left(next.getLeft());
            }
            alternatives.add(next.get());
        }
        return Either.right(alternatives);
    }

    private Either<GrammarError, Alternative> loadAlternative() {
        var start = peek().span()
                          .start();
        var terms = new ArrayList<Term>();

        var first = loadTerm();
        if (first.isLeft()) {
            return Either.left(first.getLeft());
        }
        terms.add(first.get());

        while (peek() instanceof GrammarToken.Comma) {
            advance();
            var next = loadTerm();
            if (next.isLeft()) {
                return Either.left(next.getLeft());
            }
            terms.add(next.get());
        }
        return Either.right(new Alternative(spanFrom(start), terms));
    }

    private Either<GrammarError, Term> loadTerm() {
        var start = peek().span()
                          .start();
        var base = loadFactor();
        if (base.isLeft() || !(peek() instanceof GrammarToken.Minus)) {
            return base;
        }
        advance();

        var excluded = loadFactor();
        if (excluded.isLeft()) {
            return excluded;
        }
        return Either.right(new Term.Exception(spanFrom(start), base.get(), excluded.get()));
    }

    private Either<GrammarError, Term> loadFactor() {
        var token = peek();
        var start = token.span()
                         .start();

        if (token instanceof GrammarToken.Literal literal) {
            advance();
            return Either.right(new Term.Literal(literal.span(), literal.text()));
        }
        if (token instanceof GrammarToken.Identifier id) {
            advance();
            return Either.right(new Term.NonterminalRef(id.span(), id.name()));
        }
        if (token instanceof GrammarToken.LParen) {
            advance();
            return loadGroup(start, GrammarToken.RParen.class, "')'")
                .map(alternatives -> Term.group(spanFrom(start), alternatives));
        }
        if (token instanceof GrammarToken.LBracket) {
            advance();
            return loadGroup(start, GrammarToken.RBracket.class, "']'")
                .map(alternatives -> new Term.Optional(spanFrom(start), Term.group(spanFrom(start), alternatives)));
        }
        if (token instanceof GrammarToken.LBrace) {
            advance();
            var body = loadGroup(start, GrammarToken.RBrace.class, "'}'");
            if (body.isLeft()) {
                return Either.left(body.getLeft());
            }
            boolean oneOrMore = isOneOrMoreMarker();
            if (oneOrMore) {
                advance();
            }
            var span = spanFrom(start);
            return Either.right(new Term.Repetition(span, Term.group(span, body.get()), !oneOrMore));
        }
        return fail("literal, rule name, '(', '[' or '{'");
    }

    private Either<GrammarError, List<Alternative>> loadGroup(SourceLocation start,
                                                            Class<? extends GrammarToken> closing,
                                                            String closingText) {
        var rhs = loadRhs();
        if (rhs.isLeft()) {
            return rhs;
        }
        if (!closing.isInstance(peek())) {
            return fail("',', '|' or " + closingText);
        }
        advance();
        return rhs;
    }

    /**
     * {@code }-} marks one-or-more only when the minus is not the start of an exception,
     * i.e. when it is followed by something that ends a term.
     */
    private boolean isOneOrMoreMarker() {
        if (!(peek() instanceof GrammarToken.Minus)) {
            return false;
        }
        var next = peekAhead(1);
        return next instanceof GrammarToken.Comma
               || next instanceof GrammarToken.Pipe
               || next instanceof GrammarToken.Semicolon
               || next instanceof GrammarToken.RParen
               || next instanceof GrammarToken.RBracket
               || next instanceof GrammarToken.RBrace
               || next instanceof GrammarToken.Eof;
    }

    private <T> Either<GrammarError, T> fail(String expected) {
        var token = peek();
        return Either.left(new GrammarSyntaxError(token.span()
                                                       .start(),
                                                  expected,
                                                  tokenDescription(token)));
    }

    private GrammarToken peek() {
        return tokens.get(pos);
    }

    private GrammarToken peekAhead(int offset) {
        return tokens.get(Math.min(pos + offset, tokens.size() - 1));
    }

    private void advance() {
        if (pos < tokens.size() - 1) {
            pos++;
        }
    }

    private SourceSpan spanFrom(SourceLocation start) {
        var previous = tokens.get(Math.max(0, pos - 1));
        return SourceSpan.of(start, previous.span()
                                            .end());
    }

    private String tokenDescription(GrammarToken token) {
        if (token instanceof GrammarToken.Identifier id) {
            return "identifier '" + id.name() + "'";
        }
        if (token instanceof GrammarToken.Literal literal) {
            return "literal \"" + literal.text() + "\"";
        }
        if (token instanceof GrammarToken.Eof) {
            return "end of input";
        }
        if (token instanceof GrammarToken.Equals) {
            return "'='";
        }
        if (token instanceof GrammarToken.Comma) {
            return "','";
        }
        if (token instanceof GrammarToken.Pipe) {
            return "'|'";
        }
        if (token instanceof GrammarToken.Semicolon) {
            return "';'";
        }
        if (token instanceof GrammarToken.Minus) {
            return "'-'";
        }
        if (token instanceof GrammarToken.LParen) {
            return "'('";
        }
        if (token instanceof GrammarToken.RParen) {
            return "')'";
        }
        if (token instanceof GrammarToken.LBracket) {
            return "'['";
        }
        if (token instanceof GrammarToken.RBracket) {
            return "']'";
        }
        if (token instanceof GrammarToken.LBrace) {
            return "'{'";
        }
        if (token instanceof GrammarToken.RBrace) {
            return "'}'";
        }
        return token.toString();
    }
}
