package org.pragmatica.ebnf.grammar;

import org.apache.logging.log4j.Level;
import org.junit.jupiter.api.Test;
import org.pragmatica.ebnf.testsupport.LogCaptorAppender;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class LeftRecursionRewriterTest {

    @Test
    void rewrite_directLeftRecursion_becomesIteration() {
        var grammar = rewrite("expr = expr , \"+\" , term | term ; term = \"x\" ;");

        assertEquals("expr = term , { \"+\" , term } ;", GrammarPrinter.print(grammar.rules().get(0)));
    }

    @Test
    void rewrite_severalSeedsAndTails_groupsEach() {
        var grammar = rewrite("e = e , \"+\" , a | e , \"-\" , a | a | \"(\" , e , \")\" ; a = \"x\" ;");

        assertEquals("e = ( a | \"(\" , e , \")\" ) , { \"+\" , a | \"-\" , a } ;",
                     GrammarPrinter.print(grammar.rules().get(0)));
    }

    @Test
    void rewrite_recursionInsideLeadingGroup_isFound() {
        var grammar = rewrite("typ = v | ( typ , \"->\" , typ ) ; v = \"a\" ;");

        assertEquals("typ = v , { \"->\" , typ } ;", GrammarPrinter.print(grammar.rules().get(0)));
    }

    @Test
    void rewrite_withoutSeed_leavesRuleForValidator() {
        var source = load("r = r , \"a\" ;");

        assertEquals(source.rules(), LeftRecursionRewriter.rewrite(source).rules());
    }

    @Test
    void rewrite_nullableTail_leavesRule() {
        var source = load("r = r , [ \"a\" ] | \"b\" ;");

        assertEquals(source.rules(), LeftRecursionRewriter.rewrite(source).rules());
    }

    @Test
    void rewrite_indirectRecursion_leavesRules() {
        var source = load("a = b , \"x\" | \"y\" ; b = a , \"z\" ;");

        assertEquals(source.rules(), LeftRecursionRewriter.rewrite(source).rules());
    }

    @Test
    void rewrite_logsRewrittenRule() {
        try (var appender = LogCaptorAppender.create(LeftRecursionRewriter.class, Level.INFO)) {
            rewrite("l = l , \",\" , i | i ; i = \"i\" ;");

            assertThat(appender.messages()).anyMatch(message -> message.contains("'l'")
                                                                && message.contains("l = i , { \",\" , i } ;"));
        }
    }

    private static Grammar rewrite(String text) {
        return LeftRecursionRewriter.rewrite(load(text));
    }

    private static Grammar load(String text) {
        return GrammarLoader.load(text).get();
    }
}
