package org.pragmatica.ebnf.analysis;

import org.junit.jupiter.api.Test;
import org.pragmatica.ebnf.grammar.Grammar;
import org.pragmatica.ebnf.grammar.GrammarLoader;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class GrammarAnalysisTest {

    private static final String EXPRESSIONS = """
        expr   = term , { "+" , term } ;
        term   = factor , { "*" , factor } ;
        factor = "(" , expr , ")" | num ;
        num    = [ "-" ] , digit ;
        digit  = "0" | "1" ;
        """;

    @Test
    void first_followsNullablePrefixes() {
        var analysis = analyze(EXPRESSIONS);

        assertThat(analysis.first("num")).containsExactlyInAnyOrder("-", "0", "1");
        assertThat(analysis.first("expr")).containsExactlyInAnyOrder("(", "-", "0", "1");
    }

    @Test
    void follow_includesEndOfInputForEntryRule() {
        var analysis = analyze(EXPRESSIONS);

        assertThat(analysis.follow("expr")).containsExactlyInAnyOrder(GrammarAnalysis.END_OF_INPUT, ")");
    }

    @Test
    void follow_throughRepetitions_includesLoopStartAndOuterFollow() {
        var analysis = analyze(EXPRESSIONS);

        assertThat(analysis.follow("term")).containsExactlyInAnyOrder("+", ")", GrammarAnalysis.END_OF_INPUT);
        assertThat(analysis.follow("factor")).containsExactlyInAnyOrder("*", "+", ")", GrammarAnalysis.END_OF_INPUT);
    }

    @Test
    void follow_afterNullableSuffix_includesRuleFollow() {
        var analysis = analyze("""
            s = a , [ "x" ] , "y" ;
            a = "a" ;
            """);

        assertThat(analysis.follow("a")).containsExactlyInAnyOrder("x", "y");
    }

    @Test
    void nullable_propagatesThroughReferences() {
        var analysis = analyze("""
            a = b , c ;
            b = [ "b" ] ;
            c = { "c" } ;
            d = "d" | b ;
            e = { "e" }- ;
            """);

        assertTrue(analysis.nullable("a"));
        assertTrue(analysis.nullable("d"));
        assertFalse(analysis.nullable("e"));
    }

    @Test
    void leftReferences_stopAtFirstConsumingTerm() {
        var analysis = analyze("""
            a = [ b ] , c , d ;
            b = "b" ;
            c = "c" ;
            d = "d" ;
            """);

        assertThat(analysis.leftReferences("a")).containsExactly("b", "c");
    }

    @Test
    void leftReferences_includeExcludedTerm() {
        var analysis = analyze("""
            a = b - c ;
            b = "x" ;
            c = "x" ;
            """);

        assertThat(analysis.leftReferences("a")).containsExactly("b", "c");
    }

    @Test
    void analyze_recursiveGrammar_reachesFixedPoint() {
        var analysis = analyze(EXPRESSIONS);

        assertThat(analysis.firstPasses()).isGreaterThanOrEqualTo(2);
        assertThat(analysis.followPasses()).isGreaterThanOrEqualTo(2);
    }

    @Test
    void analyze_undefinedReference_isTreatedAsEmpty() {
        var analysis = analyze("a = missing , \"x\" ;");

        assertThat(analysis.first("a")).isEmpty();
        assertFalse(analysis.nullable("missing"));
    }

    private static GrammarAnalysis analyze(String text) {
        Grammar grammar = GrammarLoader.load(text).get();
        return GrammarAnalysis.analyze(grammar);
    }
}
