package org.pragmatica.ebnf.grammar;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

class GrammarPrinterTest {

    @Test
    void print_rule_usesCanonicalLayout() {
        var grammar = GrammarLoader.load("r=\"a\",b|[c];b=\"b\";c=\"c\";").get();

        assertEquals("r = \"a\" , b | [ c ] ;", GrammarPrinter.print(grammar.rules().get(0)));
    }

    @Test
    void print_literalWithDoubleQuote_usesSingleQuotes() {
        var grammar = GrammarLoader.load("s = '\"' ;").get();

        assertEquals("s = '\"' ;", GrammarPrinter.print(grammar.rules().get(0)));
    }

    @Test
    void print_exceptionOfOneOrMore_keepsGrouping() {
        var grammar = GrammarLoader.load("r = ( { \"a\" }- ) - \"a\" ;").get();

        assertEquals("r = ( { \"a\" }- ) - \"a\" ;", GrammarPrinter.print(grammar.rules().get(0)));
    }

    @ParameterizedTest
    @ValueSource(strings = {
        "r = \"a\" , { \"b\" | \"c\" } , [ \"d\" , \"e\" ] ;",
        "r = ( \"a\" | \"b\" ) , ( \"c\" , \"d\" ) ;",
        "r = { \"a\" }- , x - \"b\" ; x = \"a\" | \"b\" ;",
        "r = '\"' , { \"x\" } - ( \"x\" , \"x\" ) ;"
    })
    void print_thenLoad_printsIdentically(String text) {
        var printed = GrammarPrinter.print(GrammarLoader.load(text).get());
        var reloaded = GrammarLoader.load(printed);

        assertTrue(reloaded.isRight(), printed);
        assertEquals(printed, GrammarPrinter.print(reloaded.get()));
    }
}
