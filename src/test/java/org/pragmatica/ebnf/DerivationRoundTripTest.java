package org.pragmatica.ebnf;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.pragmatica.ebnf.lexer.TokenStream;
import org.pragmatica.ebnf.testsupport.SentenceGenerator;
import org.pragmatica.ebnf.testsupport.TestGrammars;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Every sentence derived from a rule parses back from that rule, and the tree covers exactly the
 * derived tokens.
 */
class DerivationRoundTripTest {

    private static final String STATEMENTS = """
        program = stmt , { ";" , stmt } ;
        stmt    = "let" , name , "=" , expr | "print" , expr ;
        expr    = term , { ( "+" | "-" ) , term } ;
        term    = factor , { "*" , factor } ;
        factor  = num | name | "(" , expr , ")" ;
        num     = digit , { digit } ;
        name    = "x" | "y" | "z" ;
        digit   = "0" | "1" | "2" ;
        """;

    @ParameterizedTest
    @CsvSource({
        "statements, program",
        "standard_ml, typ",
        "standard_ml, constant",
        "standard_ml, longvar"
    })
    void derivedSentences_parseBack(String grammarName, String rule) {
        var text = grammarName.equals("statements")
                   ? STATEMENTS
                   : TestGrammars.load(grammarName + ".ebnf");
        var compilation = EbnfParser.compile(text).get();
        var generator = new SentenceGenerator(compilation.model(), 20240917L, 6);

        for (int i = 0; i < 200; i++) {
            var tokens = generator.sentence(rule);
            var result = compilation.parser().parse(TokenStream.ofTexts(tokens), rule);

            assertTrue(result.isRight(), () -> tokens + " -> " + result.getLeft().message());
            assertEquals(String.join(" ", tokens), result.get().text());
            assertEquals(rule, result.get().tag());
        }
    }
}
