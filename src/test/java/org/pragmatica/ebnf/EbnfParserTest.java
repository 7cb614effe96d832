package org.pragmatica.ebnf;

import org.apache.logging.log4j.Level;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.pragmatica.ebnf.error.GrammarError;
import org.pragmatica.ebnf.error.GrammarWarning;
import org.pragmatica.ebnf.error.ParseError;
import org.pragmatica.ebnf.lexer.TokenStream;
import org.pragmatica.ebnf.parser.Parser;
import org.pragmatica.ebnf.parser.ParserConfig;
import org.pragmatica.ebnf.testsupport.LogCaptorAppender;
import org.pragmatica.ebnf.testsupport.TestGrammars;
import org.pragmatica.ebnf.tree.SourceLocation;
import org.pragmatica.ebnf.tree.SyntaxElement;
import org.pragmatica.ebnf.tree.SyntaxNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class EbnfParserTest {

    private static Compilation sml;
    private static Parser parser;

    @BeforeAll
    static void compileSampleGrammar() {
        var result = EbnfParser.compile(TestGrammars.standardMl());
        assertTrue(result.isRight(), () -> result.getLeft().message());
        sml = result.get();
        parser = sml.parser();
    }

    // === Sample grammar ===

    @Test
    void sampleGrammar_hasOneAmbiguityWarning() {
        assertThat(sml.warnings()).singleElement()
                                  .isInstanceOfSatisfying(GrammarWarning.AmbiguityWarning.class, warning -> {
                                      assertEquals("constant", warning.rule());
                                      assertEquals(List.of(0, 1), warning.alternatives());
                                      assertThat(warning.overlap()).contains("-", "0", "9");
                                  });
    }

    @Test
    void valueDeclaration_buildsExpectedTree() {
        var tree = parser.parse("val x -42").get();

        assertEquals("dec", tree.tag());
        assertEquals(4, tree.children().size());
        assertEquals("val", assertInstanceOf(SyntaxElement.TokenLeaf.class, tree.children().get(0)).token().text());
        assertEquals("x", tree.child("var").get().text());
        assertFalse(assertInstanceOf(SyntaxElement.OptionalMatch.class, tree.children().get(2)).isPresent());
        var constant = tree.child("constant").get();
        assertEquals("-42", constant.child("int").get().compactText());
    }

    @Test
    void ambiguousConstant_prefersFirstMatchingAlternative() {
        var real = parser.parse("val x 3.25").get().child("constant").get();
        var integer = parser.parse("val x 325").get().child("constant").get();

        assertEquals("real", real.childNodes().get(0).tag());
        assertEquals("int", integer.childNodes().get(0).tag());
    }

    @Test
    void functionType_associatesToTheRight() {
        var typ = parser.parse("type t = a -> b -> c").get().child("typ").get();

        // a -> (b -> c): the outer typ holds "a" and one iteration whose typ holds "b -> c"
        assertEquals("a", typ.childNodes().get(0).text());
        var inner = typ.childNodes().get(1);
        assertEquals("typ", inner.tag());
        assertEquals("b -> c", inner.text());
    }

    @Test
    void datatypeDeclaration_parses() {
        var tree = parser.parse("datatype shape = Circle of real | Square of real | Dot").get();

        var conbind = tree.child("conbind").get();
        assertThat(conbind.childNodes()).extracting(SyntaxNode::tag)
                                        .containsExactly("var", "typ", "var", "typ", "var");
    }

    @Test
    void invalidStart_failsAtFirstToken() {
        var error = parser.parse("9x").getLeft();

        var syntax = assertInstanceOf(ParseError.ParseSyntaxError.class, error);
        assertEquals(SourceLocation.START, syntax.location());
        assertThat(syntax.expected()).containsExactlyInAnyOrder("val", "type", "datatype");
        assertEquals("9", syntax.actual().get().text());
    }

    @Test
    void leftoverTokens_areTrailingInput() {
        var error = parser.parse("val x 1 y").getLeft();

        var trailing = assertInstanceOf(ParseError.TrailingInputError.class, error);
        assertEquals("y", trailing.token().text());
        assertEquals(9, trailing.location().column());
        assertThat(trailing.expected()).contains(".");
    }

    @Test
    void leftoverTokens_afterCommittedChoice_expectEndOfInput() {
        var compilation = EbnfParser.compile("a = \"x\" | \"x\" , \"y\" ;").get();

        var error = compilation.parser()
                               .parse("x y")
                               .getLeft();

        var trailing = assertInstanceOf(ParseError.TrailingInputError.class, error);
        assertEquals("y", trailing.token().text());
        assertEquals(Set.of("<EOF>"), trailing.expected());
        assertTrue(compilation.hasWarnings());
    }

    @Test
    void unambiguousGrammar_hasNoWarnings() {
        var compilation = EbnfParser.compile("s = \"a\" , [ \"b\" ] ;").get();

        assertFalse(compilation.hasWarnings());
        assertTrue(sml.hasWarnings());
    }

    @Test
    void parseFromNamedRule() {
        var tree = parser.parse("'a -> (b -> c)", "typ").get();

        assertEquals("typ", tree.tag());
        assertInstanceOf(ParseError.UnknownRuleError.class, parser.parse("x", "nothing").getLeft());
    }

    @Test
    void parseExplicitTokenStream() {
        var tree = parser.parse(TokenStream.ofTexts("val", "x", "1")).get();

        assertEquals("1", tree.child("constant").get().text());
    }

    @Test
    void depthLimit_stopsRunawayNesting() {
        var shallow = EbnfParser.builder(TestGrammars.standardMl())
                                .maxRecursionDepth(12)
                                .build()
                                .get();
        var input = "type t = " + "(".repeat(10) + "a" + ")".repeat(10);

        var error = shallow.parse(input).getLeft();

        assertInstanceOf(ParseError.RecursionDepthExceededError.class, error);
        assertTrue(parser.parse(input).isRight());
    }

    @Test
    void parser_isSafeToShareBetweenThreads() throws Exception {
        var inputs = List.of("val x -42", "type t = a -> b", "datatype c = A | B of d", "val y 1.5", "9x");
        var expected = inputs.stream()
                             .map(parser::parse)
                             .toList();
        var pool = Executors.newFixedThreadPool(8);
        try {
            var tasks = new ArrayList<Callable<Boolean>>();
            for (int i = 0; i < 200; i++) {
                int index = i % inputs.size();
                tasks.add(() -> parser.parse(inputs.get(index)).equals(expected.get(index)));
            }
            for (var future : pool.invokeAll(tasks)) {
                assertTrue(future.get());
            }
        } finally {
            pool.shutdown();
            assertTrue(pool.awaitTermination(10, TimeUnit.SECONDS));
        }
    }

    // === Pipeline ===

    @Test
    void builder_entryRule_overridesFirstRule() {
        var typParser = EbnfParser.builder(TestGrammars.standardMl())
                                  .entryRule("typ")
                                  .build()
                                  .get();

        assertEquals("typ", typParser.entryRule());
        assertTrue(typParser.parse("a -> b").isRight());
    }

    @Test
    void builder_missingEntryRule_fails() {
        var error = EbnfParser.builder("s = \"a\" ;").entryRule("start").compile().getLeft();

        assertInstanceOf(GrammarError.MissingEntryRuleError.class, error);
    }

    @Test
    void leftRecursion_withoutRewrite_isRejected() {
        var grammar = "e = e , \"+\" , n | n ; n = \"1\" ;";

        var error = EbnfParser.builder(grammar).resolveLeftRecursion(false).build().getLeft();

        assertInstanceOf(GrammarError.LeftRecursionError.class, error);
        assertTrue(EbnfParser.fromGrammar(grammar).isRight());
    }

    @Test
    void configOptions_doNotChangeResults() {
        var plain = EbnfParser.builder(TestGrammars.standardMl())
                              .packrat(false)
                              .predictive(false)
                              .build()
                              .get();

        for (var input : List.of("val x -42", "type ('a, 'b) p = ('a -> 'b) -> c", "val x 1 y", "9x")) {
            assertEquals(parser.parse(input), plain.parse(input), input);
        }
    }

    @Test
    void fromGrammar_invalidGrammar_reportsFirstError() {
        var error = EbnfParser.fromGrammar("a = b ; a = \"x\" ;").getLeft();

        assertInstanceOf(GrammarError.DuplicateRuleError.class, error);
    }

    @Test
    void generateParser_producesJavaSource() {
        var source = EbnfParser.generateParser(TestGrammars.standardMl(), "com.example", "SmlParser").get();

        assertThat(source).contains("public final class SmlParser")
                          .contains("private static boolean rule_dec(State s)");
    }

    @Test
    void parserConfig_rejectsNonPositiveDepth() {
        assertThrows(IllegalArgumentException.class, () -> ParserConfig.DEFAULT.withMaxRecursionDepth(0));
    }

    // === Logging ===

    @Test
    void compile_logsWarningsAtInfo() {
        try (var appender = LogCaptorAppender.create(EbnfParser.class, Level.INFO)) {
            EbnfParser.compile("s = \"a\" | \"a\" , \"b\" ; unused = \"c\" ;");

            assertThat(appender.messages()).hasSize(2)
                                           .anyMatch(message -> message.contains("unused"));
            assertThat(appender.levels()).containsOnly(Level.INFO);
        }
    }
}
