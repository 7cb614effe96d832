package org.pragmatica.ebnf.validation;

import io.vavr.control.Either;
import org.apache.logging.log4j.Level;
import org.junit.jupiter.api.Test;
import org.pragmatica.ebnf.error.GrammarError;
import org.pragmatica.ebnf.error.GrammarWarning;
import org.pragmatica.ebnf.grammar.GrammarLoader;
import org.pragmatica.ebnf.testsupport.LogCaptorAppender;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class GrammarValidatorTest {

    @Test
    void validate_wellFormedGrammar_succeedsWithoutWarnings() {
        var report = validate("""
            list = item , { "," , item } ;
            item = "a" | "b" ;
            """).get();

        assertEquals("list", report.entryRule());
        assertThat(report.warnings()).isEmpty();
    }

    @Test
    void validate_duplicateRule_fails() {
        var error = validate("a = \"x\" ; b = a ; a = \"y\" ;").getLeft();

        var duplicate = assertInstanceOf(GrammarError.DuplicateRuleError.class, error);
        assertEquals("a", duplicate.name());
        assertEquals(1, duplicate.span().start().line());
        assertEquals(19, duplicate.span().start().column());
    }

    @Test
    void validate_undefinedReference_namesBothRules() {
        var error = validate("a = b ; b = c , \"x\" ;").getLeft();

        var undefined = assertInstanceOf(GrammarError.UndefinedRuleError.class, error);
        assertEquals("c", undefined.name());
        assertEquals("b", undefined.referencingRule());
    }

    @Test
    void validate_duplicatesAreCheckedBeforeReferences() {
        var error = validate("a = missing ; a = \"x\" ;").getLeft();

        assertInstanceOf(GrammarError.DuplicateRuleError.class, error);
    }

    @Test
    void validate_missingEntryRule_fails() {
        var grammar = GrammarLoader.load("a = \"x\" ;").get().withEntryRule("start");

        var error = GrammarValidator.validate(grammar).getLeft();

        assertEquals("start", assertInstanceOf(GrammarError.MissingEntryRuleError.class, error).name());
    }

    @Test
    void validate_unreachableRule_warns() {
        var report = validate("a = \"x\" ; orphan = \"y\" ;").get();

        assertThat(report.warnings()).singleElement()
                                     .isInstanceOfSatisfying(GrammarWarning.UnreachableRuleWarning.class,
                                                             warning -> assertEquals("orphan", warning.name()));
    }

    @Test
    void validate_directLeftRecursion_reportsCycle() {
        var error = validate("e = e , \"+\" , \"x\" | \"x\" ;").getLeft();

        var recursion = assertInstanceOf(GrammarError.LeftRecursionError.class, error);
        assertEquals(List.of("e", "e"), recursion.cycle());
    }

    @Test
    void validate_indirectLeftRecursion_reportsWholeCycle() {
        var error = validate("""
            a = b , "x" ;
            b = [ "y" ] , c ;
            c = a | "z" ;
            """).getLeft();

        var recursion = assertInstanceOf(GrammarError.LeftRecursionError.class, error);
        assertEquals(List.of("a", "b", "c", "a"), recursion.cycle());
        assertEquals("Left recursion: a -> b -> c -> a", recursion.message());
    }

    @Test
    void validate_recursionAfterConsumedToken_isAccepted() {
        var result = validate("p = \"(\" , p , \")\" | \"x\" ;");

        assertTrue(result.isRight());
    }

    @Test
    void validate_repetitionOfNullableBody_fails() {
        var error = validate("""
            list = { item } ;
            item = [ "a" ] ;
            """).getLeft();

        assertEquals("list", assertInstanceOf(GrammarError.InfiniteLoopError.class, error).rule());
    }

    @Test
    void validate_overlappingAlternatives_warnsWithIndices() {
        var report = validate("""
            s = "a" , "b" | "c" | "a" , "c" ;
            """).get();

        var warning = assertInstanceOf(GrammarWarning.AmbiguityWarning.class, report.warnings().get(0));
        assertEquals("s", warning.rule());
        assertEquals(List.of(0, 2), warning.alternatives());
        assertThat(warning.overlap()).containsExactly("a");
    }

    @Test
    void validate_overlapInsideNestedChoice_warns() {
        var report = validate("s = \"x\" , ( \"a\" | \"a\" , \"b\" ) ;").get();

        assertThat(report.warnings()).hasSize(1)
                                     .allMatch(GrammarWarning.AmbiguityWarning.class::isInstance);
    }

    @Test
    void validate_failure_isLoggedAtDebug() {
        try (var appender = LogCaptorAppender.create(GrammarValidator.class, Level.DEBUG)) {
            validate("a = b ;");

            assertThat(appender.messages()).anyMatch(message -> message.contains("undefined rule 'b'"));
        }
    }

    private static Either<GrammarError, ValidationReport> validate(String text) {
        return GrammarValidator.validate(GrammarLoader.load(text).get());
    }
}
