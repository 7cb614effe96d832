package org.pragmatica.ebnf;

import io.vavr.control.Either;
import io.vavr.control.Option;
import org.pragmatica.ebnf.emitter.ParserEmitter;
import org.pragmatica.ebnf.error.GrammarError;
import org.pragmatica.ebnf.generator.ParserSourceGenerator;
import org.pragmatica.ebnf.grammar.Grammar;
import org.pragmatica.ebnf.grammar.GrammarLoader;
import org.pragmatica.ebnf.grammar.LeftRecursionRewriter;
import org.pragmatica.ebnf.model.ParserModelBuilder;
import org.pragmatica.ebnf.parser.Parser;
import org.pragmatica.ebnf.parser.ParserConfig;
import org.pragmatica.ebnf.validation.GrammarValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for creating parsers from EBNF grammars.
 *
 * <p>Example usage:
 * <pre>{@code
 * var parser = EbnfParser.fromGrammar("""
 *     sum = num , { "+" , num } ;
 *     num = "0" | "1" | "2" ;
 *     """).get();
 *
 * var tree = parser.parse("1 + 2");
 * }</pre>
 */
public final class EbnfParser {
    private static final Logger log = LoggerFactory.getLogger(EbnfParser.class);

    private EbnfParser() {}

    /**
     * Run the whole pipeline and keep the intermediate model and warnings.
     */
    public static Either<GrammarError, Compilation> compile(String grammarText) {
        return compile(grammarText, ParserConfig.DEFAULT);
    }

    public static Either<GrammarError, Compilation> compile(String grammarText, ParserConfig config) {
        return compile(grammarText, Option.none(), config);
    }

    /**
     * Create a parser from grammar text.
     */
    public static Either<GrammarError, Parser> fromGrammar(String grammarText) {
        return fromGrammar(grammarText, ParserConfig.DEFAULT);
    }

    /**
     * Create a parser from grammar text with custom configuration.
     */
    public static Either<GrammarError, Parser> fromGrammar(String grammarText, ParserConfig config) {
        return compile(grammarText, config).map(Compilation::parser);
    }

    /**
     * Generate standalone recognizer source code from grammar text.
     *
     * @param grammarText the EBNF grammar
     * @param packageName target package for generated class
     * @param className   name of generated class
     * @return generated Java source code, or error if grammar is invalid
     */
    public static Either<GrammarError, String> generateParser(String grammarText, String packageName, String className) {
        return compile(grammarText).map(compilation -> ParserSourceGenerator.create(compilation.model(),
                                                                                    packageName,
                                                                                    className)
                                                                            .generate());
    }

    /**
     * Create a builder for more complex parser configuration.
     */
    public static Builder builder(String grammarText) {
        return new Builder(grammarText);
    }

    private static Either<GrammarError, Compilation> compile(String grammarText,
                                                             Option<String> entryRule,
                                                             ParserConfig config) {
        var loaded = GrammarLoader.load(grammarText);
        if (loaded.isLeft()) {
            return Either.left(loaded.getLeft());
        }
        var grammar = entryRule.map(loaded.get()::withEntryRule)
                               .getOrElse(loaded.get());
        return compile(grammar, config);
    }

    private static Either<GrammarError, Compilation> compile(Grammar grammar, ParserConfig config) {
        var prepared = config.resolveLeftRecursion()
                       ? LeftRecursionRewriter.rewrite(grammar)
                       : grammar;
        var validated = GrammarValidator.validate(prepared);
        if (validated.isLeft()) {
            log.debug("Grammar rejected: {}", validated.getLeft().message());
            return Either.left(validated.getLeft());
        }
        var report = validated.get();
        report.warnings()
              .forEach(warning -> log.info("Grammar warning: {}", warning.message()));
        var model = ParserModelBuilder.build(report, config);
        var parser = ParserEmitter.emit(model, config);
        return Either.right(new Compilation(parser, model, report.warnings()));
    }

    public static final class Builder {
        private final String grammarText;
        private Option<String> entryRule = Option.none();
        private ParserConfig config = ParserConfig.DEFAULT;

        private Builder(String grammarText) {
            this.grammarText = grammarText;
        }

        public Builder entryRule(String name) {
            this.entryRule = Option.of(name);
            return this;
        }

        public Builder maxRecursionDepth(int depth) {
            this.config = config.withMaxRecursionDepth(depth);
            return this;
        }

        public Builder packrat(boolean enabled) {
            this.config = config.withPackrat(enabled);
            return this;
        }

        public Builder predictive(boolean enabled) {
            this.config = config.withPredictiveDispatch(enabled);
            return this;
        }

        public Builder resolveLeftRecursion(boolean enabled) {
            this.config = config.withLeftRecursionRewrite(enabled);
            return this;
        }

        public Either<GrammarError, Compilation> compile() {
            return EbnfParser.compile(grammarText, entryRule, config);
        }

        public Either<GrammarError, Parser> build() {
            return compile().map(Compilation::parser);
        }
    }
}
