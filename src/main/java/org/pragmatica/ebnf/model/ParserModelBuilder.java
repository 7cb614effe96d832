package org.pragmatica.ebnf.model;

import io.vavr.control.Either;
import org.pragmatica.ebnf.analysis.GrammarAnalysis;
import org.pragmatica.ebnf.error.GrammarError;
import org.pragmatica.ebnf.error.GrammarWarning;
import org.pragmatica.ebnf.grammar.Alternative;
import org.pragmatica.ebnf.grammar.Grammar;
import org.pragmatica.ebnf.grammar.GrammarRule;
import org.pragmatica.ebnf.grammar.Term;
import org.pragmatica.ebnf.parser.ParserConfig;
import org.pragmatica.ebnf.validation.GrammarValidator;
import org.pragmatica.ebnf.validation.ValidationReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns a validated grammar into a {@link ParserModel}: FIRST/FOLLOW per rule, normalized
 * operations, and a decision plan for every choice.
 */
public final class ParserModelBuilder {
    private static final Logger log = LoggerFactory.getLogger(ParserModelBuilder.class);

    private final GrammarAnalysis analysis;
    private final Map<String, Integer> ruleIndex = new HashMap<>();
    private final boolean predictive;
    private int predictiveChoices;
    private int backtrackingChoices;

    private ParserModelBuilder(Grammar grammar, GrammarAnalysis analysis, boolean predictive) {
        this.analysis = analysis;
        this.predictive = predictive;
        var rules = grammar.rules();
        for (int i = 0; i < rules.size(); i++) {
            ruleIndex.put(rules.get(i).name(), i);
        }
    }

    /**
     * Validate the grammar and build its model with the default configuration.
     */
    public static Either<GrammarError, ParserModel> build(Grammar grammar) {
        return GrammarValidator.validate(grammar)
                               .map(report -> build(report, ParserConfig.DEFAULT));
    }

    /**
     * Build from the outcome of a successful validation.
     */
    public static ParserModel build(ValidationReport report, ParserConfig config) {
        return build(report.grammar(), report.analysis(), report.warnings(), config);
    }

    private static ParserModel build(Grammar grammar,
                                     GrammarAnalysis analysis,
                                     List<GrammarWarning> warnings,
                                     ParserConfig config) {
        var builder = new ParserModelBuilder(grammar, analysis, config.predictiveDispatch());
        var rules = new ArrayList<RuleModel>();
        for (var rule : grammar.rules()) {
            rules.add(builder.buildRule(rule));
        }
        log.debug("Built parser model: {} rules, FIRST converged after {} passes, FOLLOW after {}, "
                  + "{} predictive and {} backtracking choices",
                  rules.size(),
                  analysis.firstPasses(),
                  analysis.followPasses(),
                  builder.predictiveChoices,
                  builder.backtrackingChoices);
        return new ParserModel(rules,
                               grammar.effectiveEntryRule()
                                      .get(),
                               grammar.literals(),
                               warnings);
    }

    private RuleModel buildRule(GrammarRule rule) {
        var name = rule.name();
        return new RuleModel(name,
                             ruleIndex.get(name),
                             choice(rule.alternatives()),
                             analysis.first(name),
                             analysis.follow(name),
                             analysis.nullable(name),
                             rule.span());
    }

    private Operation choice(List<Alternative> alternatives) {
        if (alternatives.size() == 1) {
            return sequence(alternatives.get(0).terms());
        }
        var operations = alternatives.stream()
                                     .map(alternative -> sequence(alternative.terms()))
                                     .toList();
        var plan = DecisionPlan.plan(operations, predictive);
        if (plan instanceof DecisionPlan.Predictive) {
            predictiveChoices++;
        } else {
            backtrackingChoices++;
        }
        return Operation.Select.of(operations, plan);
    }

    private Operation sequence(List<Term> terms) {
        if (terms.size() == 1) {
            return normalize(terms.get(0));
        }
        var steps = new ArrayList<Operation>();
        for (var term : terms) {
            var step = normalize(term);
            if (step instanceof Operation.Chain chain) {
                steps.addAll(chain.steps());
            } else {
                steps.add(step);
            }
        }
        return Operation.Chain.of(steps);
    }

    private Operation normalize(Term term) {
        if (term instanceof Term.Literal literal) {
            return new Operation.Match(literal.text());
        }
        if (term instanceof Term.NonterminalRef ref) {
            return new Operation.Invoke(ref.name(),
                                        ruleIndex.get(ref.name()),
                                        analysis.first(ref.name()),
                                        analysis.nullable(ref.name()));
        }
        if (term instanceof Term.Sequence sequence) {
            return sequence(sequence.terms());
        }
        if (term instanceof Term.Choice choice) {
            return choice(choice.alternatives());
        }
        if (term instanceof Term.Repetition repetition) {
            return new Operation.Loop(normalize(repetition.term()), repetition.allowEmpty());
        }
        if (term instanceof Term.Optional optional) {
            return new Operation.Attempt(normalize(optional.term()));
        }
        var exception = (Term.Exception) term;
        return new Operation.Exclude(normalize(exception.base()), normalize(exception.excluded()));
    }
}
