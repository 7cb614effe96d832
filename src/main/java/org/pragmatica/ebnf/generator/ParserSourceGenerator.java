package org.pragmatica.ebnf.generator;

import org.pragmatica.ebnf.model.Operation;
import org.pragmatica.ebnf.model.ParserModel;
import org.pragmatica.ebnf.model.RuleModel;
import org.pragmatica.ebnf.parser.ParserConfig;

import javax.lang.model.SourceVersion;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Generates a standalone recognizer class from a {@link ParserModel}: one method per rule and one
 * helper per composite term. The generated code depends only on the JDK.
 *
 * <p>The generated {@code parse(rule, tokens)} works on token texts and returns the rule matches
 * in preorder (a parent before its children) when the whole input is consumed. Parents reserve
 * their slot before their children run and fill it in on success.
 */
public final class ParserSourceGenerator {

    private static final Set<String> RESERVED = Set.of("ruleText");

    private static final String STATE_CLASS = """
            private static final class State {
                final List<String> tokens;
                final List<Match> matches = new ArrayList<>();
                int pos;
                int depth;

                State(List<String> tokens) {
                    this.tokens = List.copyOf(tokens);
                }

                boolean match(String text) {
                    if (pos < tokens.size() && tokens.get(pos).equals(text)) {
                        pos++;
                        return true;
                    }
                    return false;
                }

                boolean nextIn(Set<String> texts) {
                    return pos < tokens.size() && texts.contains(tokens.get(pos));
                }

                int reserve() {
                    matches.add(null);
                    return matches.size() - 1;
                }

                void rewind(int position, int mark) {
                    pos = position;
                    while (matches.size() > mark) {
                        matches.remove(matches.size() - 1);
                    }
                }
            }
        """;

    private final ParserModel model;
    private final String packageName;
    private final String className;
    private final int maxDepth;
    private final Map<String, String> constants = new LinkedHashMap<>();
    private final Map<List<String>, String> firstSets = new LinkedHashMap<>();
    private final List<String> helpers = new ArrayList<>();
    private String currentRule;
    private int helperCounter;

    private ParserSourceGenerator(ParserModel model, String packageName, String className, int maxDepth) {
        this.model = model;
        this.packageName = packageName;
        this.className = className;
        this.maxDepth = maxDepth;
        var used = new HashSet<>(RESERVED);
        for (var rule : model.rules()) {
            constants.put(rule.name(), constantName(rule.name(), used));
        }
    }

    public static ParserSourceGenerator create(ParserModel model, String packageName, String className) {
        return create(model, packageName, className, ParserConfig.DEFAULT);
    }

    public static ParserSourceGenerator create(ParserModel model, String packageName, String className, ParserConfig config) {
        return new ParserSourceGenerator(model, packageName, className, config.maxRecursionDepth());
    }

    /**
     * Enum constant used for a rule: the rule name, with {@code _} appended while it is a Java
     * keyword or clashes with another constant.
     */
    public String constantFor(String ruleName) {
        return constants.get(ruleName);
    }

    public String generate() {
        helpers.clear();
        firstSets.clear();
        var ruleMethods = new StringBuilder();
        for (var rule : model.rules()) {
            generateRuleMethod(ruleMethods, rule);
        }

        var sb = new StringBuilder();
        generatePackage(sb);
        generateImports(sb);
        generateClassStart(sb);
        generateRuleEnum(sb);
        generateMatchRecord(sb);
        generateConstants(sb);
        generateParseMethods(sb);
        sb.append(STATE_CLASS).append("\n");
        sb.append(ruleMethods);
        helpers.forEach(sb::append);
        sb.append("}\n");
        return sb.toString();
    }

    private void generatePackage(StringBuilder sb) {
        if (!packageName.isEmpty()) {
            sb.append("package ").append(packageName).append(";\n\n");
        }
    }

    private void generateImports(StringBuilder sb) {
        sb.append("import java.util.ArrayList;\n");
        sb.append("import java.util.List;\n");
        sb.append("import java.util.Optional;\n");
        sb.append("import java.util.Set;\n\n");
    }

    private void generateClassStart(StringBuilder sb) {
        sb.append("/**\n");
        sb.append(" * Recognizer generated from an EBNF grammar. Entry rule: ").append(model.entryRule()).append(".\n");
        sb.append(" * Instances are stateless and may be shared between threads.\n");
        sb.append(" */\n");
        sb.append("public final class ").append(className).append(" {\n\n");
    }

    private void generateRuleEnum(StringBuilder sb) {
        sb.append("    public enum Rule {\n");
        var entries = model.rules()
                           .stream()
                           .map(rule -> "        " + constants.get(rule.name()) + "(\"" + rule.name() + "\")")
                           .collect(Collectors.joining(",\n"));
        sb.append(entries).append(";\n\n");
        sb.append("""
                    private final String ruleText;

                    Rule(String ruleText) {
                        this.ruleText = ruleText;
                    }

                    public String grammarName() {
                        return ruleText;
                    }
                }

            """);
    }

    private void generateMatchRecord(StringBuilder sb) {
        sb.append("""
                public record Match(Rule rule, int start, int end) {
                    public String ruleName() {
                        return rule.grammarName();
                    }
                }

            """);
    }

    private void generateConstants(StringBuilder sb) {
        sb.append("    private static final int MAX_DEPTH = ").append(maxDepth).append(";\n\n");
        firstSets.forEach((texts, name) -> {
            sb.append("    private static final Set<String> ").append(name).append(" = Set.of(");
            sb.append(texts.stream()
                           .map(text -> "\"" + escape(text) + "\"")
                           .collect(Collectors.joining(", ")));
            sb.append(");\n");
        });
        sb.append("\n");
    }

    private void generateParseMethods(StringBuilder sb) {
        sb.append("    public Optional<List<Match>> parse(List<String> tokens) {\n");
        sb.append("        return parse(\"").append(model.entryRule()).append("\", tokens);\n");
        sb.append("    }\n\n");

        sb.append("    public Optional<List<Match>> parse(String ruleName, List<String> tokens) {\n");
        sb.append("        var s = new State(tokens);\n");
        sb.append("        boolean matched = switch (ruleName) {\n");
        for (var rule : model.rules()) {
            sb.append("            case \"").append(rule.name()).append("\" -> ")
              .append(ruleMethod(rule.name())).append("(s);\n");
        }
        sb.append("            default -> throw new IllegalArgumentException(\"Unknown rule: \" + ruleName);\n");
        sb.append("        };\n");
        sb.append("        if (!matched || s.pos != s.tokens.size()) {\n");
        sb.append("            return Optional.empty();\n");
        sb.append("        }\n");
        sb.append("        return Optional.of(List.copyOf(s.matches));\n");
        sb.append("    }\n\n");
    }

    private void generateRuleMethod(StringBuilder sb, RuleModel rule) {
        currentRule = rule.name();
        helperCounter = 0;
        var body = expression(rule.body());

        sb.append("    // ").append(comment(rule.name())).append("\n");
        sb.append("    // FIRST: ").append(comment(String.join(" ", rule.first()))).append("\n");
        sb.append("    // FOLLOW: ").append(comment(String.join(" ", rule.follow()))).append("\n");
        sb.append("    private static boolean ").append(ruleMethod(rule.name())).append("(State s) {\n");
        sb.append("        if (++s.depth > MAX_DEPTH) {\n");
        sb.append("            throw new IllegalStateException(\"Recursion depth limit of \" + MAX_DEPTH + \" exceeded in rule ")
          .append(rule.name()).append("\");\n");
        sb.append("        }\n");
        sb.append("        try {\n");
        sb.append("            int start = s.pos;\n");
        sb.append("            int slot = s.reserve();\n");
        sb.append("            if (").append(body).append(") {\n");
        sb.append("                s.matches.set(slot, new Match(Rule.").append(constants.get(rule.name()))
          .append(", start, s.pos));\n");
        sb.append("                return true;\n");
        sb.append("            }\n");
        sb.append("            s.rewind(start, slot);\n");
        sb.append("            return false;\n");
        sb.append("        } finally {\n");
        sb.append("            s.depth--;\n");
        sb.append("        }\n");
        sb.append("    }\n\n");
    }

    /**
     * Java boolean expression that runs the operation against {@code s}.
     */
    private String expression(Operation operation) {
        if (operation instanceof Operation.Match match) {
            return "s.match(\"" + escape(match.text()) + "\")";
        }
        if (operation instanceof Operation.Invoke invoke) {
            return ruleMethod(invoke.rule()) + "(s)";
        }
        var name = "term_" + currentRule + "_" + helperCounter++;
        var method = new StringBuilder();
        method.append("    private static boolean ").append(name).append("(State s) {\n");

        if (operation instanceof Operation.Chain chain) {
            var steps = chain.steps()
                             .stream()
                             .map(this::expression)
                             .collect(Collectors.joining("\n                && "));
            method.append("        int start = s.pos;\n");
            method.append("        int mark = s.matches.size();\n");
            method.append("        if (").append(steps).append(") {\n");
            method.append("            return true;\n");
            method.append("        }\n");
            method.append("        s.rewind(start, mark);\n");
            method.append("        return false;\n");
        } else if (operation instanceof Operation.Select select) {
            method.append("        int start = s.pos;\n");
            method.append("        int mark = s.matches.size();\n");
            for (var alternative : select.alternatives()) {
                method.append("        if (").append(guarded(alternative, expression(alternative))).append(") {\n");
                method.append("            return true;\n");
                method.append("        }\n");
                method.append("        s.rewind(start, mark);\n");
            }
            method.append("        return false;\n");
        } else if (operation instanceof Operation.Loop loop) {
            method.append("        int count = 0;\n");
            method.append("        while (s.nextIn(").append(firstSet(loop.body())).append(")) {\n");
            method.append("            int start = s.pos;\n");
            method.append("            int mark = s.matches.size();\n");
            method.append("            if (!").append(expression(loop.body())).append(" || s.pos == start) {\n");
            method.append("                s.rewind(start, mark);\n");
            method.append("                break;\n");
            method.append("            }\n");
            method.append("            count++;\n");
            method.append("        }\n");
            method.append(loop.allowEmpty()
                          ? "        return true;\n"
                          : "        return count > 0;\n");
        } else if (operation instanceof Operation.Attempt attempt) {
            method.append("        int start = s.pos;\n");
            method.append("        int mark = s.matches.size();\n");
            method.append("        if (!(").append(guarded(attempt.body(), expression(attempt.body()))).append(")) {\n");
            method.append("            s.rewind(start, mark);\n");
            method.append("        }\n");
            method.append("        return true;\n");
        } else {
            var exclude = (Operation.Exclude) operation;
            method.append("        int start = s.pos;\n");
            method.append("        int mark = s.matches.size();\n");
            method.append("        if (!").append(expression(exclude.base())).append(") {\n");
            method.append("            s.rewind(start, mark);\n");
            method.append("            return false;\n");
            method.append("        }\n");
            method.append("        int end = s.pos;\n");
            method.append("        int after = s.matches.size();\n");
            method.append("        s.pos = start;\n");
            method.append("        boolean excluded = ").append(expression(exclude.excluded())).append(" && s.pos == end;\n");
            method.append("        s.rewind(end, after);\n");
            method.append("        if (excluded) {\n");
            method.append("            s.rewind(start, mark);\n");
            method.append("            return false;\n");
            method.append("        }\n");
            method.append("        return true;\n");
        }
        method.append("    }\n\n");
        helpers.add(method.toString());
        return name + "(s)";
    }

    // Non-nullable operations are only tried when the next token can start them.
    private String guarded(Operation operation, String expression) {
        return operation.nullable()
               ? expression
               : "s.nextIn(" + firstSet(operation) + ") && " + expression;
    }

    private String firstSet(Operation operation) {
        var texts = List.copyOf(operation.first());
        return firstSets.computeIfAbsent(texts, key -> "FIRST_" + firstSets.size());
    }

    private static String ruleMethod(String ruleName) {
        return "rule_" + ruleName;
    }

    private static String constantName(String ruleName, Set<String> used) {
        var name = ruleName;
        while (!SourceVersion.isName(name) || used.contains(name)) {
            name = name + "_";
        }
        used.add(name);
        return name;
    }

    private static String escape(String text) {
        var sb = new StringBuilder();
        for (char c : text.toCharArray()) {
            switch (c) {
                case '\\' -> sb.append("\\\\");
                case '"' -> sb.append("\\\"");
                case '\t' -> sb.append("\\t");
                case '\r' -> sb.append("\\r");
                case '\n' -> sb.append("\\n");
                default -> {
                    if (c < 0x20 || c > 0x7e) {
                        sb.append(String.format("\\u%04x", (int) c));
                    } else {
                        sb.append(c);
                    }
                }
            }
        }
        return sb.toString();
    }

    // Backslashes are doubled so that no unicode escape is formed inside a comment.
    private static String comment(String text) {
        return text.replace("\\", "\\\\");
    }
}
