package org.pragmatica.ebnf.error;

import io.vavr.control.Option;
import org.pragmatica.ebnf.tree.SourceSpan;

import java.util.ArrayList;
import java.util.List;

/**
 * Rust-style rendering of a problem against the text it was found in.
 *
 * <p>Example output:
 * <pre>
 * error: Unexpected '9' at 1:1, expected 'a' or 'b'
 *   --> input:1:1
 *   |
 * 1 | 9x
 *   | ^ found '9'
 *   |
 *   = help: expected 'a' or 'b'
 * </pre>
 *
 * @param severity Error severity level
 * @param message  Primary message
 * @param span     Source span the problem refers to
 * @param label    Optional text printed next to the underline
 * @param notes    Additional notes or suggestions
 */
public record Diagnostic(Severity severity, String message, SourceSpan span, Option<String> label, List<String> notes) {

    public enum Severity {
        ERROR("error"),
        WARNING("warning");

        private final String display;

        Severity(String display) {
            this.display = display;
        }

        public String display() {
            return display;
        }
    }

    public Diagnostic {
        notes = List.copyOf(notes);
    }

    public static Diagnostic error(String message, SourceSpan span) {
        return new Diagnostic(Severity.ERROR, message, span, Option.none(), List.of());
    }

    public static Diagnostic warning(String message, SourceSpan span) {
        return new Diagnostic(Severity.WARNING, message, span, Option.none(), List.of());
    }

    /**
     * Diagnostic for a grammar error, to be formatted against the grammar text.
     */
    public static Diagnostic of(GrammarError error) {
        var diagnostic = error(error.message(), error.span());
        if (error instanceof GrammarError.GrammarSyntaxError syntax) {
            return diagnostic.withLabel("found " + syntax.found())
                             .withHelp("expected " + syntax.expected());
        }
        if (error instanceof GrammarError.LeftRecursionError recursion) {
            return diagnostic.withLabel("left-recursive rule")
                             .withHelp("rewrite the cycle " + String.join(" -> ", recursion.cycle())
                                       + " so that a token is consumed first");
        }
        return diagnostic;
    }

    /**
     * Diagnostic for a grammar warning, to be formatted against the grammar text.
     */
    public static Diagnostic of(GrammarWarning warning) {
        var diagnostic = warning(warning.message(), warning.span());
        if (warning instanceof GrammarWarning.AmbiguityWarning) {
            return diagnostic.withNote("the earlier alternative is always tried first");
        }
        return diagnostic;
    }

    /**
     * Diagnostic for a parse error, to be formatted against the parsed input.
     */
    public static Diagnostic of(ParseError error) {
        if (error instanceof ParseError.ParseSyntaxError syntax) {
            var span = syntax.actual()
                             .map(token -> token.span())
                             .getOrElse(SourceSpan.at(syntax.location()));
            var found = syntax.actual()
                              .map(token -> "found '" + token.text() + "'")
                              .getOrElse("found end of input");
            var diagnostic = error(error.message(), span).withLabel(found);
            return syntax.expected()
                         .isEmpty()
                   ? diagnostic
                   : diagnostic.withHelp("expected " + String.join(" or ", quoted(syntax.expected())));
        }
        if (error instanceof ParseError.TrailingInputError trailing) {
            return error(error.message(), trailing.token().span()).withLabel("not consumed by the grammar");
        }
        return error(error.message(), SourceSpan.at(error.location()));
    }

    private static List<String> quoted(Iterable<String> texts) {
        var result = new ArrayList<String>();
        texts.forEach(text -> result.add("'" + text + "'"));
        return result;
    }

    public Diagnostic withLabel(String text) {
        return new Diagnostic(severity, message, span, Option.some(text), notes);
    }

    public Diagnostic withNote(String note) {
        var newNotes = new ArrayList<>(notes);
        newNotes.add(note);
        return new Diagnostic(severity, message, span, label, newNotes);
    }

    public Diagnostic withHelp(String help) {
        return withNote("help: " + help);
    }

    /**
     * Format this diagnostic in Rust style.
     *
     * @param source   The text the span refers to
     * @param filename Name shown in the location line
     * @return Formatted diagnostic string
     */
    public String format(String source, String filename) {
        var sb = new StringBuilder();
        var lines = source.split("\n", -1);
        var start = span.start();

        sb.append(severity.display())
          .append(": ")
          .append(message)
          .append("\n");
        sb.append("  --> ")
          .append(filename)
          .append(":")
          .append(start.line())
          .append(":")
          .append(start.column())
          .append("\n");

        int gutterWidth = String.valueOf(span.end().line()).length();
        var gutter = " ".repeat(gutterWidth + 1) + "|";
        sb.append(gutter).append("\n");

        for (int lineNum = start.line(); lineNum <= span.end().line(); lineNum++) {
            if (lineNum < 1 || lineNum > lines.length) {
                continue;
            }
            var content = lines[lineNum - 1];
            sb.append(String.format("%" + gutterWidth + "d", lineNum))
              .append(" | ")
              .append(content)
              .append("\n");
            sb.append(" ".repeat(gutterWidth))
              .append(" | ")
              .append(underline(lineNum, content))
              .append("\n");
        }

        sb.append(gutter).append("\n");
        for (var note : notes) {
            sb.append(" ".repeat(gutterWidth + 1))
              .append("= ")
              .append(note)
              .append("\n");
        }
        return sb.toString();
    }

    private String underline(int lineNum, String content) {
        int startCol = span.start().line() == lineNum
                       ? span.start().column()
                       : 1;
        int endCol = span.end().line() == lineNum
                     ? span.end().column()
                     : content.length() + 1;
        var sb = new StringBuilder();
        sb.append(" ".repeat(Math.max(0, startCol - 1)));
        sb.append("^".repeat(Math.max(1, endCol - startCol)));
        if (lineNum == span.end().line()) {
            label.forEach(text -> sb.append(" ").append(text));
        }
        return sb.toString();
    }

    /**
     * Single-line format, e.g. {@code input:1:1: error: ...}.
     */
    public String formatSimple(String filename) {
        var loc = span.start();
        return String.format("%s:%d:%d: %s: %s", filename, loc.line(), loc.column(), severity.display(), message);
    }
}
