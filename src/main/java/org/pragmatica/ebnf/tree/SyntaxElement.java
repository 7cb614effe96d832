package org.pragmatica.ebnf.tree;

import io.vavr.control.Option;
import org.pragmatica.ebnf.lexer.Token;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Element of a syntax tree: a matched token, a rule node, or the result of a grouped construct.
 * All elements are immutable.
 */
public sealed interface SyntaxElement
    permits SyntaxElement.TokenLeaf, SyntaxElement.Repeated, SyntaxElement.OptionalMatch, SyntaxElement.SequenceMatch,
            SyntaxNode {

    /**
     * Nested elements in order.
     */
    List<SyntaxElement> elements();

    /**
     * All matched tokens under this element, left to right.
     */
    default List<Token> tokens() {
        var tokens = new ArrayList<Token>();
        collectTokens(this, tokens);
        return List.copyOf(tokens);
    }

    /**
     * Token texts separated by single spaces.
     */
    default String text() {
        return tokens().stream()
                       .map(Token::text)
                       .collect(Collectors.joining(" "));
    }

    /**
     * Token texts concatenated without separators, e.g. {@code -42} for the tokens {@code -}, {@code 4}, {@code 2}.
     */
    default String compactText() {
        return tokens().stream()
                       .map(Token::text)
                       .collect(Collectors.joining());
    }

    private static void collectTokens(SyntaxElement element, List<Token> tokens) {
        if (element instanceof TokenLeaf leaf) {
            tokens.add(leaf.token());
            return;
        }
        for (var nested : element.elements()) {
            collectTokens(nested, tokens);
        }
    }

    /**
     * A literal match.
     */
    record TokenLeaf(Token token) implements SyntaxElement {
        @Override
        public List<SyntaxElement> elements() {
            return List.of();
        }

        @Override
        public String toString() {
            return "'" + token.text() + "'";
        }
    }

    /**
     * Result of a repetition: the ordered list of iteration matches, possibly empty.
     */
    record Repeated(List<SyntaxElement> items) implements SyntaxElement {
        public Repeated {
            items = List.copyOf(items);
        }

        @Override
        public List<SyntaxElement> elements() {
            return items;
        }

        @Override
        public String toString() {
            return "{" + items.stream().map(Object::toString).collect(Collectors.joining(", ")) + "}";
        }
    }

    /**
     * Result of an optional: present or absent.
     */
    record OptionalMatch(Option<SyntaxElement> value) implements SyntaxElement {
        public static OptionalMatch absent() {
            return new OptionalMatch(Option.none());
        }

        public static OptionalMatch present(SyntaxElement element) {
            return new OptionalMatch(Option.some(element));
        }

        public boolean isPresent() {
            return value.isDefined();
        }

        @Override
        public List<SyntaxElement> elements() {
            return value.toJavaList();
        }

        @Override
        public String toString() {
            return value.map(element -> "[" + element + "]")
                        .getOrElse("[]");
        }
    }

    /**
     * A grouped sequence matched inside a repetition, optional or choice.
     */
    record SequenceMatch(List<SyntaxElement> items) implements SyntaxElement {
        public SequenceMatch {
            items = List.copyOf(items);
        }

        @Override
        public List<SyntaxElement> elements() {
            return items;
        }

        @Override
        public String toString() {
            return "(" + items.stream().map(Object::toString).collect(Collectors.joining(" ")) + ")";
        }
    }
}
