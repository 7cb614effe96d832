package org.pragmatica.ebnf.tree;

import io.vavr.control.Option;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * A rule match. The tag is the rule name, the children are the elements of the matched alternative.
 */
public record SyntaxNode(String tag, List<SyntaxElement> children, SourceSpan span) implements SyntaxElement {

    public SyntaxNode {
        children = List.copyOf(children);
    }

    @Override
    public List<SyntaxElement> elements() {
        return children;
    }

    /**
     * First child node with the given tag. Grouped constructs are looked through.
     */
    public Option<SyntaxNode> child(String tag) {
        return Option.ofOptional(childNodes().stream()
                                             .filter(node -> node.tag()
                                                                 .equals(tag))
                                             .findFirst());
    }

    /**
     * Rule nodes directly below this node; repetitions, optionals and groups are looked through.
     */
    public List<SyntaxNode> childNodes() {
        var nodes = new ArrayList<SyntaxNode>();
        for (var element : children) {
            collectNodes(element, nodes);
        }
        return List.copyOf(nodes);
    }

    private static void collectNodes(SyntaxElement element, List<SyntaxNode> nodes) {
        if (element instanceof SyntaxNode node) {
            nodes.add(node);
            return;
        }
        for (var nested : element.elements()) {
            collectNodes(nested, nodes);
        }
    }

    /**
     * Depth-first, parent-before-children traversal of this node and all nested rule nodes.
     */
    public Iterator<SyntaxNode> preorder() {
        return new PreorderIterator(this);
    }

    public Stream<SyntaxNode> stream() {
        return StreamSupport.stream(Spliterators.spliteratorUnknownSize(preorder(), Spliterator.ORDERED), false);
    }

    /**
     * S-expression style rendering, e.g. {@code (int '-' (num (digit '4')))}.
     */
    public String toSExpression() {
        var parts = children.stream()
                            .map(SyntaxNode::render)
                            .filter(part -> !part.isEmpty())
                            .collect(Collectors.joining(" "));
        return parts.isEmpty()
               ? "(" + tag + ")"
               : "(" + tag + " " + parts + ")";
    }

    private static String render(SyntaxElement element) {
        if (element instanceof SyntaxNode node) {
            return node.toSExpression();
        }
        if (element instanceof TokenLeaf leaf) {
            return "'" + leaf.token().text() + "'";
        }
        return element.elements()
                      .stream()
                      .map(SyntaxNode::render)
                      .filter(part -> !part.isEmpty())
                      .collect(Collectors.joining(" "));
    }

    @Override
    public String toString() {
        return toSExpression();
    }

    private static final class PreorderIterator implements Iterator<SyntaxNode> {
        private final ArrayDeque<SyntaxNode> pending = new ArrayDeque<>();

        private PreorderIterator(SyntaxNode root) {
            pending.push(root);
        }

        @Override
        public boolean hasNext() {
            return !pending.isEmpty();
        }

        @Override
        public SyntaxNode next() {
            if (pending.isEmpty()) {
                throw new NoSuchElementException();
            }
            var node = pending.pop();
            var nested = node.childNodes();
            for (int i = nested.size() - 1; i >= 0; i--) {
                pending.push(nested.get(i));
            }
            return node;
        }
    }
}
