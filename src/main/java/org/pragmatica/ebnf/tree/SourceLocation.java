package org.pragmatica.ebnf.tree;

/**
 * A position in source text (line and column, both 1-based; offset 0-based).
 */
public record SourceLocation(int line, int column, int offset) {

    public static final SourceLocation START = new SourceLocation(1, 1, 0);

    public static SourceLocation at(int line, int column, int offset) {
        return new SourceLocation(line, column, offset);
    }

    /**
     * Location reached after consuming the given character at this location.
     */
    public SourceLocation next(char c) {
        return c == '\n'
               ? new SourceLocation(line + 1, 1, offset + 1)
               : new SourceLocation(line, column + 1, offset + 1);
    }

    /**
     * Location reached after consuming the given text at this location.
     */
    public SourceLocation after(String text) {
        var location = this;
        for (int i = 0; i < text.length(); i++) {
            location = location.next(text.charAt(i));
        }
        return location;
    }

    @Override
    public String toString() {
        return line + ":" + column;
    }
}
