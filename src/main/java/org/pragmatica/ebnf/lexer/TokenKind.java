package org.pragmatica.ebnf.lexer;

/**
 * Coarse classification of tokens. Matching is always done on token text; the kind is informational.
 */
public enum TokenKind {
    /** Multi-character word, e.g. {@code val}. */
    KEYWORD,
    /** Multi-character punctuation, e.g. {@code ->}. */
    SYMBOL,
    /** Any single character. */
    CHARACTER;

    public static TokenKind classify(String text) {
        if (text.length() == 1) {
            return CHARACTER;
        }
        for (int i = 0; i < text.length(); i++) {
            if (!isWordChar(text.charAt(i))) {
                return SYMBOL;
            }
        }
        return KEYWORD;
    }

    static boolean isWordChar(char c) {
        return Character.isLetterOrDigit(c) || c == '_';
    }
}
