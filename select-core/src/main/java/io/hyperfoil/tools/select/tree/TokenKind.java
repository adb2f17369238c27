package io.hyperfoil.tools.select.tree;

/**
 * What a {@link Tag#TOKEN} leaf holds.
 */
public enum TokenKind {
    SYMBOL,
    KEYWORD,
    NUMBER,
    CHARACTER,
    STRING
}
