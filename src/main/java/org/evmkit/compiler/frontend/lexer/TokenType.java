package org.evmkit.compiler.frontend.lexer;

/**
 * Defines the different types of tokens that the {@link Lexer} can recognize.
 */
public enum TokenType {
    // Single-character tokens.
    /** The '(' character, opening a form. */
    LEFT_PAREN,
    /** The ')' character, closing a form. */
    RIGHT_PAREN,

    // Literals.
    /** A bare word: a mnemonic, {@code if} or {@code self-code-size}. */
    SYMBOL,
    /** A decimal or {@code 0x} hexadecimal integer. */
    NUMBER,
    /** A quoted {@code "0x..."} byte string. */
    STRING,

    // Miscellaneous.
    /** Represents the end of the source. */
    END_OF_FILE
}
