package org.evmkit.compiler.api;

/**
 * Thrown for a malformed operation tree: an unknown form, a wrong operand count, an
 * oversized or negative literal, a jump offset that no longer fits, or an attempt to
 * encode a program that still holds placeholders.
 */
public class InvalidAssemblyException extends AssemblyException {

    public InvalidAssemblyException(String message) {
        super(message);
    }

    /**
     * Constructs an exception that points at a position in textual source.
     * @param message The detail message.
     * @param line The 1-based line number.
     * @param column The 1-based column number.
     */
    public InvalidAssemblyException(String message, int line, int column) {
        super(String.format("%s at line %d, column %d", message, line, column));
    }

    public InvalidAssemblyException(String message, Throwable cause) {
        super(message, cause);
    }
}
