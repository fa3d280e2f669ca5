package org.evmkit.compiler.api;

/**
 * Base class for errors raised while assembling, resolving, encoding or decoding a program.
 * <p>
 * These errors mean the program itself is malformed. They are unchecked and are never
 * recovered from inside the assembler; callers either fix their input or report the error.
 */
public class AssemblyException extends RuntimeException {

    /**
     * Constructs a new assembly exception with the specified detail message.
     * @param message The detail message.
     */
    public AssemblyException(String message) {
        super(message);
    }

    /**
     * Constructs a new assembly exception with the specified detail message and cause.
     * @param message The detail message.
     * @param cause The cause.
     */
    public AssemblyException(String message, Throwable cause) {
        super(message, cause);
    }
}
