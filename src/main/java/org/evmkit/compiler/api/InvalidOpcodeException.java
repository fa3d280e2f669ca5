package org.evmkit.compiler.api;

/**
 * Thrown when a jump refers to a label that was never placed, or when the decoder meets a
 * byte that matches no instruction.
 */
public class InvalidOpcodeException extends AssemblyException {

    public InvalidOpcodeException(String message) {
        super(message);
    }
}
