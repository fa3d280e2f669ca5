package org.evmkit.compiler.api;

/**
 * Thrown by the decoder when a push instruction declares more immediate bytes than remain
 * in the buffer.
 */
public class InvalidCodeException extends AssemblyException {

    public InvalidCodeException(String message) {
        super(message);
    }
}
