package org.evmkit.runtime;

/**
 * Thrown by {@link VirtualMachine#execCall} when an execution ends in anything other than
 * {@code STOP}, {@code RETURN} or {@code REVERT}.
 */
public class VmFailureException extends RuntimeException {

    private final VmError error;

    public VmFailureException(VmError error) {
        super("VmError: " + error);
        this.error = error;
    }

    public VmError getError() {
        return error;
    }
}
