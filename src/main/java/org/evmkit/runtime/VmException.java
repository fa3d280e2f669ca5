package org.evmkit.runtime;

/**
 * Raised by an instruction to abort the current execution. The step loop turns it into a
 * failed {@link ExecutionOutcome}; it never escapes {@link VirtualMachine#exec}.
 */
public class VmException extends Exception {

    private final VmError error;

    public VmException(VmError error) {
        super(error.toString());
        this.error = error;
    }

    public VmException(VmError.Kind kind) {
        this(VmError.of(kind));
    }

    public VmError getError() {
        return error;
    }
}
