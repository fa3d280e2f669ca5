package org.evmkit.runtime;

import java.util.NoSuchElementException;
import java.util.Objects;

import org.evmkit.runtime.model.ExecutionResult;

/**
 * Either the result of a halted execution or the error that aborted it.
 */
public final class ExecutionOutcome {

    private final ExecutionResult result;
    private final VmError error;

    private ExecutionOutcome(ExecutionResult result, VmError error) {
        this.result = result;
        this.error = error;
    }

    public static ExecutionOutcome success(ExecutionResult result) {
        return new ExecutionOutcome(Objects.requireNonNull(result, "result"), null);
    }

    public static ExecutionOutcome failure(VmError error) {
        return new ExecutionOutcome(null, Objects.requireNonNull(error, "error"));
    }

    public boolean isSuccess() {
        return result != null;
    }

    /**
     * @return The result of the execution.
     * @throws NoSuchElementException if the execution failed.
     */
    public ExecutionResult result() {
        if (result == null) {
            throw new NoSuchElementException("Execution failed: " + error);
        }
        return result;
    }

    /**
     * @return The error that aborted the execution.
     * @throws NoSuchElementException if the execution succeeded.
     */
    public VmError error() {
        if (error == null) {
            throw new NoSuchElementException("Execution succeeded");
        }
        return error;
    }

    @Override
    public String toString() {
        return isSuccess() ? "success(" + result + ")" : "failure(" + error + ")";
    }
}
