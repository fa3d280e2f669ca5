package org.evmkit.runtime;

/**
 * Thrown by {@link org.evmkit.runtime.services.StepLimitTracer} when an execution dispatches
 * more instructions than allowed.
 */
public class StepLimitExceededException extends RuntimeException {

    private final long limit;

    public StepLimitExceededException(long limit) {
        super("Execution exceeded " + limit + " steps");
        this.limit = limit;
    }

    public long getLimit() {
        return limit;
    }
}
