package org.evmkit.runtime.services;

import org.evmkit.runtime.StepLimitExceededException;
import org.evmkit.runtime.spi.IExecutionTracer;
import org.evmkit.runtime.spi.TraceEvent;

/**
 * Aborts an execution once it has dispatched a given number of instructions.
 * <p>
 * The count comes from each {@link TraceEvent}, so one instance can bound any number of
 * executions.
 */
public class StepLimitTracer implements IExecutionTracer {

    private final long maxSteps;

    /**
     * @param maxSteps The number of instructions an execution may dispatch.
     */
    public StepLimitTracer(long maxSteps) {
        if (maxSteps < 1) {
            throw new IllegalArgumentException("maxSteps must be positive, got: " + maxSteps);
        }
        this.maxSteps = maxSteps;
    }

    @Override
    public void beforeInstruction(TraceEvent event) {
        if (event.step() >= maxSteps) {
            throw new StepLimitExceededException(maxSteps);
        }
    }
}
