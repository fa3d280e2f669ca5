package org.evmkit.runtime.spi;

/**
 * Observes an execution one instruction at a time.
 * <p>
 * A tracer may abort the execution by throwing an unchecked exception from
 * {@link #beforeInstruction(TraceEvent)}; the exception propagates out of the
 * {@code VirtualMachine} entry point unchanged. This is how callers impose a step budget.
 * <p>
 * A tracer shared by concurrent executions must be thread-safe.
 */
public interface IExecutionTracer {

    /** A tracer that does nothing. */
    IExecutionTracer NONE = event -> { };

    /**
     * Called before each instruction is dispatched.
     *
     * @param event The state before the instruction runs.
     */
    void beforeInstruction(TraceEvent event);

    /**
     * Returns a tracer that calls this tracer, then {@code next}.
     */
    default IExecutionTracer andThen(IExecutionTracer next) {
        return event -> {
            beforeInstruction(event);
            next.beforeInstruction(event);
        };
    }
}
