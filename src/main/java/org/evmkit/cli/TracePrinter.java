package org.evmkit.cli;

import java.io.PrintWriter;

import org.evmkit.runtime.spi.IExecutionTracer;
import org.evmkit.runtime.spi.TraceEvent;

/**
 * Prints one line per dispatched instruction: step, offset, instruction, stack depth and
 * memory size.
 */
public class TracePrinter implements IExecutionTracer {

    private final PrintWriter out;

    public TracePrinter(PrintWriter out) {
        this.out = out;
    }

    @Override
    public void beforeInstruction(TraceEvent event) {
        out.printf("%6d  %04x  %-24s stack=%d memory=%d%n",
                event.step(), event.pc(), event.token(), event.stackDepth(), event.memorySize());
    }
}
