package org.evmkit.runtime.spi;

import org.evmkit.compiler.ir.IrToken;

/**
 * Snapshot handed to an {@link IExecutionTracer} before an instruction is dispatched.
 *
 * @param step The number of instructions dispatched before this one.
 * @param pc The byte offset of the instruction.
 * @param token The instruction.
 * @param stackDepth The stack depth before the instruction runs.
 * @param memorySize The memory size before the instruction runs.
 */
public record TraceEvent(long step, int pc, IrToken token, int stackDepth, int memorySize) {
}
