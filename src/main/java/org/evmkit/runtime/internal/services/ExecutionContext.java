package org.evmkit.runtime.internal.services;

import java.math.BigInteger;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

import org.evmkit.compiler.ir.IrToken;
import org.evmkit.compiler.ir.Program;
import org.evmkit.runtime.VmError;
import org.evmkit.runtime.VmException;
import org.evmkit.runtime.VmLimits;
import org.evmkit.runtime.isa.Opcode;
import org.evmkit.runtime.model.CallInput;
import org.evmkit.runtime.model.ExecutionResult;
import org.evmkit.runtime.model.Memory;
import org.evmkit.runtime.model.OperandStack;
import org.evmkit.runtime.model.Word;
import org.evmkit.runtime.spi.IHashFunction;

/**
 * Mutable state of one execution. Instructions read and modify it; it is never shared between
 * executions.
 */
public final class ExecutionContext {

    private final byte[] code;
    private final Map<Integer, IrToken> opMap;
    private final CallInput input;
    private final VmLimits limits;
    private final IHashFunction hashFunction;

    private final OperandStack stack;
    private final Memory memory;
    private final Map<Word, Word> transientStorage = new HashMap<>();

    private int pc = 0;
    private boolean halted = false;
    private boolean reverted = false;
    private byte[] returnData = new byte[0];

    /**
     * Creates the initial state for executing {@code program}.
     *
     * @param program The resolved program.
     * @param code The encoded bytes of {@code program}.
     * @param input The call input.
     * @param limits The resource limits.
     * @param hashFunction The hash primitive for {@code SHA3}.
     */
    public ExecutionContext(Program program, byte[] code, CallInput input, VmLimits limits, IHashFunction hashFunction) {
        this.code = code;
        this.opMap = buildOpMap(program);
        this.input = input;
        this.limits = limits;
        this.hashFunction = hashFunction;
        this.stack = new OperandStack(limits.maxStackDepth());
        this.memory = new Memory(limits.maxMemoryBytes());
    }

    private static Map<Integer, IrToken> buildOpMap(Program program) {
        Map<Integer, IrToken> map = new HashMap<>();
        int offset = 0;
        for (IrToken token : program.tokens()) {
            map.put(offset, token);
            offset += token.size();
        }
        return Collections.unmodifiableMap(map);
    }

    // --- Program and input ---

    /**
     * @return The encoded program. Callers must not modify the array.
     */
    public byte[] getCode() { return code; }

    public CallInput getInput() { return input; }

    public VmLimits getLimits() { return limits; }

    public IHashFunction getHashFunction() { return hashFunction; }

    /**
     * @return The instruction starting at byte {@code offset}, or {@code null} if none does.
     */
    public IrToken tokenAt(int offset) {
        return opMap.get(offset);
    }

    // --- Machine state ---

    public int getPc() { return pc; }

    public void setPc(int pc) { this.pc = pc; }

    public boolean isHalted() { return halted; }

    public OperandStack getStack() { return stack; }

    public Memory getMemory() { return memory; }

    public Map<Word, Word> getTransientStorage() { return transientStorage; }

    /**
     * Stops the execution.
     *
     * @param data The return data.
     * @param revert {@code true} for {@code REVERT}.
     */
    public void halt(byte[] data, boolean revert) {
        this.halted = true;
        this.reverted = revert;
        this.returnData = data;
    }

    /**
     * Moves the program counter to a jump destination. The step loop then advances past the
     * {@code JUMPDEST} as for any other instruction.
     *
     * @param destination The target byte offset.
     * @throws VmException with {@link VmError.Kind#INVALID_JUMP_DEST} unless the target is a
     *                     {@code JUMPDEST}.
     */
    public void jumpTo(BigInteger destination) throws VmException {
        IrToken target = destination.bitLength() < 32 ? opMap.get(destination.intValue()) : null;
        if (!(target instanceof IrToken.Plain plain) || plain.opcode() != Opcode.JUMPDEST) {
            throw new VmException(VmError.of(VmError.Kind.INVALID_JUMP_DEST, "offset " + destination));
        }
        this.pc = destination.intValue();
    }

    // --- Stack helpers ---

    public Word pop() throws VmException {
        return stack.pop();
    }

    public BigInteger popUnsigned() throws VmException {
        return stack.pop().toUnsigned();
    }

    public BigInteger popSigned() throws VmException {
        return stack.pop().toSigned();
    }

    public void push(Word word) throws VmException {
        stack.push(word);
    }

    /**
     * Pushes an unsigned integer.
     *
     * @throws VmException with {@link VmError.Kind#VALUE_OVERFLOW} if it needs more than 256 bits.
     */
    public void pushUnsigned(BigInteger value) throws VmException {
        if (value.signum() < 0 || value.bitLength() > 256) {
            throw new VmException(VmError.of(VmError.Kind.VALUE_OVERFLOW, value.toString()));
        }
        stack.push(Word.fromUnsigned(value));
    }

    public void pushUnsigned(long value) throws VmException {
        pushUnsigned(BigInteger.valueOf(value));
    }

    /**
     * Pushes a signed integer.
     *
     * @throws VmException with {@link VmError.Kind#SIGNED_INTEGER_OUT_OF_BOUNDS} if it lies
     *                     outside the signed 256-bit range.
     */
    public void pushSigned(BigInteger value) throws VmException {
        if (value.compareTo(Word.MIN_SIGNED) < 0 || value.compareTo(Word.MAX_SIGNED) > 0) {
            throw new VmException(VmError.of(VmError.Kind.SIGNED_INTEGER_OUT_OF_BOUNDS, value.toString()));
        }
        stack.push(Word.fromSigned(value));
    }

    /**
     * Produces the result of a halted execution.
     */
    public ExecutionResult toResult() {
        return new ExecutionResult(stack.toList(), reverted, returnData);
    }
}
