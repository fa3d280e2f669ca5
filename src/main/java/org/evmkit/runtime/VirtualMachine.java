package org.evmkit.runtime;

import java.math.BigInteger;
import java.util.Objects;
import java.util.function.Function;
import java.util.function.IntFunction;

import org.evmkit.compiler.backend.emit.BytecodeEmitter;
import org.evmkit.compiler.ir.IrToken;
import org.evmkit.compiler.ir.Program;
import org.evmkit.runtime.internal.services.ExecutionContext;
import org.evmkit.runtime.internal.services.Keccak256HashFunction;
import org.evmkit.runtime.isa.Instruction;
import org.evmkit.runtime.isa.Opcode;
import org.evmkit.runtime.model.CallInput;
import org.evmkit.runtime.model.ExecutionResult;
import org.evmkit.runtime.services.Disassembler;
import org.evmkit.runtime.spi.IExecutionTracer;
import org.evmkit.runtime.spi.IHashFunction;
import org.evmkit.runtime.spi.TraceEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The core of the execution environment. Runs a program to completion over its own stack,
 * memory and transient storage.
 * <p>
 * Each step fetches the token at the program counter, plans the matching instruction through
 * the instruction registry, executes it and advances the program counter by the size of the
 * fetched token. A jump only moves the counter to the {@code JUMPDEST}, which the advance then
 * steps over.
 * <p>
 * An instance holds no per-execution state and can be shared between threads, provided its
 * hash function and tracer are thread-safe.
 */
public class VirtualMachine {

    private static final Logger LOG = LoggerFactory.getLogger(VirtualMachine.class);

    private final VmLimits limits;
    private final IHashFunction hashFunction;
    private final IExecutionTracer tracer;
    private final IntFunction<Function<IrToken, Instruction>> planners;
    private final Disassembler disassembler = new Disassembler();
    private final BytecodeEmitter emitter = new BytecodeEmitter();

    /**
     * Creates a VM with default limits, Keccak-256 hashing and no tracing.
     */
    public VirtualMachine() {
        this(VmLimits.DEFAULTS);
    }

    public VirtualMachine(VmLimits limits) {
        this(limits, new Keccak256HashFunction(), IExecutionTracer.NONE);
    }

    /**
     * Creates a VM using the standard instruction set.
     *
     * @param limits The resource limits.
     * @param hashFunction The hash primitive for {@code SHA3}.
     * @param tracer Observes every step.
     */
    public VirtualMachine(VmLimits limits, IHashFunction hashFunction, IExecutionTracer tracer) {
        this(limits, hashFunction, tracer, Instruction::getPlannerById);
    }

    /**
     * Creates a VM with a custom instruction lookup. Opcodes for which {@code planners} returns
     * {@code null} fail with {@link VmError.Kind#NOT_IMPLEMENTED}.
     *
     * @param limits The resource limits.
     * @param hashFunction The hash primitive for {@code SHA3}.
     * @param tracer Observes every step.
     * @param planners Maps an opcode byte to the planner of its instruction.
     */
    public VirtualMachine(VmLimits limits, IHashFunction hashFunction, IExecutionTracer tracer,
                          IntFunction<Function<IrToken, Instruction>> planners) {
        Instruction.init();
        this.limits = Objects.requireNonNull(limits, "limits");
        this.hashFunction = Objects.requireNonNull(hashFunction, "hashFunction");
        this.tracer = Objects.requireNonNull(tracer, "tracer");
        this.planners = Objects.requireNonNull(planners, "planners");
    }

    /**
     * Decodes and executes bytecode.
     *
     * @param code The bytecode.
     * @param calldata The call data.
     * @param value The call value.
     * @return The result, or the error that aborted the execution.
     * @throws org.evmkit.compiler.api.AssemblyException if the bytecode cannot be decoded.
     */
    public ExecutionOutcome exec(byte[] code, byte[] calldata, BigInteger value) {
        Program program = disassembler.decode(code);
        return run(program, code, new CallInput(calldata, value));
    }

    public ExecutionOutcome exec(byte[] code, byte[] calldata) {
        return exec(code, calldata, BigInteger.ZERO);
    }

    /**
     * Executes a resolved program.
     *
     * @param program The program, without placeholders.
     * @param calldata The call data.
     * @param value The call value.
     * @return The result, or the error that aborted the execution.
     * @throws org.evmkit.compiler.api.InvalidAssemblyException if the program still contains
     *         placeholders.
     */
    public ExecutionOutcome exec(Program program, byte[] calldata, BigInteger value) {
        byte[] code = emitter.emit(program);
        return run(program, code, new CallInput(calldata, value));
    }

    public ExecutionOutcome exec(Program program, byte[] calldata) {
        return exec(program, calldata, BigInteger.ZERO);
    }

    /**
     * Executes bytecode and returns its return data.
     *
     * @return {@link CallResult#ok} after {@code RETURN} or {@code STOP},
     *         {@link CallResult#revert} after {@code REVERT}.
     * @throws VmFailureException on any run-time error.
     */
    public CallResult execCall(byte[] code, byte[] calldata, BigInteger value) {
        return toCallResult(exec(code, calldata, value));
    }

    public CallResult execCall(byte[] code, byte[] calldata) {
        return execCall(code, calldata, BigInteger.ZERO);
    }

    /**
     * Executes a resolved program and returns its return data.
     *
     * @throws VmFailureException on any run-time error.
     */
    public CallResult execCall(Program program, byte[] calldata, BigInteger value) {
        return toCallResult(exec(program, calldata, value));
    }

    public CallResult execCall(Program program, byte[] calldata) {
        return execCall(program, calldata, BigInteger.ZERO);
    }

    private static CallResult toCallResult(ExecutionOutcome outcome) {
        if (!outcome.isSuccess()) {
            throw new VmFailureException(outcome.error());
        }
        ExecutionResult result = outcome.result();
        return result.reverted() ? CallResult.revert(result.returnData()) : CallResult.ok(result.returnData());
    }

    private ExecutionOutcome run(Program program, byte[] code, CallInput input) {
        ExecutionContext context = new ExecutionContext(program, code, input, limits, hashFunction);
        long step = 0;
        try {
            while (!context.isHalted()) {
                step(context, step++);
            }
        } catch (VmException e) {
            LOG.debug("Execution failed after {} steps at pc {}: {}", step, context.getPc(), e.getError());
            return ExecutionOutcome.failure(e.getError());
        }
        ExecutionResult result = context.toResult();
        LOG.debug("Execution halted after {} steps (reverted={}, {} bytes returned)",
                step, result.reverted(), result.returnData().length);
        return ExecutionOutcome.success(result);
    }

    private void step(ExecutionContext context, long step) throws VmException {
        int pc = context.getPc();
        IrToken token = context.tokenAt(pc);
        if (token == null) {
            throw new VmException(VmError.of(VmError.Kind.PC_OUT_OF_BOUNDS, "pc " + pc));
        }
        tracer.beforeInstruction(new TraceEvent(step, pc, token, context.getStack().depth(), context.getMemory().size()));
        if (LOG.isTraceEnabled()) {
            LOG.trace("{} {} (stack={})", String.format("%04x", pc), token, context.getStack().depth());
        }

        plan(token).execute(context);
        context.setPc(context.getPc() + token.size());
    }

    /**
     * Creates the instruction for a fetched token.
     *
     * @throws VmException with {@link VmError.Kind#NOT_IMPLEMENTED} if no instruction is
     *                     registered for the token's opcode.
     */
    private Instruction plan(IrToken token) throws VmException {
        int opcodeId = Instruction.opcodeIdOf(token);
        Function<IrToken, Instruction> planner = planners.apply(opcodeId);
        if (planner == null) {
            Opcode opcode = Opcode.fromByte(opcodeId).orElse(null);
            throw new VmException(new VmError(VmError.Kind.NOT_IMPLEMENTED, opcode,
                    opcode == null ? Instruction.getInstructionNameById(opcodeId) : null));
        }
        return planner.apply(token);
    }
}
