package org.evmkit.runtime.isa;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.function.Function;

import org.evmkit.compiler.ir.IrToken;
import org.evmkit.runtime.VmException;
import org.evmkit.runtime.internal.services.ExecutionContext;
import org.evmkit.runtime.isa.instructions.ArithmeticInstruction;
import org.evmkit.runtime.isa.instructions.BitwiseInstruction;
import org.evmkit.runtime.isa.instructions.ConditionalInstruction;
import org.evmkit.runtime.isa.instructions.ControlFlowInstruction;
import org.evmkit.runtime.isa.instructions.DataInstruction;
import org.evmkit.runtime.isa.instructions.EnvironmentInteractionInstruction;
import org.evmkit.runtime.isa.instructions.MemoryInstruction;
import org.evmkit.runtime.isa.instructions.NopInstruction;
import org.evmkit.runtime.isa.instructions.StackInstruction;
import org.evmkit.runtime.isa.instructions.StateInstruction;

/**
 * The abstract base class for all instructions of the interpreter.
 * <p>
 * Instruction families register a planner per opcode byte. For each step the virtual machine
 * looks up the planner of the fetched token's opcode, creates the instruction and executes it.
 */
public abstract class Instruction {

    /**
     * A public record describing the properties of a registered instruction.
     */
    public record InstructionInfo(int opcodeId, String name, Class<? extends Instruction> family) {}

    // Runtime Registries
    private static final Map<Integer, Class<? extends Instruction>> REGISTERED_INSTRUCTIONS_BY_ID = new HashMap<>();
    private static final Map<Integer, String> ID_TO_NAME = new HashMap<>();
    private static final Map<Integer, Function<IrToken, Instruction>> REGISTERED_PLANNERS_BY_ID = new HashMap<>();

    private static boolean initialized = false;

    protected final IrToken token;
    protected final int opcodeId;

    /**
     * Constructs a new instruction.
     * @param token The token being executed.
     */
    protected Instruction(IrToken token) {
        this.token = token;
        this.opcodeId = opcodeIdOf(token);
    }

    /**
     * Executes the instruction against the given context.
     *
     * @param context The execution context.
     * @throws VmException if the instruction fails; the execution is aborted.
     */
    public abstract void execute(ExecutionContext context) throws VmException;

    /**
     * Initializes the instruction set by registering all instruction families.
     * Each instruction class is responsible for registering its own opcodes.
     * Calling this more than once has no further effect.
     */
    public static synchronized void init() {
        if (initialized) {
            return;
        }
        NopInstruction.register();
        ArithmeticInstruction.register();
        ConditionalInstruction.register();
        BitwiseInstruction.register();
        MemoryInstruction.register();
        DataInstruction.register();
        StackInstruction.register();
        StateInstruction.register();
        ControlFlowInstruction.register();
        EnvironmentInteractionInstruction.register();
        initialized = true;
    }

    /**
     * Registers an instruction opcode. Called by instruction subclasses in their register() method.
     *
     * @param familyClass The implementing family class.
     * @param planner Creates the instruction for a fetched token.
     * @param opcodeId The opcode byte.
     * @param name The mnemonic.
     */
    protected static void registerOp(Class<? extends Instruction> familyClass, Function<IrToken, Instruction> planner,
                                     int opcodeId, String name) {
        if (REGISTERED_PLANNERS_BY_ID.containsKey(opcodeId)) {
            throw new IllegalStateException(String.format("Opcode 0x%02x registered twice (%s, %s)",
                    opcodeId, ID_TO_NAME.get(opcodeId), name));
        }
        REGISTERED_INSTRUCTIONS_BY_ID.put(opcodeId, familyClass);
        ID_TO_NAME.put(opcodeId, name);
        REGISTERED_PLANNERS_BY_ID.put(opcodeId, planner);
    }

    /**
     * Convenience overload for table opcodes.
     */
    protected static void registerOp(Class<? extends Instruction> familyClass, Function<IrToken, Instruction> planner,
                                     Opcode opcode) {
        registerOp(familyClass, planner, opcode.byteValue(), opcode.mnemonic());
    }

    /**
     * Returns the opcode byte a token encodes to.
     *
     * @param token A concrete (non-placeholder) token.
     * @return The opcode byte.
     * @throws IllegalArgumentException if the token is a placeholder.
     */
    public static int opcodeIdOf(IrToken token) {
        if (token instanceof IrToken.Plain plain) return plain.opcode().byteValue();
        if (token instanceof IrToken.Push push) return OpcodeId.push(push.width());
        if (token instanceof IrToken.Dup dup) return OpcodeId.dup(dup.n());
        if (token instanceof IrToken.Swap swap) return OpcodeId.swap(swap.n());
        if (token instanceof IrToken.Invalid) return OpcodeId.INVALID;
        throw new IllegalArgumentException("Placeholder has no opcode: " + token);
    }

    /**
     * @return The mnemonic of this instruction, e.g. {@code "ADD"} or {@code "PUSH4"}.
     */
    public final String getName() { return ID_TO_NAME.getOrDefault(this.opcodeId, "UNKNOWN"); }

    /**
     * @return The opcode byte of this instruction.
     */
    public int getOpcodeId() { return this.opcodeId; }

    /**
     * @return The token being executed.
     */
    public IrToken getToken() { return this.token; }

    /**
     * @return The table entry of this instruction.
     * @throws IllegalStateException if the token is not a table instruction.
     */
    protected Opcode opcode() {
        if (token instanceof IrToken.Plain plain) {
            return plain.opcode();
        }
        throw new IllegalStateException("Not a table instruction: " + token);
    }

    /**
     * Returns the planner registered for an opcode byte.
     * @param id The opcode byte.
     * @return The planner, or {@code null} if no instruction is registered for the byte.
     */
    public static Function<IrToken, Instruction> getPlannerById(int id) { return REGISTERED_PLANNERS_BY_ID.get(id); }

    /**
     * @param id The opcode byte.
     * @return The registered mnemonic, or {@code "UNKNOWN"}.
     */
    public static String getInstructionNameById(int id) { return ID_TO_NAME.getOrDefault(id, "UNKNOWN"); }

    /**
     * Retrieves the implementing class for a given opcode byte.
     *
     * @param opcodeId The opcode byte.
     * @return The family class, or {@code null} if not found.
     */
    public static Class<? extends Instruction> getInstructionClassById(int opcodeId) {
        return REGISTERED_INSTRUCTIONS_BY_ID.get(opcodeId);
    }

    /**
     * Returns a list of public information records for all registered instructions, ordered by
     * opcode byte.
     *
     * @return An unmodifiable list of {@link InstructionInfo} records.
     */
    public static List<InstructionInfo> getInstructionSetInfo() {
        init();
        List<InstructionInfo> info = new ArrayList<>();
        for (Map.Entry<Integer, Class<? extends Instruction>> e : new TreeMap<>(REGISTERED_INSTRUCTIONS_BY_ID).entrySet()) {
            info.add(new InstructionInfo(e.getKey(), ID_TO_NAME.get(e.getKey()), e.getValue()));
        }
        return Collections.unmodifiableList(info);
    }
}
