package org.evmkit.runtime.isa.instructions;

import java.math.BigInteger;

import org.evmkit.compiler.ir.IrToken;
import org.evmkit.runtime.VmError;
import org.evmkit.runtime.VmException;
import org.evmkit.runtime.internal.services.ExecutionContext;
import org.evmkit.runtime.isa.Instruction;
import org.evmkit.runtime.isa.Opcode;
import org.evmkit.runtime.isa.OpcodeId;

/**
 * Handles control flow: STOP, JUMP, JUMPI, PC, RETURN, REVERT and INVALID.
 * <p>
 * A jump sets the program counter to the destination; the virtual machine then steps over the
 * {@code JUMPDEST} like over any other instruction.
 */
public class ControlFlowInstruction extends Instruction {

    /**
     * Registers all control flow instructions with the instruction registry.
     */
    public static void register() {
        reg(Opcode.STOP);
        reg(Opcode.JUMP);
        reg(Opcode.JUMPI);
        reg(Opcode.PC);
        reg(Opcode.RETURN);
        reg(Opcode.REVERT);
        Instruction.registerOp(ControlFlowInstruction.class, ControlFlowInstruction::new, OpcodeId.INVALID, "INVALID");
    }

    private static void reg(Opcode opcode) {
        Instruction.registerOp(ControlFlowInstruction.class, ControlFlowInstruction::new, opcode);
    }

    /**
     * Constructs a new ControlFlowInstruction.
     * @param token The token being executed.
     */
    public ControlFlowInstruction(IrToken token) {
        super(token);
    }

    @Override
    public void execute(ExecutionContext context) throws VmException {
        if (token instanceof IrToken.Invalid) {
            throw new VmException(VmError.Kind.INVALID_OPERATION);
        }
        Opcode op = opcode();
        switch (op) {
            case STOP:
                context.halt(new byte[0], false);
                break;
            case JUMP:
                context.jumpTo(context.popUnsigned());
                break;
            case JUMPI: {
                BigInteger destination = context.popUnsigned();
                BigInteger condition = context.popUnsigned();
                if (condition.signum() != 0) {
                    context.jumpTo(destination);
                }
                break;
            }
            case PC:
                context.pushUnsigned(context.getPc());
                break;
            case RETURN:
            case REVERT: {
                BigInteger offset = context.popUnsigned();
                BigInteger size = context.popUnsigned();
                byte[] data = context.getMemory().read(offset, size);
                context.halt(data, op == Opcode.REVERT);
                break;
            }
            default:
                throw new IllegalStateException("Unhandled control flow instruction: " + op);
        }
    }
}
