package org.evmkit.runtime.isa.instructions;

import java.math.BigInteger;

import org.evmkit.compiler.ir.IrToken;
import org.evmkit.runtime.VmException;
import org.evmkit.runtime.internal.services.ExecutionContext;
import org.evmkit.runtime.isa.Instruction;
import org.evmkit.runtime.isa.Opcode;
import org.evmkit.runtime.model.Word;

/**
 * Handles all bitwise instructions: AND, OR, XOR, NOT, BYTE and the shifts SHL, SHR and SAR.
 * <p>
 * Shift amounts are capped to 255, so any larger shift behaves like a shift by 255.
 */
public class BitwiseInstruction extends Instruction {

    private static final BigInteger MAX_SHIFT = BigInteger.valueOf(255);

    /**
     * Registers all bitwise instructions with the instruction registry.
     */
    public static void register() {
        reg(Opcode.AND);
        reg(Opcode.OR);
        reg(Opcode.XOR);
        reg(Opcode.NOT);
        reg(Opcode.BYTE);
        reg(Opcode.SHL);
        reg(Opcode.SHR);
        reg(Opcode.SAR);
    }

    private static void reg(Opcode opcode) {
        Instruction.registerOp(BitwiseInstruction.class, BitwiseInstruction::new, opcode);
    }

    /**
     * Constructs a new BitwiseInstruction.
     * @param token The token being executed.
     */
    public BitwiseInstruction(IrToken token) {
        super(token);
    }

    @Override
    public void execute(ExecutionContext context) throws VmException {
        Opcode op = opcode();
        switch (op) {
            case AND:
                context.pushUnsigned(context.popUnsigned().and(context.popUnsigned()));
                break;
            case OR:
                context.pushUnsigned(context.popUnsigned().or(context.popUnsigned()));
                break;
            case XOR:
                context.pushUnsigned(context.popUnsigned().xor(context.popUnsigned()));
                break;
            case NOT:
                context.pushUnsigned(context.popUnsigned().xor(Word.MAX_UNSIGNED));
                break;
            case BYTE: {
                BigInteger i = context.popUnsigned();
                Word x = context.pop();
                int value = i.compareTo(BigInteger.valueOf(Word.SIZE)) < 0 ? x.byteAt(i.intValue()) : 0;
                context.pushUnsigned(value);
                break;
            }
            case SHL: {
                int shift = cappedShift(context.popUnsigned());
                BigInteger value = context.popUnsigned();
                context.pushUnsigned(value.shiftLeft(shift).mod(Word.TWO_POW_256));
                break;
            }
            case SHR: {
                int shift = cappedShift(context.popUnsigned());
                BigInteger value = context.popUnsigned();
                context.pushUnsigned(value.shiftRight(shift));
                break;
            }
            case SAR: {
                int shift = cappedShift(context.popUnsigned());
                BigInteger value = context.popSigned();
                context.pushSigned(value.shiftRight(shift));
                break;
            }
            default:
                throw new IllegalStateException("Unhandled bitwise instruction: " + op);
        }
    }

    private static int cappedShift(BigInteger shift) {
        return shift.min(MAX_SHIFT).intValue();
    }
}
