package org.evmkit.runtime.isa.instructions;

import java.math.BigInteger;

import org.evmkit.compiler.ir.IrToken;
import org.evmkit.runtime.VmException;
import org.evmkit.runtime.internal.services.ExecutionContext;
import org.evmkit.runtime.isa.Instruction;
import org.evmkit.runtime.isa.Opcode;
import org.evmkit.runtime.model.Word;

/**
 * Handles comparisons, which push 1 when the condition holds and 0 otherwise:
 * LT, GT, SLT, SGT, EQ and ISZERO.
 */
public class ConditionalInstruction extends Instruction {

    public static void register() {
        reg(Opcode.LT);
        reg(Opcode.GT);
        reg(Opcode.SLT);
        reg(Opcode.SGT);
        reg(Opcode.EQ);
        reg(Opcode.ISZERO);
    }

    private static void reg(Opcode opcode) {
        Instruction.registerOp(ConditionalInstruction.class, ConditionalInstruction::new, opcode);
    }

    public ConditionalInstruction(IrToken token) {
        super(token);
    }

    @Override
    public void execute(ExecutionContext context) throws VmException {
        Opcode op = opcode();
        boolean result;
        switch (op) {
            case LT:
                result = context.popUnsigned().compareTo(context.popUnsigned()) < 0;
                break;
            case GT:
                result = context.popUnsigned().compareTo(context.popUnsigned()) > 0;
                break;
            case SLT:
                result = context.popSigned().compareTo(context.popSigned()) < 0;
                break;
            case SGT:
                result = context.popSigned().compareTo(context.popSigned()) > 0;
                break;
            case EQ:
                result = context.pop().equals(context.pop());
                break;
            case ISZERO:
                result = context.popUnsigned().signum() == 0;
                break;
            default:
                throw new IllegalStateException("Unhandled conditional instruction: " + op);
        }
        context.push(result ? Word.ONE : Word.ZERO);
    }
}
