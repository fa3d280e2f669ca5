package org.evmkit.runtime.isa.instructions;

import java.math.BigInteger;

import org.evmkit.compiler.ir.IrToken;
import org.evmkit.runtime.VmException;
import org.evmkit.runtime.internal.services.ExecutionContext;
import org.evmkit.runtime.isa.Instruction;
import org.evmkit.runtime.isa.Opcode;
import org.evmkit.runtime.model.Memory;
import org.evmkit.runtime.model.Word;

/**
 * Handles instructions that read the call input and the executing code:
 * CALLVALUE, CALLDATALOAD, CALLDATASIZE, CALLDATACOPY, CODESIZE and CODECOPY.
 * Reads past the end of calldata or code yield zero bytes.
 */
public class DataInstruction extends Instruction {

    private static final BigInteger WORD_SIZE = BigInteger.valueOf(Word.SIZE);

    public static void register() {
        reg(Opcode.CALLVALUE);
        reg(Opcode.CALLDATALOAD);
        reg(Opcode.CALLDATASIZE);
        reg(Opcode.CALLDATACOPY);
        reg(Opcode.CODESIZE);
        reg(Opcode.CODECOPY);
    }

    private static void reg(Opcode opcode) {
        Instruction.registerOp(DataInstruction.class, DataInstruction::new, opcode);
    }

    public DataInstruction(IrToken token) {
        super(token);
    }

    @Override
    public void execute(ExecutionContext context) throws VmException {
        long maxBytes = context.getLimits().maxMemoryBytes();
        Opcode op = opcode();
        switch (op) {
            case CALLVALUE:
                context.pushUnsigned(context.getInput().value());
                break;
            case CALLDATALOAD: {
                BigInteger i = context.popUnsigned();
                context.push(Word.fromBytes(Memory.readZeroPadded(context.getInput().calldata(), i, WORD_SIZE, maxBytes)));
                break;
            }
            case CALLDATASIZE:
                context.pushUnsigned(context.getInput().calldataSize());
                break;
            case CALLDATACOPY:
                copyToMemory(context, context.getInput().calldata(), maxBytes);
                break;
            case CODESIZE:
                context.pushUnsigned(context.getCode().length);
                break;
            case CODECOPY:
                copyToMemory(context, context.getCode(), maxBytes);
                break;
            default:
                throw new IllegalStateException("Unhandled data instruction: " + op);
        }
    }

    private static void copyToMemory(ExecutionContext context, byte[] source, long maxBytes) throws VmException {
        BigInteger destOffset = context.popUnsigned();
        BigInteger offset = context.popUnsigned();
        BigInteger size = context.popUnsigned();
        byte[] slice = Memory.readZeroPadded(source, offset, size, maxBytes);
        context.getMemory().write(destOffset, slice);
    }
}
