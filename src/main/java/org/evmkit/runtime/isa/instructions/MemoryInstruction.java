package org.evmkit.runtime.isa.instructions;

import java.math.BigInteger;

import org.evmkit.compiler.ir.IrToken;
import org.evmkit.runtime.VmError;
import org.evmkit.runtime.VmException;
import org.evmkit.runtime.internal.services.ExecutionContext;
import org.evmkit.runtime.isa.Instruction;
import org.evmkit.runtime.isa.Opcode;
import org.evmkit.runtime.model.Memory;
import org.evmkit.runtime.model.Word;

/**
 * Handles instructions that work on memory: MLOAD, MSTORE, MSTORE8, MSIZE, MCOPY and SHA3.
 * Every access grows memory to cover the touched range.
 */
public class MemoryInstruction extends Instruction {

    private static final BigInteger WORD_SIZE = BigInteger.valueOf(Word.SIZE);

    public static void register() {
        reg(Opcode.SHA3);
        reg(Opcode.MLOAD);
        reg(Opcode.MSTORE);
        reg(Opcode.MSTORE8);
        reg(Opcode.MSIZE);
        reg(Opcode.MCOPY);
    }

    private static void reg(Opcode opcode) {
        Instruction.registerOp(MemoryInstruction.class, MemoryInstruction::new, opcode);
    }

    public MemoryInstruction(IrToken token) {
        super(token);
    }

    @Override
    public void execute(ExecutionContext context) throws VmException {
        Memory memory = context.getMemory();
        Opcode op = opcode();
        switch (op) {
            case SHA3: {
                BigInteger offset = context.popUnsigned();
                BigInteger size = context.popUnsigned();
                byte[] digest = context.getHashFunction().hash(memory.read(offset, size));
                if (digest.length > Word.SIZE) {
                    throw new VmException(VmError.of(VmError.Kind.VALUE_OVERFLOW, "digest of " + digest.length + " bytes"));
                }
                context.push(Word.fromBytes(digest));
                break;
            }
            case MLOAD: {
                BigInteger offset = context.popUnsigned();
                context.push(Word.fromBytes(memory.read(offset, WORD_SIZE)));
                break;
            }
            case MSTORE: {
                BigInteger offset = context.popUnsigned();
                Word value = context.pop();
                memory.write(offset, value.toByteArray());
                break;
            }
            case MSTORE8: {
                BigInteger offset = context.popUnsigned();
                Word value = context.pop();
                memory.write(offset, new byte[] {(byte) value.byteAt(Word.SIZE - 1)});
                break;
            }
            case MSIZE:
                context.pushUnsigned(memory.size());
                break;
            case MCOPY: {
                BigInteger destOffset = context.popUnsigned();
                BigInteger offset = context.popUnsigned();
                BigInteger size = context.popUnsigned();
                byte[] value = memory.read(offset, size);
                memory.write(destOffset, value);
                break;
            }
            default:
                throw new IllegalStateException("Unhandled memory instruction: " + op);
        }
    }
}
