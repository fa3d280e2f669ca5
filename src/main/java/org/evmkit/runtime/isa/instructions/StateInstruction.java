package org.evmkit.runtime.isa.instructions;

import org.evmkit.compiler.ir.IrToken;
import org.evmkit.runtime.VmException;
import org.evmkit.runtime.internal.services.ExecutionContext;
import org.evmkit.runtime.isa.Instruction;
import org.evmkit.runtime.isa.Opcode;
import org.evmkit.runtime.model.Word;

/**
 * Handles transient storage: TLOAD and TSTORE. The storage lives only for the current
 * execution; unset keys read as zero.
 */
public class StateInstruction extends Instruction {

    public static void register() {
        Instruction.registerOp(StateInstruction.class, StateInstruction::new, Opcode.TLOAD);
        Instruction.registerOp(StateInstruction.class, StateInstruction::new, Opcode.TSTORE);
    }

    public StateInstruction(IrToken token) {
        super(token);
    }

    @Override
    public void execute(ExecutionContext context) throws VmException {
        if (opcode() == Opcode.TLOAD) {
            Word key = context.pop();
            context.push(context.getTransientStorage().getOrDefault(key, Word.ZERO));
        } else {
            Word key = context.pop();
            Word value = context.pop();
            context.getTransientStorage().put(key, value);
        }
    }
}
