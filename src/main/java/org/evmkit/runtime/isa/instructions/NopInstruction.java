package org.evmkit.runtime.isa.instructions;

import org.evmkit.compiler.ir.IrToken;
import org.evmkit.runtime.internal.services.ExecutionContext;
import org.evmkit.runtime.isa.Instruction;
import org.evmkit.runtime.isa.Opcode;

/**
 * JUMPDEST: marks a valid jump target and does nothing when executed.
 */
public class NopInstruction extends Instruction {

    public static void register() {
        Instruction.registerOp(NopInstruction.class, NopInstruction::new, Opcode.JUMPDEST);
    }

    public NopInstruction(IrToken token) {
        super(token);
    }

    @Override
    public void execute(ExecutionContext context) {
        // Do nothing.
    }
}
