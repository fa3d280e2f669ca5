package org.evmkit.runtime.isa.instructions;

import org.evmkit.compiler.ir.IrToken;
import org.evmkit.runtime.VmError;
import org.evmkit.runtime.VmException;
import org.evmkit.runtime.internal.services.ExecutionContext;
import org.evmkit.runtime.isa.Instruction;
import org.evmkit.runtime.isa.Opcode;
import org.evmkit.runtime.isa.OpcodeId;
import org.evmkit.runtime.model.OperandStack;
import org.evmkit.runtime.model.Word;

/**
 * Handles stack manipulation: POP, PUSH0-PUSH32, DUP1-DUP16 and SWAP1-SWAP16.
 */
public class StackInstruction extends Instruction {

    /**
     * Registers all stack instructions with the instruction registry.
     */
    public static void register() {
        Instruction.registerOp(StackInstruction.class, StackInstruction::new, Opcode.POP);
        for (int n = 0; n <= OpcodeId.MAX_PUSH_SIZE; n++) {
            Instruction.registerOp(StackInstruction.class, StackInstruction::new, OpcodeId.push(n), "PUSH" + n);
        }
        for (int n = 1; n <= OpcodeId.MAX_STACK_INDEX; n++) {
            Instruction.registerOp(StackInstruction.class, StackInstruction::new, OpcodeId.dup(n), "DUP" + n);
            Instruction.registerOp(StackInstruction.class, StackInstruction::new, OpcodeId.swap(n), "SWAP" + n);
        }
    }

    /**
     * Constructs a new StackInstruction.
     * @param token The token being executed.
     */
    public StackInstruction(IrToken token) {
        super(token);
    }

    @Override
    public void execute(ExecutionContext context) throws VmException {
        OperandStack stack = context.getStack();
        if (token instanceof IrToken.Push push) {
            byte[] value = push.value();
            if (value.length != push.width()) {
                throw new VmException(VmError.of(VmError.Kind.INVALID_PUSH, push.toString()));
            }
            if (value.length > Word.SIZE) {
                throw new VmException(VmError.of(VmError.Kind.VALUE_OVERFLOW, push.toString()));
            }
            context.push(Word.fromBytes(value));
        } else if (token instanceof IrToken.Dup dup) {
            context.push(stack.peek(dup.n() - 1));
        } else if (token instanceof IrToken.Swap swap) {
            Word high = stack.peek(swap.n());
            Word low = stack.peek(0);
            stack.set(swap.n(), low);
            stack.set(0, high);
        } else {
            // POP
            context.pop();
        }
    }
}
