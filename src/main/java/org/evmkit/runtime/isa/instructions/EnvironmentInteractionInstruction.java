package org.evmkit.runtime.isa.instructions;

import java.util.EnumSet;
import java.util.Set;

import org.evmkit.compiler.ir.IrToken;
import org.evmkit.runtime.VmError;
import org.evmkit.runtime.VmException;
import org.evmkit.runtime.internal.services.ExecutionContext;
import org.evmkit.runtime.isa.Instruction;
import org.evmkit.runtime.isa.Opcode;

/**
 * Instructions that depend on state outside the call: accounts, storage, block and chain
 * context, gas, logs, calls and contract creation.
 * <p>
 * The interpreter only evaluates pure code, so every one of these fails with
 * {@link VmError.Kind#IMPURE}.
 */
public class EnvironmentInteractionInstruction extends Instruction {

    /**
     * The opcodes rejected as impure.
     */
    public static final Set<Opcode> IMPURE_OPCODES = EnumSet.of(
            Opcode.ADDRESS, Opcode.BALANCE, Opcode.ORIGIN, Opcode.CALLER, Opcode.GASPRICE,
            Opcode.EXTCODESIZE, Opcode.EXTCODECOPY, Opcode.RETURNDATASIZE, Opcode.RETURNDATACOPY,
            Opcode.EXTCODEHASH,
            Opcode.BLOCKHASH, Opcode.COINBASE, Opcode.TIMESTAMP, Opcode.NUMBER, Opcode.PREVRANDAO,
            Opcode.GASLIMIT, Opcode.CHAINID, Opcode.SELFBALANCE, Opcode.BASEFEE, Opcode.BLOBHASH,
            Opcode.BLOBBASEFEE,
            Opcode.SLOAD, Opcode.SSTORE, Opcode.GAS,
            Opcode.LOG0, Opcode.LOG1, Opcode.LOG2, Opcode.LOG3, Opcode.LOG4,
            Opcode.CREATE, Opcode.CALL, Opcode.CALLCODE, Opcode.DELEGATECALL, Opcode.CREATE2,
            Opcode.STATICCALL, Opcode.SELFDESTRUCT);

    public static void register() {
        for (Opcode opcode : IMPURE_OPCODES) {
            Instruction.registerOp(EnvironmentInteractionInstruction.class, EnvironmentInteractionInstruction::new, opcode);
        }
    }

    public EnvironmentInteractionInstruction(IrToken token) {
        super(token);
    }

    @Override
    public void execute(ExecutionContext context) throws VmException {
        throw new VmException(VmError.impure(opcode()));
    }
}
