package org.evmkit.runtime.isa.instructions;

import java.math.BigInteger;

import org.evmkit.compiler.ir.IrToken;
import org.evmkit.runtime.VmException;
import org.evmkit.runtime.internal.services.ExecutionContext;
import org.evmkit.runtime.isa.Instruction;
import org.evmkit.runtime.isa.Opcode;
import org.evmkit.runtime.model.Word;

/**
 * Handles arithmetic: ADD, MUL, SUB, DIV, SDIV, MOD, SMOD, ADDMOD, MULMOD, EXP and SIGNEXTEND.
 * <p>
 * Unsigned results wrap modulo {@code 2^256}. A zero divisor or modulus yields zero. Signed
 * division truncates toward zero and the signed remainder takes the sign of the dividend.
 */
public class ArithmeticInstruction extends Instruction {

    private static final BigInteger MODULUS = Word.TWO_POW_256;

    /**
     * Registers all arithmetic instructions with the instruction registry.
     */
    public static void register() {
        reg(Opcode.ADD);
        reg(Opcode.MUL);
        reg(Opcode.SUB);
        reg(Opcode.DIV);
        reg(Opcode.SDIV);
        reg(Opcode.MOD);
        reg(Opcode.SMOD);
        reg(Opcode.ADDMOD);
        reg(Opcode.MULMOD);
        reg(Opcode.EXP);
        reg(Opcode.SIGNEXTEND);
    }

    private static void reg(Opcode opcode) {
        Instruction.registerOp(ArithmeticInstruction.class, ArithmeticInstruction::new, opcode);
    }

    /**
     * Constructs a new ArithmeticInstruction.
     * @param token The token being executed.
     */
    public ArithmeticInstruction(IrToken token) {
        super(token);
    }

    @Override
    public void execute(ExecutionContext context) throws VmException {
        Opcode op = opcode();
        switch (op) {
            case ADD: {
                BigInteger a = context.popUnsigned();
                BigInteger b = context.popUnsigned();
                context.pushUnsigned(a.add(b).mod(MODULUS));
                break;
            }
            case MUL: {
                BigInteger a = context.popUnsigned();
                BigInteger b = context.popUnsigned();
                context.pushUnsigned(a.multiply(b).mod(MODULUS));
                break;
            }
            case SUB: {
                BigInteger a = context.popUnsigned();
                BigInteger b = context.popUnsigned();
                context.pushUnsigned(a.subtract(b).mod(MODULUS));
                break;
            }
            case DIV: {
                BigInteger a = context.popUnsigned();
                BigInteger b = context.popUnsigned();
                context.pushUnsigned(b.signum() == 0 ? BigInteger.ZERO : a.divide(b));
                break;
            }
            case SDIV: {
                BigInteger a = context.popSigned();
                BigInteger b = context.popSigned();
                // -2^255 / -1 does not fit and is reported, not wrapped
                context.pushSigned(b.signum() == 0 ? BigInteger.ZERO : a.divide(b));
                break;
            }
            case MOD: {
                BigInteger a = context.popUnsigned();
                BigInteger b = context.popUnsigned();
                context.pushUnsigned(b.signum() == 0 ? BigInteger.ZERO : a.mod(b));
                break;
            }
            case SMOD: {
                BigInteger a = context.popSigned();
                BigInteger b = context.popSigned();
                context.pushSigned(b.signum() == 0 ? BigInteger.ZERO : a.remainder(b));
                break;
            }
            case ADDMOD: {
                BigInteger a = context.popUnsigned();
                BigInteger b = context.popUnsigned();
                BigInteger n = context.popUnsigned();
                context.pushUnsigned(n.signum() == 0 ? BigInteger.ZERO : a.add(b).mod(n));
                break;
            }
            case MULMOD: {
                BigInteger a = context.popUnsigned();
                BigInteger b = context.popUnsigned();
                BigInteger n = context.popUnsigned();
                context.pushUnsigned(n.signum() == 0 ? BigInteger.ZERO : a.multiply(b).mod(n));
                break;
            }
            case EXP: {
                BigInteger base = context.popUnsigned();
                BigInteger exponent = context.popUnsigned();
                context.pushUnsigned(base.modPow(exponent, MODULUS));
                break;
            }
            case SIGNEXTEND: {
                BigInteger b = context.popUnsigned();
                Word x = context.pop();
                context.push(signExtend(b, x));
                break;
            }
            default:
                throw new IllegalStateException("Unhandled arithmetic instruction: " + op);
        }
    }

    /**
     * Extends the sign bit of the low {@code b + 1} bytes of {@code x} over the whole word.
     * For {@code b >= 31} the word is returned unchanged.
     */
    static Word signExtend(BigInteger b, Word x) {
        if (b.compareTo(BigInteger.valueOf(31)) >= 0) {
            return x;
        }
        int valueLength = b.intValue() + 1;
        int signByte = Word.SIZE - valueLength;
        if ((x.byteAt(signByte) & 0x80) == 0) {
            return x;
        }
        byte[] bytes = x.toByteArray();
        for (int i = 0; i < signByte; i++) {
            bytes[i] = (byte) 0xFF;
        }
        return Word.fromBytes(bytes);
    }
}
