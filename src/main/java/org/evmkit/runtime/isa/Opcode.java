package org.evmkit.runtime.isa;

import java.util.Collections;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * The fixed table of single-byte instructions.
 *
 * <p>Each entry records its mnemonic, its byte value and the number of stack words it
 * consumes and produces. The parameterised families {@code PUSHn}, {@code DUPn},
 * {@code SWAPn} and the {@code INVALID} sentinel are byte ranges and are described by
 * {@link OpcodeId} instead.
 *
 * <p>Operand order follows the stack: the first input is the top of the stack when the
 * instruction executes.
 */
public enum Opcode {
    STOP(0x00, 0, 0),
    ADD(0x01, 2, 1),
    MUL(0x02, 2, 1),
    SUB(0x03, 2, 1),
    DIV(0x04, 2, 1),
    SDIV(0x05, 2, 1),
    MOD(0x06, 2, 1),
    SMOD(0x07, 2, 1),
    ADDMOD(0x08, 3, 1),
    MULMOD(0x09, 3, 1),
    EXP(0x0A, 2, 1),
    SIGNEXTEND(0x0B, 2, 1),

    LT(0x10, 2, 1),
    GT(0x11, 2, 1),
    SLT(0x12, 2, 1),
    SGT(0x13, 2, 1),
    EQ(0x14, 2, 1),
    ISZERO(0x15, 1, 1),
    AND(0x16, 2, 1),
    OR(0x17, 2, 1),
    XOR(0x18, 2, 1),
    NOT(0x19, 1, 1),
    BYTE(0x1A, 2, 1),
    SHL(0x1B, 2, 1),
    SHR(0x1C, 2, 1),
    SAR(0x1D, 2, 1),

    SHA3(0x20, 2, 1),

    ADDRESS(0x30, 0, 1),
    BALANCE(0x31, 1, 1),
    ORIGIN(0x32, 0, 1),
    CALLER(0x33, 0, 1),
    CALLVALUE(0x34, 0, 1),
    CALLDATALOAD(0x35, 1, 1),
    CALLDATASIZE(0x36, 0, 1),
    CALLDATACOPY(0x37, 3, 0),
    CODESIZE(0x38, 0, 1),
    CODECOPY(0x39, 3, 0),
    GASPRICE(0x3A, 0, 1),
    EXTCODESIZE(0x3B, 1, 1),
    EXTCODECOPY(0x3C, 4, 0),
    RETURNDATASIZE(0x3D, 0, 1),
    RETURNDATACOPY(0x3E, 3, 0),
    EXTCODEHASH(0x3F, 1, 1),

    BLOCKHASH(0x40, 1, 1),
    COINBASE(0x41, 0, 1),
    TIMESTAMP(0x42, 0, 1),
    NUMBER(0x43, 0, 1),
    PREVRANDAO(0x44, 0, 1),
    GASLIMIT(0x45, 0, 1),
    CHAINID(0x46, 0, 1),
    SELFBALANCE(0x47, 0, 1),
    BASEFEE(0x48, 0, 1),
    BLOBHASH(0x49, 1, 1),
    BLOBBASEFEE(0x4A, 0, 1),

    POP(0x50, 1, 0),
    MLOAD(0x51, 1, 1),
    MSTORE(0x52, 2, 0),
    MSTORE8(0x53, 2, 0),
    SLOAD(0x54, 1, 1),
    SSTORE(0x55, 2, 0),
    JUMP(0x56, 1, 0),
    JUMPI(0x57, 2, 0),
    PC(0x58, 0, 1),
    MSIZE(0x59, 0, 1),
    GAS(0x5A, 0, 1),
    JUMPDEST(0x5B, 0, 0),
    TLOAD(0x5C, 1, 1),
    TSTORE(0x5D, 2, 0),
    MCOPY(0x5E, 3, 0),

    LOG0(0xA0, 2, 0),
    LOG1(0xA1, 3, 0),
    LOG2(0xA2, 4, 0),
    LOG3(0xA3, 5, 0),
    LOG4(0xA4, 6, 0),

    CREATE(0xF0, 3, 1),
    CALL(0xF1, 7, 1),
    CALLCODE(0xF2, 7, 1),
    RETURN(0xF3, 2, 0),
    DELEGATECALL(0xF4, 6, 1),
    CREATE2(0xF5, 4, 1),
    STATICCALL(0xFA, 6, 1),
    REVERT(0xFD, 2, 0),
    SELFDESTRUCT(0xFF, 1, 0);

    private static final Map<Integer, Opcode> BY_BYTE;
    private static final Map<String, Opcode> BY_MNEMONIC;

    static {
        Map<Integer, Opcode> byByte = new HashMap<>();
        Map<String, Opcode> byMnemonic = new HashMap<>();
        for (Opcode op : values()) {
            byByte.put(op.byteValue, op);
            byMnemonic.put(op.name(), op);
        }
        BY_BYTE = Collections.unmodifiableMap(byByte);
        BY_MNEMONIC = Collections.unmodifiableMap(byMnemonic);
    }

    private final int byteValue;
    private final int inputs;
    private final int outputs;

    Opcode(int byteValue, int inputs, int outputs) {
        this.byteValue = byteValue;
        this.inputs = inputs;
        this.outputs = outputs;
    }

    public int byteValue() {
        return byteValue;
    }

    public int inputs() {
        return inputs;
    }

    public int outputs() {
        return outputs;
    }

    /**
     * Returns the family this opcode belongs to, see {@link Family}.
     */
    public int family() {
        return Family.of(byteValue);
    }

    /**
     * Returns the upper-case mnemonic, e.g. {@code "CALLDATALOAD"}.
     */
    public String mnemonic() {
        return name();
    }

    /**
     * Looks up a table entry by byte value.
     *
     * @param byteValue the opcode byte (0x00-0xFF)
     * @return the entry, or empty for range opcodes and unassigned bytes
     */
    public static Optional<Opcode> fromByte(int byteValue) {
        return Optional.ofNullable(BY_BYTE.get(byteValue & 0xFF));
    }

    /**
     * Looks up a table entry by mnemonic, ignoring case.
     *
     * @param mnemonic the mnemonic, e.g. {@code "mstore"}
     * @return the entry, or empty if no entry has that mnemonic
     */
    public static Optional<Opcode> fromMnemonic(String mnemonic) {
        if (mnemonic == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(BY_MNEMONIC.get(mnemonic.toUpperCase(Locale.ROOT)));
    }
}
