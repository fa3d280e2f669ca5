package org.evmkit.runtime.isa;

/**
 * Constants defining instruction family IDs for the single-byte opcode space.
 *
 * <p>The family of an opcode is its high nibble. Each family therefore covers a range of 16
 * byte values; {@link #of(int)} derives it with {@link OpcodeId#extractFamily(int)}.
 *
 * <p>Family ranges:
 * <ul>
 *   <li>STOP_ARITHMETIC (0x0): 0x00-0x0F - STOP, ADD, SUB, MUL, DIV, etc.</li>
 *   <li>COMPARISON_BITWISE (0x1): 0x10-0x1F - LT, GT, EQ, AND, OR, shifts</li>
 *   <li>HASHING (0x2): 0x20-0x2F - SHA3</li>
 *   <li>ENVIRONMENT (0x3): 0x30-0x3F - call input, code and account information</li>
 *   <li>BLOCK (0x4): 0x40-0x4F - chain context</li>
 *   <li>STACK_MEMORY_FLOW (0x5): 0x50-0x5E - memory, storage, jumps</li>
 *   <li>PUSH (0x5F-0x7F) - spans three nibbles, see {@link OpcodeId#isPush(int)}</li>
 *   <li>DUP (0x8): 0x80-0x8F</li>
 *   <li>SWAP (0x9): 0x90-0x9F</li>
 *   <li>LOG (0xA): 0xA0-0xA4</li>
 *   <li>SYSTEM (0xF): 0xF0-0xFF - calls, creation, RETURN, REVERT, INVALID</li>
 * </ul>
 *
 * <p>This class is thread-safe as it contains only static constants and methods.
 */
public final class Family {

    /** STOP and arithmetic operations. Range: 0x00-0x0F. */
    public static final int STOP_ARITHMETIC = 0x0;

    /** Comparison and bitwise logic operations. Range: 0x10-0x1F. */
    public static final int COMPARISON_BITWISE = 0x1;

    /** Hashing. Range: 0x20-0x2F. */
    public static final int HASHING = 0x2;

    /** Environmental information. Range: 0x30-0x3F. */
    public static final int ENVIRONMENT = 0x3;

    /** Block information. Range: 0x40-0x4F. */
    public static final int BLOCK = 0x4;

    /** Stack, memory, storage and flow operations. Range: 0x50-0x5E. */
    public static final int STACK_MEMORY_FLOW = 0x5;

    /** Push operations. Range: 0x5F-0x7F. */
    public static final int PUSH = 0x6;

    /** Duplication operations. Range: 0x80-0x8F. */
    public static final int DUP = 0x8;

    /** Exchange operations. Range: 0x90-0x9F. */
    public static final int SWAP = 0x9;

    /** Logging operations. Range: 0xA0-0xA4. */
    public static final int LOG = 0xA;

    /** System operations. Range: 0xF0-0xFF. */
    public static final int SYSTEM = 0xF;

    private Family() {
        // Utility class - prevent instantiation
    }

    /**
     * Classifies an opcode byte into its family.
     *
     * @param byteValue the opcode byte (0x00-0xFF)
     * @return the family ID
     */
    public static int of(int byteValue) {
        if (OpcodeId.isPush(byteValue)) {
            return PUSH;
        }
        return OpcodeId.extractFamily(byteValue);
    }
}
