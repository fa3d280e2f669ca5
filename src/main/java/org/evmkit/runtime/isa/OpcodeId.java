package org.evmkit.runtime.isa;

/**
 * Helper class for classifying and encoding single-byte opcode values.
 *
 * <p>Opcode bytes use a 8-bit structure: {@code [FFFF][OOOO]}
 * <ul>
 *   <li>Family: 4 bits (0-15), position 4-7</li>
 *   <li>Operation: 4 bits (0-15), position 0-3</li>
 * </ul>
 *
 * <p>Three instruction families embed a small parameter in the byte itself and are not listed
 * in {@link Opcode}: {@code PUSH0..PUSH32} ({@code 0x5F-0x7F}), {@code DUP1..DUP16}
 * ({@code 0x80-0x8F}) and {@code SWAP1..SWAP16} ({@code 0x90-0x9F}). The sentinel byte
 * {@code 0xFE} ({@code INVALID}) is not listed either.
 *
 * <p>This class is thread-safe as it contains only static methods and immutable constants.
 */
public final class OpcodeId {

    /** Multiplier for family field: 2^4 = 16. */
    public static final int FAMILY_MULTIPLIER = 16;

    /** Opcode byte of {@code PUSH0}; {@code PUSHn} is {@code PUSH0 + n}. */
    public static final int PUSH0 = 0x5F;

    /** Largest immediate a push can carry, in bytes. */
    public static final int MAX_PUSH_SIZE = 32;

    /** Opcode byte of {@code DUP1}; {@code DUPn} is {@code DUP1 + n - 1}. */
    public static final int DUP1 = 0x80;

    /** Opcode byte of {@code SWAP1}; {@code SWAPn} is {@code SWAP1 + n - 1}. */
    public static final int SWAP1 = 0x90;

    /** Largest DUP/SWAP index. */
    public static final int MAX_STACK_INDEX = 16;

    /** The designated invalid instruction, also used as a raw-data carrier. */
    public static final int INVALID = 0xFE;

    private OpcodeId() {
        // Utility class - prevent instantiation
    }

    /**
     * Extracts the family component from an opcode byte.
     *
     * @param opcode the opcode byte to decompose
     * @return the family component (0-15)
     */
    public static int extractFamily(int opcode) {
        return (opcode & 0xFF) / FAMILY_MULTIPLIER;
    }

    public static boolean isPush(int opcode) {
        return opcode >= PUSH0 && opcode <= PUSH0 + MAX_PUSH_SIZE;
    }

    public static boolean isDup(int opcode) {
        return opcode >= DUP1 && opcode < DUP1 + MAX_STACK_INDEX;
    }

    public static boolean isSwap(int opcode) {
        return opcode >= SWAP1 && opcode < SWAP1 + MAX_STACK_INDEX;
    }

    /**
     * Returns the opcode byte of {@code PUSHn}.
     *
     * @param size the immediate size in bytes (0-32)
     * @return the opcode byte
     * @throws IllegalArgumentException if {@code size} is out of range
     */
    public static int push(int size) {
        if (size < 0 || size > MAX_PUSH_SIZE) {
            throw new IllegalArgumentException("Push size must be between 0 and " + MAX_PUSH_SIZE + ", got: " + size);
        }
        return PUSH0 + size;
    }

    /**
     * Returns the opcode byte of {@code DUPn}.
     *
     * @param n the stack index (1-16)
     * @return the opcode byte
     * @throws IllegalArgumentException if {@code n} is out of range
     */
    public static int dup(int n) {
        checkStackIndex(n);
        return DUP1 + n - 1;
    }

    /**
     * Returns the opcode byte of {@code SWAPn}.
     *
     * @param n the stack index (1-16)
     * @return the opcode byte
     * @throws IllegalArgumentException if {@code n} is out of range
     */
    public static int swap(int n) {
        checkStackIndex(n);
        return SWAP1 + n - 1;
    }

    /** Inverse of {@link #push(int)}. */
    public static int pushSize(int opcode) {
        return opcode - PUSH0;
    }

    /** Inverse of {@link #dup(int)}. */
    public static int dupIndex(int opcode) {
        return opcode - DUP1 + 1;
    }

    /** Inverse of {@link #swap(int)}. */
    public static int swapIndex(int opcode) {
        return opcode - SWAP1 + 1;
    }

    private static void checkStackIndex(int n) {
        if (n < 1 || n > MAX_STACK_INDEX) {
            throw new IllegalArgumentException("Stack index must be between 1 and " + MAX_STACK_INDEX + ", got: " + n);
        }
    }
}
