package org.evmkit.compiler.ir;

import java.util.Arrays;
import java.util.Objects;

import org.bouncycastle.util.encoders.Hex;
import org.evmkit.runtime.isa.Opcode;
import org.evmkit.runtime.isa.OpcodeId;

/**
 * One instruction of a linear program.
 * <p>
 * The assembler produces a mix of concrete instructions and placeholders
 * ({@link JumpPointer}, {@link JumpDest}, {@link SelfCodeSize}). Jump resolution replaces every
 * placeholder with a concrete instruction; only concrete instructions can be encoded.
 */
public sealed interface IrToken
        permits IrToken.Plain, IrToken.Push, IrToken.Dup, IrToken.Swap, IrToken.Invalid,
                IrToken.JumpPointer, IrToken.JumpDest, IrToken.SelfCodeSize {

    /** Width in bytes of a resolved jump or code-size address. */
    int ADDRESS_WIDTH = 3;

    /**
     * Returns the number of bytes this token occupies once encoded. Placeholders report the
     * size of the instruction that replaces them.
     */
    int size();

    /**
     * Returns whether this token is a placeholder that jump resolution must rewrite.
     */
    default boolean isPlaceholder() {
        return false;
    }

    /**
     * An instruction from the fixed table with no immediate bytes.
     * @param opcode The table entry.
     */
    record Plain(Opcode opcode) implements IrToken {
        public Plain {
            Objects.requireNonNull(opcode, "opcode");
        }

        @Override
        public int size() {
            return 1;
        }

        @Override
        public String toString() {
            return opcode.mnemonic();
        }
    }

    /**
     * {@code PUSHn} with its immediate bytes.
     * @param width The immediate width, 0-32.
     * @param value The big-endian immediate, exactly {@code width} bytes.
     */
    record Push(int width, byte[] value) implements IrToken {
        public Push {
            Objects.requireNonNull(value, "value");
            if (width < 0 || width > OpcodeId.MAX_PUSH_SIZE) {
                throw new IllegalArgumentException("Push width must be between 0 and 32, got: " + width);
            }
            if (value.length != width) {
                throw new IllegalArgumentException("Push" + width + " requires " + width + " bytes, got: " + value.length);
            }
            value = value.clone();
        }

        /**
         * Creates a push whose width is the length of the given bytes.
         */
        public static Push of(byte[] value) {
            return new Push(value.length, value);
        }

        @Override
        public byte[] value() {
            return value.clone();
        }

        @Override
        public int size() {
            return width + 1;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Push other)) return false;
            return width == other.width && Arrays.equals(value, other.value);
        }

        @Override
        public int hashCode() {
            return 31 * width + Arrays.hashCode(value);
        }

        @Override
        public String toString() {
            return width == 0 ? "PUSH0" : "PUSH" + width + " 0x" + Hex.toHexString(value);
        }
    }

    /**
     * {@code DUPn}: copies the n-th stack word to the top.
     * @param n The stack index, 1-16.
     */
    record Dup(int n) implements IrToken {
        public Dup {
            OpcodeId.dup(n);
        }

        @Override
        public int size() {
            return 1;
        }

        @Override
        public String toString() {
            return "DUP" + n;
        }
    }

    /**
     * {@code SWAPn}: exchanges the top with the word n positions below it.
     * @param n The stack index, 1-16.
     */
    record Swap(int n) implements IrToken {
        public Swap {
            OpcodeId.swap(n);
        }

        @Override
        public int size() {
            return 1;
        }

        @Override
        public String toString() {
            return "SWAP" + n;
        }
    }

    /**
     * The designated invalid instruction followed by raw trailing bytes.
     * @param data Everything that follows the {@code 0xFE} byte.
     */
    record Invalid(byte[] data) implements IrToken {
        public Invalid {
            Objects.requireNonNull(data, "data");
            data = data.clone();
        }

        @Override
        public byte[] data() {
            return data.clone();
        }

        @Override
        public int size() {
            return 1 + data.length;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            return o instanceof Invalid other && Arrays.equals(data, other.data);
        }

        @Override
        public int hashCode() {
            return Arrays.hashCode(data);
        }

        @Override
        public String toString() {
            return data.length == 0 ? "INVALID" : "INVALID 0x" + Hex.toHexString(data);
        }
    }

    /**
     * Placeholder for a {@code PUSH3} of a label's byte offset.
     * @param label The jump label.
     */
    record JumpPointer(String label) implements IrToken {
        public JumpPointer {
            Objects.requireNonNull(label, "label");
        }

        @Override
        public int size() {
            return ADDRESS_WIDTH + 1;
        }

        @Override
        public boolean isPlaceholder() {
            return true;
        }
    }

    /**
     * Placeholder for a {@code JUMPDEST} that marks a label.
     * @param label The jump label.
     */
    record JumpDest(String label) implements IrToken {
        public JumpDest {
            Objects.requireNonNull(label, "label");
        }

        @Override
        public int size() {
            return 1;
        }

        @Override
        public boolean isPlaceholder() {
            return true;
        }
    }

    /**
     * Placeholder for a {@code PUSH3} of the total encoded program length.
     */
    record SelfCodeSize() implements IrToken {
        @Override
        public int size() {
            return ADDRESS_WIDTH + 1;
        }

        @Override
        public boolean isPlaceholder() {
            return true;
        }
    }
}
