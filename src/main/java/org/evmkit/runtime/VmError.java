package org.evmkit.runtime;

import java.util.Locale;
import java.util.Objects;

import org.evmkit.runtime.isa.Opcode;

/**
 * A run-time failure of one execution.
 *
 * @param kind What went wrong.
 * @param opcode The instruction involved, present for {@link Kind#IMPURE} and
 *               {@link Kind#NOT_IMPLEMENTED}.
 * @param detail Optional human-readable context, e.g. the offending push.
 */
public record VmError(Kind kind, Opcode opcode, String detail) {

    /**
     * The closed set of run-time failures.
     */
    public enum Kind {
        PC_OUT_OF_BOUNDS,
        STACK_UNDERFLOW,
        STACK_OVERFLOW,
        VALUE_OVERFLOW,
        SIGNED_INTEGER_OUT_OF_BOUNDS,
        OUT_OF_MEMORY,
        INVALID_OPERATION,
        INVALID_JUMP_DEST,
        INVALID_PUSH,
        IMPURE,
        NOT_IMPLEMENTED
    }

    public VmError {
        Objects.requireNonNull(kind, "kind");
    }

    public static VmError of(Kind kind) {
        return new VmError(kind, null, null);
    }

    public static VmError of(Kind kind, String detail) {
        return new VmError(kind, null, detail);
    }

    public static VmError impure(Opcode opcode) {
        return new VmError(Kind.IMPURE, opcode, null);
    }

    public static VmError notImplemented(Opcode opcode) {
        return new VmError(Kind.NOT_IMPLEMENTED, opcode, null);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(kind.name().toLowerCase(Locale.ROOT));
        if (opcode != null) {
            sb.append('(').append(opcode.mnemonic()).append(')');
        }
        if (detail != null) {
            sb.append(": ").append(detail);
        }
        return sb.toString();
    }
}
