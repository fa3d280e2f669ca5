package org.evmkit.runtime.model;

import java.math.BigInteger;
import java.util.Objects;

/**
 * Read-only input of one execution.
 *
 * @param calldata The caller-supplied input bytes.
 * @param value The call value, a non-negative integer.
 */
public record CallInput(byte[] calldata, BigInteger value) {

    public CallInput {
        calldata = Objects.requireNonNull(calldata, "calldata").clone();
        Objects.requireNonNull(value, "value");
        if (value.signum() < 0) {
            throw new IllegalArgumentException("Call value must not be negative: " + value);
        }
    }

    @Override
    public byte[] calldata() {
        return calldata.clone();
    }

    /**
     * @return The calldata length without copying it.
     */
    public int calldataSize() {
        return calldata.length;
    }
}
