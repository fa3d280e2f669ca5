package org.evmkit.runtime;

import java.util.Arrays;

import org.bouncycastle.util.encoders.Hex;

/**
 * Outcome of {@link VirtualMachine#execCall}: the return data, tagged with whether the
 * execution reverted.
 *
 * @param reverted {@code true} if the execution ended with {@code REVERT}.
 * @param returnData The data returned or reverted with.
 */
public record CallResult(boolean reverted, byte[] returnData) {

    public CallResult {
        returnData = returnData.clone();
    }

    public static CallResult ok(byte[] returnData) {
        return new CallResult(false, returnData);
    }

    public static CallResult revert(byte[] returnData) {
        return new CallResult(true, returnData);
    }

    @Override
    public byte[] returnData() {
        return returnData.clone();
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof CallResult other && reverted == other.reverted && Arrays.equals(returnData, other.returnData);
    }

    @Override
    public int hashCode() {
        return 31 * Boolean.hashCode(reverted) + Arrays.hashCode(returnData);
    }

    @Override
    public String toString() {
        return (reverted ? "revert" : "ok") + " 0x" + Hex.toHexString(returnData);
    }
}
