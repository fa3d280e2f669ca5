package org.evmkit.runtime.model;

import java.util.Arrays;
import java.util.List;

import org.bouncycastle.util.encoders.Hex;

/**
 * State of a halted execution.
 *
 * @param stack The final stack, top first.
 * @param reverted {@code true} if the execution ended with {@code REVERT}.
 * @param returnData The data passed to {@code RETURN} or {@code REVERT}; empty after {@code STOP}.
 */
public record ExecutionResult(List<Word> stack, boolean reverted, byte[] returnData) {

    public ExecutionResult {
        stack = List.copyOf(stack);
        returnData = returnData.clone();
    }

    @Override
    public byte[] returnData() {
        return returnData.clone();
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof ExecutionResult other
                && reverted == other.reverted
                && stack.equals(other.stack)
                && Arrays.equals(returnData, other.returnData);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * stack.hashCode() + Boolean.hashCode(reverted)) + Arrays.hashCode(returnData);
    }

    @Override
    public String toString() {
        return "ExecutionResult[stack=" + stack + ", reverted=" + reverted + ", returnData=0x" + Hex.toHexString(returnData) + "]";
    }
}
