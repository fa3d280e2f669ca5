package org.evmkit.runtime.isa.instructions;

import java.math.BigInteger;
import java.util.List;

import org.evmkit.compiler.ir.Program;
import org.evmkit.runtime.ExecutionOutcome;
import org.evmkit.runtime.VmError;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.evmkit.runtime.isa.Opcode.*;
import static org.evmkit.runtime.isa.instructions.VmTestSupport.*;

/**
 * Tests the instructions reading call data, call value and code.
 */
@Tag("unit")
class DataInstructionTest {

    private static final byte[] CALLDATA = bytes("0xbbccddeeff1122334455");

    @Test
    void testCallValueDefaultsToZero() {
        assertThat(stackOf(op(CALLVALUE), op(STOP))).containsExactly(word(0));
    }

    @Test
    void testCallValue() {
        assertThat(run(new byte[0], BigInteger.valueOf(55), op(CALLVALUE), op(STOP)).stack())
                .containsExactly(word(55));
    }

    @Test
    void testCallValueTooLargeForWordOverflows() {
        ExecutionOutcome outcome = VM.exec(new Program(List.of(op(CALLVALUE), op(STOP))),
                new byte[0], BigInteger.ONE.shiftLeft(256));
        assertThat(outcome.error().kind()).isEqualTo(VmError.Kind.VALUE_OVERFLOW);
    }

    @Test
    void testCallDataLoadPastEndReadsZero() {
        assertThat(stackOf(push1(100), op(CALLDATALOAD), op(STOP))).containsExactly(word(0));
    }

    @Test
    void testCallDataLoadIsZeroPadded() {
        assertThat(run(CALLDATA, BigInteger.ZERO, push1(5), op(CALLDATALOAD), op(STOP)).stack())
                .containsExactly(word("0x1122334455000000000000000000000000000000000000000000000000000000"));
    }

    @Test
    void testCallDataLoadPastMemoryLimitIsOutOfMemory() {
        assertThat(fail(push32(-1), op(CALLDATALOAD), op(STOP)).kind()).isEqualTo(VmError.Kind.OUT_OF_MEMORY);
    }

    @Test
    void testCallDataSize() {
        assertThat(stackOf(op(CALLDATASIZE), op(STOP))).containsExactly(word(0));
        assertThat(run(CALLDATA, BigInteger.ZERO, op(CALLDATASIZE), op(STOP)).stack()).containsExactly(word(10));
    }

    @Test
    void testCallDataCopyWithoutCallData() {
        assertThat(stackOf(
                push1(5), push1(1), push1(100), op(CALLDATACOPY),
                push32(101), op(MLOAD),
                op(STOP)))
                .containsExactly(word(0));
    }

    @Test
    void testCallDataCopy() {
        assertThat(run(CALLDATA, BigInteger.ZERO,
                push1(5), push1(1), push1(100), op(CALLDATACOPY),
                push32(101), op(MLOAD),
                op(STOP)).stack())
                .containsExactly(word("0xddeeff1100000000000000000000000000000000000000000000000000000000"));
    }

    @Test
    void testCodeSize() {
        assertThat(stackOf(op(CODESIZE), op(STOP))).containsExactly(word(2));
    }

    @Test
    void testCodeCopy() {
        // code: 6005 6001 6064 39 7f<32 bytes> 51 00
        assertThat(stackOf(
                push1(5), push1(1), push1(100), op(CODECOPY),
                push32(101), op(MLOAD),
                op(STOP)))
                .containsExactly(word("0x6001606400000000000000000000000000000000000000000000000000000000"));
    }

    @Test
    void testCodeCopyPastEndIsZeroPadded() {
        assertThat(stackOf(
                push1(4), push1(8), push1(0), op(CODECOPY),
                push1(0), op(MLOAD),
                op(STOP)))
                .containsExactly(word("0x0051000000000000000000000000000000000000000000000000000000000000"));
    }
}
