package org.evmkit.runtime.isa.instructions;

import org.evmkit.compiler.ir.IrToken;
import org.evmkit.runtime.VmError;
import org.evmkit.runtime.model.ExecutionResult;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.evmkit.runtime.isa.Opcode.*;
import static org.evmkit.runtime.isa.instructions.VmTestSupport.*;

/**
 * Tests jumps, halting instructions and the program counter.
 */
@Tag("unit")
class ControlFlowInstructionTest {

    private static final String PATTERN = "0x112233445566778899aabbccddeeff112233445566778899aabbccddeeff1122";

    private static IrToken[] directJump(int target) {
        return new IrToken[] {
            push1(target),      // 0
            op(JUMP),           // 2
            op(JUMPDEST),       // 3
            push1(2),           // 4
            op(STOP),           // 6
            op(JUMPDEST),       // 7
            push1(3),           // 8
            op(STOP)            // 10
        };
    }

    private static IrToken[] conditionalJump(int condition, int target) {
        return new IrToken[] {
            push1(condition),   // 0
            push1(target),      // 2
            op(JUMPI),          // 4
            push1(2),           // 5
            op(STOP),           // 7
            op(JUMPDEST),       // 8
            push1(3),           // 9
            op(STOP)            // 11
        };
    }

    @Test
    void testJumpToFirstDestination() {
        assertThat(stackOf(directJump(3))).containsExactly(word(2));
    }

    @Test
    void testJumpToSecondDestination() {
        assertThat(stackOf(directJump(7))).containsExactly(word(3));
    }

    @Test
    void testJumpToNonDestinationFails() {
        assertThat(fail(directJump(1)).kind()).isEqualTo(VmError.Kind.INVALID_JUMP_DEST);
    }

    @Test
    void testJumpPastEndFails() {
        assertThat(fail(directJump(200)).kind()).isEqualTo(VmError.Kind.INVALID_JUMP_DEST);
    }

    @Test
    void testJumpIntoPushDataFails() {
        // 0x5b inside the immediate of a push is data, not a destination
        assertThat(fail(new IrToken.Push(2, new byte[] {0x5b, 0x5b}), push1(1), op(JUMP)).kind())
                .isEqualTo(VmError.Kind.INVALID_JUMP_DEST);
    }

    @Test
    void testConditionalJumpTaken() {
        assertThat(stackOf(conditionalJump(111, 8))).containsExactly(word(3));
    }

    @Test
    void testConditionalJumpFallsThrough() {
        assertThat(stackOf(conditionalJump(0, 8))).containsExactly(word(2));
    }

    @Test
    void testConditionalJumpChecksDestinationOnlyWhenTaken() {
        assertThat(stackOf(conditionalJump(0, 1))).containsExactly(word(2));
        assertThat(fail(conditionalJump(1, 0)).kind()).isEqualTo(VmError.Kind.INVALID_JUMP_DEST);
    }

    @Test
    void testPc() {
        assertThat(stackOf(push1(1), push1(0), op(POP), op(POP), op(PC), op(STOP))).containsExactly(word(6));
    }

    @Test
    void testStopReturnsNothing() {
        ExecutionResult result = run(push1(1), op(STOP));
        assertThat(result.reverted()).isFalse();
        assertThat(result.returnData()).isEmpty();
        assertThat(result.stack()).containsExactly(word(1));
    }

    @Test
    void testReturn() {
        ExecutionResult result = run(push32(PATTERN), push32(100), op(MSTORE), push32(10), push32(110), op(RETURN));
        assertThat(result.reverted()).isFalse();
        assertThat(result.returnData()).isEqualTo(bytes("0xbbccddeeff1122334455"));
    }

    @Test
    void testRevert() {
        ExecutionResult result = run(push32(PATTERN), push32(100), op(MSTORE), push32(10), push32(110), op(REVERT));
        assertThat(result.reverted()).isTrue();
        assertThat(result.returnData()).isEqualTo(bytes("0xbbccddeeff1122334455"));
    }

    @Test
    void testReturnOfUnwrittenMemoryIsZeros() {
        assertThat(run(push1(3), push1(0), op(RETURN)).returnData()).isEqualTo(new byte[3]);
    }

    @Test
    void testInvalid() {
        assertThat(fail(new IrToken.Invalid(new byte[] {0x11}), op(STOP)).kind())
                .isEqualTo(VmError.Kind.INVALID_OPERATION);
    }

    @Test
    void testRunningOffTheEndIsOutOfBounds() {
        assertThat(fail(push1(1)).kind()).isEqualTo(VmError.Kind.PC_OUT_OF_BOUNDS);
    }

    @Test
    void testJumpDestIsNoOp() {
        assertThat(stackOf(op(JUMPDEST), push1(7), op(JUMPDEST), op(STOP))).containsExactly(word(7));
    }
}
