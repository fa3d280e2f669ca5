package org.evmkit.runtime.isa.instructions;

import org.evmkit.compiler.ir.IrToken;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.evmkit.runtime.isa.Opcode.*;
import static org.evmkit.runtime.isa.instructions.VmTestSupport.*;

/**
 * Tests the bitwise instructions, including the shift vectors of EIP-145.
 */
@Tag("unit")
class BitwiseInstructionTest {

    private static final String A = "0xffffffffffffffffffffffffffffffffffffffffffffffffffffffffffff00ff";
    private static final String B = "0xffffffffffffffffffffffffffffffffffffffffffffffffffffffffffffff11";
    private static final String PATTERN = "0x112233445566778899aabbccddeeff112233445566778899aabbccddeeff1122";

    @Test
    void testAnd() {
        assertThat(stackOf(push32(A), push32(B), op(AND), op(STOP)))
                .containsExactly(word("0xffffffffffffffffffffffffffffffffffffffffffffffffffffffffffff0011"));
    }

    @Test
    void testOr() {
        assertThat(stackOf(push32(A), push32(B), op(OR), op(STOP)))
                .containsExactly(word("0xffffffffffffffffffffffffffffffffffffffffffffffffffffffffffffffff"));
    }

    @Test
    void testXor() {
        assertThat(stackOf(push32(A), push32(B), op(XOR), op(STOP))).containsExactly(word(0xffee));
    }

    @Test
    void testNot() {
        assertThat(stackOf(push32("0xffffffffffffffffffffffffffffffffffffffffffffffffffffffffffff2211"), op(NOT), op(STOP)))
                .containsExactly(word(0xddee));
    }

    @ParameterizedTest(name = "byte {0}")
    @CsvSource({"31, 0x33", "30, 0x22", "0, 0x11", "99, 0x00"})
    void testByte(long index, String expected) {
        assertThat(stackOf(push32("0x1100000000000000000000000000000000000000000000000000000000002233"),
                push32(index), op(BYTE), op(STOP)))
                .containsExactly(word(expected));
    }

    @ParameterizedTest(name = "shl {1}")
    @CsvSource({
        PATTERN + ", 0, " + PATTERN,
        PATTERN + ", 1, 0x22446688aaccef1133557799bbddfe22446688aaccef1133557799bbddfe2244",
        PATTERN + ", 8, 0x2233445566778899aabbccddeeff112233445566778899aabbccddeeff112200",
        "0x112233445566778899aabbccddeeff112233445566778899aabbccddeeff1111, 255, "
                + "0x8000000000000000000000000000000000000000000000000000000000000000"
    })
    void testShl(String value, long shift, String expected) {
        assertThat(stackOf(push32(value), push32(shift), op(SHL), op(STOP))).containsExactly(word(expected));
    }

    @ParameterizedTest(name = "shr {1}")
    @CsvSource({
        PATTERN + ", 0, " + PATTERN,
        PATTERN + ", 1, 0x089119a22ab33bc44cd55de66ef77f889119a22ab33bc44cd55de66ef77f8891",
        PATTERN + ", 8, 0x00112233445566778899aabbccddeeff112233445566778899aabbccddeeff11",
        PATTERN + ", 255, 0x00",
        "0xf02233445566778899aabbccddeeff112233445566778899aabbccddeeff1122, 255, 0x01",
        "0xf000000000000000000000000000000000000000000000000000000000000000, 4, "
                + "0x0f00000000000000000000000000000000000000000000000000000000000000"
    })
    void testShr(String value, long shift, String expected) {
        assertThat(stackOf(push32(value), push32(shift), op(SHR), op(STOP))).containsExactly(word(expected));
    }

    @ParameterizedTest(name = "sar {1}")
    @CsvSource({
        PATTERN + ", 255, 0x00",
        "0xf02233445566778899aabbccddeeff112233445566778899aabbccddeeff1122, 128, "
                + "0xfffffffffffffffffffffffffffffffff02233445566778899aabbccddeeff11",
        "0xf000000000000000000000000000000000000000000000000000000000000000, 4, "
                + "0xff00000000000000000000000000000000000000000000000000000000000000",
        "0x3000000000000000000000000000000000000000000000000000000000000000, 4, "
                + "0x0300000000000000000000000000000000000000000000000000000000000000",
        "0xf000000000000000000000000000000000000000000000000000000000000000, 8, "
                + "0xfff0000000000000000000000000000000000000000000000000000000000000",
        "0x3000000000000000000000000000000000000000000000000000000000000000, 8, "
                + "0x0030000000000000000000000000000000000000000000000000000000000000"
    })
    void testSar(String value, long shift, String expected) {
        assertThat(stackOf(push32(value), push32(shift), op(SAR), op(STOP))).containsExactly(word(expected));
    }

    @ParameterizedTest(name = "EIP-145 sar {0} by {1}")
    @CsvSource({
        "0x01, 0x00, 0x01",
        "0x01, 0x01, 0x00",
        "0x8000000000000000000000000000000000000000000000000000000000000000, 0x01, "
                + "0xc000000000000000000000000000000000000000000000000000000000000000",
        "0x8000000000000000000000000000000000000000000000000000000000000000, 0xff, "
                + "0xffffffffffffffffffffffffffffffffffffffffffffffffffffffffffffffff",
        "0x8000000000000000000000000000000000000000000000000000000000000000, 0x0100, "
                + "0xffffffffffffffffffffffffffffffffffffffffffffffffffffffffffffffff",
        "0x8000000000000000000000000000000000000000000000000000000000000000, 0x0101, "
                + "0xffffffffffffffffffffffffffffffffffffffffffffffffffffffffffffffff",
        "0xffffffffffffffffffffffffffffffffffffffffffffffffffffffffffffffff, 0x00, "
                + "0xffffffffffffffffffffffffffffffffffffffffffffffffffffffffffffffff",
        "0xffffffffffffffffffffffffffffffffffffffffffffffffffffffffffffffff, 0x01, "
                + "0xffffffffffffffffffffffffffffffffffffffffffffffffffffffffffffffff",
        "0xffffffffffffffffffffffffffffffffffffffffffffffffffffffffffffffff, 0xff, "
                + "0xffffffffffffffffffffffffffffffffffffffffffffffffffffffffffffffff",
        "0xffffffffffffffffffffffffffffffffffffffffffffffffffffffffffffffff, 0x0100, "
                + "0xffffffffffffffffffffffffffffffffffffffffffffffffffffffffffffffff",
        "0x00, 0x01, 0x00",
        "0x4000000000000000000000000000000000000000000000000000000000000000, 0xfe, 0x01",
        "0x7fffffffffffffffffffffffffffffffffffffffffffffffffffffffffffffff, 0xf8, 0x7f",
        "0x7fffffffffffffffffffffffffffffffffffffffffffffffffffffffffffffff, 0xfe, 0x01",
        "0x7fffffffffffffffffffffffffffffffffffffffffffffffffffffffffffffff, 0xff, 0x00",
        "0x7fffffffffffffffffffffffffffffffffffffffffffffffffffffffffffffff, 0x0100, 0x00"
    })
    void testSarEip145(String value, String shift, String expected) {
        byte[] shiftBytes = new byte[4];
        byte[] raw = bytes(shift);
        System.arraycopy(raw, 0, shiftBytes, 4 - raw.length, raw.length);
        assertThat(stackOf(push32(value), new IrToken.Push(4, shiftBytes), op(SAR), op(STOP)))
                .containsExactly(word(expected));
    }
}
