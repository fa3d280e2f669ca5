package org.evmkit.runtime.isa;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for the OpcodeId helper class.
 *
 * <p>Covers:
 * <ul>
 *   <li>Family nibble of an opcode byte</li>
 *   <li>Encoding of the PUSH, DUP and SWAP ranges and their inverses</li>
 *   <li>Validation of out-of-range values</li>
 * </ul>
 */
@Tag("unit")
class OpcodeIdTest {

    // ========== Family Tests ==========

    @ParameterizedTest(name = "opcode={0}, family={1}")
    @CsvSource({
        "0x00, 0",
        "0x0B, 0",
        "0x1D, 1",
        "0x5B, 5",
        "0xFF, 15"
    })
    void extractFamily_returnsHighNibble(String opcode, int family) {
        assertEquals(family, OpcodeId.extractFamily(Integer.decode(opcode)));
    }

    @Test
    void extractFamily_matchesTableFamilies() {
        assertEquals(Family.COMPARISON_BITWISE, OpcodeId.extractFamily(Opcode.SAR.byteValue()));
        assertEquals(Family.SYSTEM, OpcodeId.extractFamily(Opcode.REVERT.byteValue()));
    }

    @Test
    void extractFamily_ignoresBitsAboveTheByte() {
        assertEquals(0xF, OpcodeId.extractFamily(0x1F3));
    }

    // ========== Range Tests ==========

    @Test
    void push_encodesRange() {
        assertEquals(0x5F, OpcodeId.push(0));
        assertEquals(0x60, OpcodeId.push(1));
        assertEquals(0x7F, OpcodeId.push(32));
        assertEquals(32, OpcodeId.pushSize(0x7F));
    }

    @Test
    void dupAndSwap_encodeRanges() {
        assertEquals(0x80, OpcodeId.dup(1));
        assertEquals(0x8F, OpcodeId.dup(16));
        assertEquals(0x90, OpcodeId.swap(1));
        assertEquals(0x9F, OpcodeId.swap(16));
        assertEquals(2, OpcodeId.dupIndex(0x81));
        assertEquals(3, OpcodeId.swapIndex(0x92));
    }

    @ParameterizedTest
    @ValueSource(ints = {-1, 33})
    void push_outOfRange_throwsException(int size) {
        assertThrows(IllegalArgumentException.class, () -> OpcodeId.push(size));
    }

    @ParameterizedTest
    @ValueSource(ints = {0, 17})
    void dupAndSwap_outOfRange_throwsException(int n) {
        assertThrows(IllegalArgumentException.class, () -> OpcodeId.dup(n));
        assertThrows(IllegalArgumentException.class, () -> OpcodeId.swap(n));
    }

    @Test
    void rangePredicates_areDisjoint() {
        for (int b = 0; b < 256; b++) {
            int matches = (OpcodeId.isPush(b) ? 1 : 0) + (OpcodeId.isDup(b) ? 1 : 0) + (OpcodeId.isSwap(b) ? 1 : 0);
            assertTrue(matches <= 1, "byte " + b);
        }
        assertFalse(OpcodeId.isPush(0x5E));
        assertFalse(OpcodeId.isSwap(0xA0));
    }
}
