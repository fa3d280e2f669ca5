package org.evmkit.runtime.services;

import org.evmkit.compiler.ir.IrToken;

/**
 * A simple data structure for disassembly results.
 * @param offset The byte offset of the instruction.
 * @param token The decoded instruction.
 */
public record DisassemblyData(int offset, IrToken token) {

    /**
     * Renders the entry as one listing line, e.g. {@code 0002  PUSH1 0x00}.
     */
    public String toListingLine() {
        return String.format("%04x  %s", offset, token);
    }
}
