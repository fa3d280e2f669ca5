package org.evmkit.compiler.backend.layout;

import java.util.HashMap;
import java.util.Map;

import org.evmkit.compiler.ir.IrToken;
import org.evmkit.compiler.ir.Program;

/**
 * Assigns byte offsets to the tokens of a program and records where each jump label lands.
 * This pass does not perform linking; jump pointers are not resolved here.
 */
public final class LayoutEngine {

    /**
     * Lays out the given program.
     * <p>
     * If the same label marks several destinations, the last one wins.
     *
     * @param program The program to lay out, usually still containing placeholders.
     * @return The label offsets and the total size.
     */
    public LayoutResult layout(Program program) {
        Map<String, Integer> labelToAddress = new HashMap<>();
        int address = 0;
        for (IrToken token : program.tokens()) {
            if (token instanceof IrToken.JumpDest dest) {
                labelToAddress.put(dest.label(), address);
            }
            address += token.size();
        }
        return new LayoutResult(labelToAddress, address);
    }
}
