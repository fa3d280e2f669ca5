package org.evmkit.compiler.backend.layout;

import java.util.Map;

/**
 * Result of the layout phase (without linking).
 *
 * @param labelToAddress A map from jump labels to the byte offset of their destination.
 * @param endSize The total encoded size of the program.
 */
public record LayoutResult(Map<String, Integer> labelToAddress, int endSize) {

    public LayoutResult {
        labelToAddress = Map.copyOf(labelToAddress);
    }
}
