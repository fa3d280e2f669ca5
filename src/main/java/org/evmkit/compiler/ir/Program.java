package org.evmkit.compiler.ir;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Linear program container. The order of tokens is the emission order produced by the
 * assembler and is preserved by every later phase.
 *
 * @param tokens The tokens, in order.
 */
public record Program(List<IrToken> tokens) {

    public Program {
        tokens = List.copyOf(tokens);
    }

    public static Program of(IrToken... tokens) {
        return new Program(List.of(tokens));
    }

    /**
     * Returns {@code true} when no placeholder remains, i.e. the program can be encoded.
     */
    public boolean isResolved() {
        for (IrToken token : tokens) {
            if (token.isPlaceholder()) {
                return false;
            }
        }
        return true;
    }

    /**
     * Returns the encoded length in bytes, the sum of all token sizes.
     */
    public int byteSize() {
        int total = 0;
        for (IrToken token : tokens) {
            total += token.size();
        }
        return total;
    }

    @Override
    public String toString() {
        return tokens.stream().map(IrToken::toString).collect(Collectors.joining(", ", "[", "]"));
    }
}
