package org.evmkit.compiler.frontend.parser.ast;

import java.util.Arrays;
import java.util.Objects;

import org.bouncycastle.util.encoders.Hex;

/**
 * A byte-string literal, pushed with its own length.
 *
 * @param bytes The literal bytes.
 */
public record BytesNode(byte[] bytes) implements AstNode {

    public BytesNode {
        bytes = Objects.requireNonNull(bytes, "bytes").clone();
    }

    @Override
    public byte[] bytes() {
        return bytes.clone();
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof BytesNode other && Arrays.equals(bytes, other.bytes);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(bytes);
    }

    @Override
    public String toString() {
        return "BytesNode[0x" + Hex.toHexString(bytes) + "]";
    }
}
