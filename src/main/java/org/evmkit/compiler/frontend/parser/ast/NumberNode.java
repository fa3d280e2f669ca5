package org.evmkit.compiler.frontend.parser.ast;

import java.math.BigInteger;
import java.util.Objects;

/**
 * An integer literal, pushed as its minimal big-endian encoding.
 *
 * @param value The literal value.
 */
public record NumberNode(BigInteger value) implements AstNode {

    public NumberNode {
        Objects.requireNonNull(value, "value");
    }
}
