package org.evmkit.compiler.frontend.parser.ast;

import java.util.List;
import java.util.Objects;

/**
 * The conditional macro {@code (if cond nonZero zero)}.
 * <p>
 * The zero branch is laid out first and is not followed by a jump: unless it halts,
 * execution continues into the non-zero branch.
 *
 * @param condition The condition, evaluated once.
 * @param nonZero Taken when the condition is non-zero.
 * @param zero Taken when the condition is zero.
 */
public record IfNode(AstNode condition, AstNode nonZero, AstNode zero) implements AstNode {

    public IfNode {
        Objects.requireNonNull(condition, "condition");
        Objects.requireNonNull(nonZero, "nonZero");
        Objects.requireNonNull(zero, "zero");
    }

    @Override
    public List<AstNode> getChildren() {
        return List.of(condition, nonZero, zero);
    }
}
