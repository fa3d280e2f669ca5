package org.evmkit.compiler.frontend.parser.ast;

import java.util.ArrayList;
import java.util.List;

import org.evmkit.runtime.isa.Opcode;

/**
 * Static factories for building operation trees in Java code.
 *
 * <pre>{@code
 * seq(op(MSTORE, 0, 0x11223344), op(REVERT, 28, 4))
 * }</pre>
 */
public final class Ops {

    private Ops() {
        // Utility class - prevent instantiation
    }

    /**
     * Applies an instruction to its operands. Each operand goes through {@link AstNode#of(Object)}.
     */
    public static OpNode op(Opcode opcode, Object... args) {
        List<AstNode> nodes = new ArrayList<>(args.length);
        for (Object arg : args) {
            nodes.add(AstNode.of(arg));
        }
        return new OpNode(opcode, nodes);
    }

    public static IfNode ifThen(Object condition, Object nonZero, Object zero) {
        return new IfNode(AstNode.of(condition), AstNode.of(nonZero), AstNode.of(zero));
    }

    public static SequenceNode seq(Object... items) {
        List<AstNode> nodes = new ArrayList<>(items.length);
        for (Object item : items) {
            nodes.add(AstNode.of(item));
        }
        return new SequenceNode(nodes);
    }

    public static SelfCodeSizeNode selfCodeSize() {
        return new SelfCodeSizeNode();
    }
}
