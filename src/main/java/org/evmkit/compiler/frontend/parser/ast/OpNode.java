package org.evmkit.compiler.frontend.parser.ast;

import java.util.List;
import java.util.Objects;

import org.evmkit.runtime.isa.Opcode;

/**
 * An instruction applied to its operands, e.g. {@code (mstore 0 x)}. A bare mnemonic is an
 * {@code OpNode} without operands.
 *
 * @param opcode The instruction.
 * @param args The operands, first operand first.
 */
public record OpNode(Opcode opcode, List<AstNode> args) implements AstNode {

    public OpNode {
        Objects.requireNonNull(opcode, "opcode");
        args = List.copyOf(args);
    }

    @Override
    public List<AstNode> getChildren() {
        return args;
    }
}
