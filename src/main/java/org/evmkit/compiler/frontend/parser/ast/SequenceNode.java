package org.evmkit.compiler.frontend.parser.ast;

import java.util.List;

/**
 * A list of nodes that is spliced into the surrounding output in order.
 *
 * @param items The nodes.
 */
public record SequenceNode(List<AstNode> items) implements AstNode {

    public SequenceNode {
        items = List.copyOf(items);
    }

    @Override
    public List<AstNode> getChildren() {
        return items;
    }
}
