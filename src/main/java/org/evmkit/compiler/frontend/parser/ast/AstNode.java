package org.evmkit.compiler.frontend.parser.ast;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.evmkit.compiler.api.InvalidAssemblyException;
import org.evmkit.runtime.isa.Opcode;

/**
 * The base interface for all nodes of an operation tree.
 */
public sealed interface AstNode permits OpNode, BytesNode, NumberNode, SequenceNode, IfNode, SelfCodeSizeNode {

    /**
     * Returns a list of the direct child nodes.
     *
     * @return A list of child nodes. Returns an empty list if the node has no children.
     */
    default List<AstNode> getChildren() {
        return Collections.emptyList();
    }

    /**
     * Converts a loosely typed Java value into a node.
     * <p>
     * Accepted values: an {@link AstNode} (returned as is), an {@link Opcode} (a bare
     * mnemonic), a {@code byte[]}, an {@link Integer}, {@link Long} or {@link BigInteger}, and a
     * {@link List} of any of these (a sequence).
     *
     * @param value The value to convert.
     * @return The corresponding node.
     * @throws InvalidAssemblyException if the value has no tree form.
     */
    static AstNode of(Object value) {
        if (value instanceof AstNode node) {
            return node;
        }
        if (value instanceof Opcode op) {
            return new OpNode(op, List.of());
        }
        if (value instanceof byte[] bytes) {
            return new BytesNode(bytes);
        }
        if (value instanceof Integer || value instanceof Long) {
            return new NumberNode(BigInteger.valueOf(((Number) value).longValue()));
        }
        if (value instanceof BigInteger big) {
            return new NumberNode(big);
        }
        if (value instanceof List<?> list) {
            List<AstNode> items = new ArrayList<>(list.size());
            for (Object item : list) {
                items.add(of(item));
            }
            return new SequenceNode(items);
        }
        throw new InvalidAssemblyException("invalid or unknown assembly: " + value);
    }
}
