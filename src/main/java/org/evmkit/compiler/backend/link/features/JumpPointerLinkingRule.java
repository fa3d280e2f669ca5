package org.evmkit.compiler.backend.link.features;

import org.evmkit.compiler.api.InvalidOpcodeException;
import org.evmkit.compiler.backend.layout.LayoutResult;
import org.evmkit.compiler.backend.link.ILinkingRule;
import org.evmkit.compiler.backend.link.Linker;
import org.evmkit.compiler.ir.IrToken;

/**
 * Resolves jump pointers to a {@code PUSH3} of their destination's byte offset.
 */
public class JumpPointerLinkingRule implements ILinkingRule {

    /**
     * {@inheritDoc}
     */
    @Override
    public IrToken apply(IrToken token, LayoutResult layout) {
        if (!(token instanceof IrToken.JumpPointer pointer)) {
            return token;
        }
        Integer targetAddr = layout.labelToAddress().get(pointer.label());
        if (targetAddr == null) {
            throw new InvalidOpcodeException("could not find jump dest: " + pointer.label());
        }
        return Linker.addressPush(targetAddr);
    }
}
