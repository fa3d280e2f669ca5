package org.evmkit.compiler.backend.link.features;

import org.evmkit.compiler.backend.layout.LayoutResult;
import org.evmkit.compiler.backend.link.ILinkingRule;
import org.evmkit.compiler.backend.link.Linker;
import org.evmkit.compiler.ir.IrToken;

/**
 * Replaces the code-size placeholder with a {@code PUSH3} of the program's total size.
 */
public class SelfCodeSizeLinkingRule implements ILinkingRule {

    @Override
    public IrToken apply(IrToken token, LayoutResult layout) {
        return token instanceof IrToken.SelfCodeSize ? Linker.addressPush(layout.endSize()) : token;
    }
}
