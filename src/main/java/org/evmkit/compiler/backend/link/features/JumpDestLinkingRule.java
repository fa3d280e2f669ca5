package org.evmkit.compiler.backend.link.features;

import org.evmkit.compiler.backend.layout.LayoutResult;
import org.evmkit.compiler.backend.link.ILinkingRule;
import org.evmkit.compiler.ir.IrToken;
import org.evmkit.runtime.isa.Opcode;

/**
 * Turns a labelled jump destination into a plain {@code JUMPDEST}.
 */
public class JumpDestLinkingRule implements ILinkingRule {

    private static final IrToken JUMPDEST = new IrToken.Plain(Opcode.JUMPDEST);

    @Override
    public IrToken apply(IrToken token, LayoutResult layout) {
        return token instanceof IrToken.JumpDest ? JUMPDEST : token;
    }
}
