package org.evmkit.compiler.backend.link;

import org.evmkit.compiler.backend.layout.LayoutResult;
import org.evmkit.compiler.ir.IrToken;

/**
 * Linking rule that can transform a token (e.g., resolve a jump pointer).
 */
public interface ILinkingRule {

	/**
	 * Applies linking on a single token, returning a potentially rewritten token.
	 *
	 * @param token   The original token.
	 * @param layout  The layout result providing label offsets and the total size.
	 * @return The (potentially) rewritten token.
	 */
	IrToken apply(IrToken token, LayoutResult layout);
}
