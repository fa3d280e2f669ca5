package org.evmkit.compiler.frontend.irgen;

import java.util.ArrayList;
import java.util.List;

import org.evmkit.compiler.ir.IrToken;
import org.evmkit.compiler.ir.Program;

/**
 * Mutable context for one IR generation run. Holds the emitted tokens and the label counter.
 * <p>
 * Labels are only unique within one context, so two runs over the same tree produce the same
 * labels and therefore the same bytes.
 */
public final class IrGenContext {

	private final List<IrToken> out = new ArrayList<>();
	private int nextLabel = 0;

	/**
	 * Emits a new token.
	 * @param token The token to append to the program.
	 */
	public void emit(IrToken token) {
		out.add(token);
	}

	/**
	 * Allocates a fresh jump label.
	 * @return A label not returned before by this context.
	 */
	public String newLabel() {
		return "jump_" + (nextLabel++);
	}

	/**
	 * @return The program emitted so far.
	 */
	public Program build() {
		return new Program(out);
	}
}
