package org.evmkit.compiler.frontend.irgen;

import java.math.BigInteger;
import java.util.List;

import org.evmkit.compiler.api.InvalidAssemblyException;
import org.evmkit.compiler.frontend.parser.ast.AstNode;
import org.evmkit.compiler.frontend.parser.ast.BytesNode;
import org.evmkit.compiler.frontend.parser.ast.IfNode;
import org.evmkit.compiler.frontend.parser.ast.NumberNode;
import org.evmkit.compiler.frontend.parser.ast.OpNode;
import org.evmkit.compiler.frontend.parser.ast.SelfCodeSizeNode;
import org.evmkit.compiler.frontend.parser.ast.SequenceNode;
import org.evmkit.compiler.ir.IrToken;
import org.evmkit.compiler.ir.Program;
import org.evmkit.runtime.isa.Opcode;
import org.evmkit.runtime.isa.OpcodeId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Phase: lowers an operation tree into a linear, pre-resolution program.
 * <p>
 * Operands are emitted right to left before their instruction, so the first operand ends up
 * on top of the stack. The output may still contain jump and code-size placeholders.
 */
public final class IrGenerator {

	private static final Logger LOG = LoggerFactory.getLogger(IrGenerator.class);

	/**
	 * Generates a linear program from the given nodes.
	 *
	 * @param ast The top-level nodes, in order.
	 * @return The generated program.
	 * @throws InvalidAssemblyException if a node is malformed.
	 */
	public Program generate(List<AstNode> ast) {
		IrGenContext ctx = new IrGenContext();
		for (AstNode node : ast) {
			convert(node, ctx);
		}
		Program program = ctx.build();
		LOG.debug("Generated {} tokens from {} top-level nodes", program.tokens().size(), ast.size());
		return program;
	}

	/**
	 * Convenience overload for a single tree.
	 */
	public Program generate(AstNode node) {
		return generate(List.of(node));
	}

	private void convert(AstNode node, IrGenContext ctx) {
		if (node instanceof OpNode op) {
			convertOp(op, ctx);
		} else if (node instanceof BytesNode bytes) {
			ctx.emit(pushOf(bytes.bytes()));
		} else if (node instanceof NumberNode number) {
			ctx.emit(pushOf(encodeUnsigned(number.value())));
		} else if (node instanceof SequenceNode seq) {
			for (AstNode item : seq.items()) {
				convert(item, ctx);
			}
		} else if (node instanceof IfNode ifNode) {
			convertIf(ifNode, ctx);
		} else if (node instanceof SelfCodeSizeNode) {
			ctx.emit(new IrToken.SelfCodeSize());
		} else {
			throw new InvalidAssemblyException("invalid or unknown assembly: " + node);
		}
	}

	private void convertOp(OpNode node, IrGenContext ctx) {
		Opcode opcode = node.opcode();
		List<AstNode> args = node.args();
		if (args.size() != opcode.inputs()) {
			throw new InvalidAssemblyException(String.format(
					"%s takes %d operand(s), got %d", opcode.mnemonic(), opcode.inputs(), args.size()));
		}
		for (int i = args.size() - 1; i >= 0; i--) {
			convert(args.get(i), ctx);
		}
		ctx.emit(new IrToken.Plain(opcode));
	}

	private void convertIf(IfNode node, IrGenContext ctx) {
		String label = ctx.newLabel();
		convert(node.condition(), ctx);
		ctx.emit(new IrToken.JumpPointer(label));
		ctx.emit(new IrToken.Plain(Opcode.JUMPI));
		convert(node.zero(), ctx);
		ctx.emit(new IrToken.JumpDest(label));
		convert(node.nonZero(), ctx);
	}

	private static IrToken.Push pushOf(byte[] bytes) {
		if (bytes.length > OpcodeId.MAX_PUSH_SIZE) {
			throw new InvalidAssemblyException("binary value larger than 32 bytes (" + bytes.length + " bytes)");
		}
		return IrToken.Push.of(bytes);
	}

	/**
	 * Returns the minimal big-endian encoding of a non-negative integer. Zero encodes as a
	 * single zero byte.
	 *
	 * @throws InvalidAssemblyException if {@code value} is negative.
	 */
	static byte[] encodeUnsigned(BigInteger value) {
		if (value.signum() < 0) {
			throw new InvalidAssemblyException("negative integer literal: " + value);
		}
		byte[] raw = value.toByteArray();
		if (raw.length > 1 && raw[0] == 0) {
			byte[] trimmed = new byte[raw.length - 1];
			System.arraycopy(raw, 1, trimmed, 0, trimmed.length);
			return trimmed;
		}
		return raw;
	}
}
