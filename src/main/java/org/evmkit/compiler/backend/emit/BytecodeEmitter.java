package org.evmkit.compiler.backend.emit;

import java.io.ByteArrayOutputStream;

import org.evmkit.compiler.api.InvalidAssemblyException;
import org.evmkit.compiler.ir.IrToken;
import org.evmkit.compiler.ir.Program;
import org.evmkit.runtime.isa.OpcodeId;

/**
 * Final phase: writes a linked program as raw bytecode.
 */
public final class BytecodeEmitter {

	/**
	 * Encodes the given program.
	 *
	 * @param program A program without placeholders.
	 * @return The concatenated bytes of every token, in order.
	 * @throws InvalidAssemblyException if the program still contains placeholders.
	 */
	public byte[] emit(Program program) {
		ByteArrayOutputStream out = new ByteArrayOutputStream(program.byteSize());
		for (IrToken token : program.tokens()) {
			emit(token, out);
		}
		return out.toByteArray();
	}

	private static void emit(IrToken token, ByteArrayOutputStream out) {
		if (token instanceof IrToken.Plain plain) {
			out.write(plain.opcode().byteValue());
		} else if (token instanceof IrToken.Push push) {
			out.write(OpcodeId.push(push.width()));
			out.writeBytes(push.value());
		} else if (token instanceof IrToken.Dup dup) {
			out.write(OpcodeId.dup(dup.n()));
		} else if (token instanceof IrToken.Swap swap) {
			out.write(OpcodeId.swap(swap.n()));
		} else if (token instanceof IrToken.Invalid invalid) {
			out.write(OpcodeId.INVALID);
			out.writeBytes(invalid.data());
		} else {
			throw new InvalidAssemblyException("cannot encode unresolved token " + token);
		}
	}
}
