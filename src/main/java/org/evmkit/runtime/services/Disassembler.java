package org.evmkit.runtime.services;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

import org.bouncycastle.util.encoders.Hex;
import org.evmkit.compiler.api.InvalidCodeException;
import org.evmkit.compiler.api.InvalidOpcodeException;
import org.evmkit.compiler.ir.IrToken;
import org.evmkit.compiler.ir.Program;
import org.evmkit.runtime.isa.Opcode;
import org.evmkit.runtime.isa.OpcodeId;

/**
 * Decodes raw bytecode back into tokens. This is the inverse of
 * {@link org.evmkit.compiler.backend.emit.BytecodeEmitter} for every program without
 * placeholders.
 * <p>
 * The {@code INVALID} byte ends decoding: everything after it is kept as raw data, which is how
 * constructor arguments appended to code survive a round trip.
 */
public class Disassembler {

    /**
     * Decodes the given bytecode.
     *
     * @param code The raw bytecode.
     * @return The decoded program.
     * @throws InvalidCodeException if a push runs past the end of the buffer.
     * @throws InvalidOpcodeException if a byte matches no instruction.
     */
    public Program decode(byte[] code) {
        List<IrToken> tokens = new ArrayList<>();
        for (DisassemblyData entry : disassemble(code)) {
            tokens.add(entry.token());
        }
        return new Program(tokens);
    }

    /**
     * Decodes the given bytecode and keeps the offset of each instruction.
     *
     * @param code The raw bytecode.
     * @return One entry per instruction, in order.
     * @throws InvalidCodeException if a push runs past the end of the buffer.
     * @throws InvalidOpcodeException if a byte matches no instruction.
     */
    public List<DisassemblyData> disassemble(byte[] code) {
        List<DisassemblyData> out = new ArrayList<>();
        int pc = 0;
        while (pc < code.length) {
            int x = code[pc] & 0xFF;
            IrToken token;
            if (OpcodeId.isPush(x)) {
                int n = OpcodeId.pushSize(x);
                if (code.length - pc - 1 < n) {
                    throw new InvalidCodeException(String.format("insufficient data for PUSH%d at offset %d: 0x%s",
                            n, pc, Hex.toHexString(code, pc, code.length - pc)));
                }
                token = new IrToken.Push(n, Arrays.copyOfRange(code, pc + 1, pc + 1 + n));
            } else if (OpcodeId.isDup(x)) {
                token = new IrToken.Dup(OpcodeId.dupIndex(x));
            } else if (OpcodeId.isSwap(x)) {
                token = new IrToken.Swap(OpcodeId.swapIndex(x));
            } else if (x == OpcodeId.INVALID) {
                token = new IrToken.Invalid(Arrays.copyOfRange(code, pc + 1, code.length));
            } else {
                final int offset = pc;
                Opcode opcode = Opcode.fromByte(x).orElseThrow(() -> new InvalidOpcodeException(
                        String.format("unknown opcode 0x%02x at offset %d", x, offset)));
                token = new IrToken.Plain(opcode);
            }
            out.add(new DisassemblyData(pc, token));
            pc += token.size();
        }
        return out;
    }

    /**
     * Renders the bytecode as a listing, one instruction per line.
     *
     * @param code The raw bytecode.
     * @return The listing text.
     */
    public String listing(byte[] code) {
        return disassemble(code).stream()
                .map(DisassemblyData::toListingLine)
                .collect(Collectors.joining(System.lineSeparator()));
    }
}
