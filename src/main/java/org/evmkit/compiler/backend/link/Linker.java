package org.evmkit.compiler.backend.link;

import java.util.ArrayList;
import java.util.List;

import org.evmkit.compiler.api.InvalidAssemblyException;
import org.evmkit.compiler.backend.layout.LayoutResult;
import org.evmkit.compiler.ir.IrToken;
import org.evmkit.compiler.ir.Program;

/**
 * Linking pass: replaces every placeholder using the layout result.
 */
public final class Linker {

    private final LinkingRegistry registry;

    /**
     * Constructs a new linker.
     * @param registry The registry of linking rules to apply.
     */
    public Linker(LinkingRegistry registry) { this.registry = registry; }

    /**
     * Links the given program.
     * @param program The program to link.
     * @param layout The layout result of the same program.
     * @return The linked program, free of placeholders.
     * @throws org.evmkit.compiler.api.InvalidOpcodeException if a jump refers to an unknown label.
     * @throws InvalidAssemblyException if a placeholder has no rule or an address does not fit.
     */
    public Program link(Program program, LayoutResult layout) {
        List<IrToken> out = new ArrayList<>(program.tokens().size());
        for (IrToken token : program.tokens()) {
            for (ILinkingRule rule : registry.rules()) {
                token = rule.apply(token, layout);
            }
            if (token.isPlaceholder()) {
                throw new InvalidAssemblyException("No linking rule resolved " + token);
            }
            out.add(token);
        }
        return new Program(out);
    }

    /**
     * Encodes an address as a fixed-width big-endian push.
     *
     * @param address The non-negative address.
     * @return A {@code PUSH3} of the address.
     * @throws InvalidAssemblyException if the address needs more than three bytes.
     */
    public static IrToken.Push addressPush(int address) {
        if (address < 0 || address >= (1 << (8 * IrToken.ADDRESS_WIDTH))) {
            throw new InvalidAssemblyException("jump too large: " + address);
        }
        byte[] bytes = new byte[IrToken.ADDRESS_WIDTH];
        for (int i = IrToken.ADDRESS_WIDTH - 1; i >= 0; i--) {
            bytes[i] = (byte) (address & 0xFF);
            address >>>= 8;
        }
        return new IrToken.Push(IrToken.ADDRESS_WIDTH, bytes);
    }
}
