package org.evmkit.compiler.api;

import java.io.ByteArrayOutputStream;
import java.util.List;

import org.evmkit.compiler.backend.emit.BytecodeEmitter;
import org.evmkit.compiler.backend.layout.LayoutEngine;
import org.evmkit.compiler.backend.layout.LayoutResult;
import org.evmkit.compiler.backend.link.Linker;
import org.evmkit.compiler.backend.link.LinkingRegistry;
import org.evmkit.compiler.frontend.irgen.IrGenerator;
import org.evmkit.compiler.frontend.parser.Parser;
import org.evmkit.compiler.frontend.parser.ast.AstNode;
import org.evmkit.compiler.ir.IrToken;
import org.evmkit.compiler.ir.Program;
import org.evmkit.runtime.isa.Opcode;
import org.evmkit.runtime.services.Disassembler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static org.evmkit.compiler.frontend.parser.ast.Ops.op;
import static org.evmkit.compiler.frontend.parser.ast.Ops.selfCodeSize;

/**
 * Entry point of the assembler. Orchestrates the phases:
 * <ol>
 *   <li>IR generation: operation tree to a linear program with placeholders</li>
 *   <li>Layout: byte offsets of jump destinations and the total size</li>
 *   <li>Linking: placeholders to concrete pushes and {@code JUMPDEST}s</li>
 *   <li>Emission: tokens to bytes</li>
 * </ol>
 * Instances hold no per-call state and can be shared.
 */
public class Assembly {

    private static final Logger LOG = LoggerFactory.getLogger(Assembly.class);

    private final IrGenerator irGenerator = new IrGenerator();
    private final LayoutEngine layoutEngine = new LayoutEngine();
    private final Linker linker = new Linker(LinkingRegistry.initializeWithDefaults());
    private final BytecodeEmitter emitter = new BytecodeEmitter();
    private final Disassembler disassembler = new Disassembler();

    /**
     * Lowers an operation tree into a pre-resolution program.
     *
     * @param tree An {@link AstNode} or any value accepted by {@link AstNode#of(Object)}.
     * @return The program, possibly containing placeholders.
     * @throws InvalidAssemblyException if the tree is malformed.
     */
    public Program compile(Object tree) {
        return irGenerator.generate(AstNode.of(tree));
    }

    /**
     * Parses and lowers source text in the s-expression form.
     *
     * @param source The source text.
     * @return The program, possibly containing placeholders.
     * @throws InvalidAssemblyException if the text is malformed.
     */
    public Program compileSource(String source) {
        List<AstNode> forms = new Parser(source).parse();
        return irGenerator.generate(forms);
    }

    /**
     * Replaces every placeholder of the program with a concrete instruction.
     *
     * @param program The program to resolve.
     * @return An equivalent program without placeholders.
     * @throws InvalidOpcodeException if a jump refers to an unknown label.
     * @throws InvalidAssemblyException if an address does not fit in three bytes.
     */
    public Program resolve(Program program) {
        LayoutResult layout = layoutEngine.layout(program);
        return linker.link(program, layout);
    }

    /**
     * Resolves and encodes a program.
     *
     * @param program The program, with or without placeholders.
     * @return The bytecode.
     */
    public byte[] assemble(Program program) {
        byte[] code = emitter.emit(resolve(program));
        LOG.debug("Assembled {} tokens into {} bytes", program.tokens().size(), code.length);
        return code;
    }

    /**
     * Encodes a program that has already been resolved.
     *
     * @param program The program.
     * @return The bytecode.
     * @throws InvalidAssemblyException if the program still contains placeholders.
     */
    public byte[] encode(Program program) {
        return emitter.emit(program);
    }

    /**
     * Compiles and assembles an operation tree in one step.
     *
     * @param tree An {@link AstNode} or any value accepted by {@link AstNode#of(Object)}.
     * @return The bytecode.
     */
    public byte[] build(Object tree) {
        return assemble(compile(tree));
    }

    /**
     * Compiles and assembles source text in one step.
     *
     * @param source The source text.
     * @return The bytecode.
     */
    public byte[] buildSource(String source) {
        return assemble(compileSource(source));
    }

    /**
     * Decodes bytecode into a program.
     *
     * @param code The bytecode.
     * @return The decoded program.
     * @throws InvalidCodeException if a push is truncated.
     * @throws InvalidOpcodeException if a byte matches no instruction.
     */
    public Program disassemble(byte[] code) {
        return disassembler.decode(code);
    }

    /**
     * Wraps runtime code in init code that returns it.
     * <p>
     * The preamble copies everything after itself into memory and returns it, so executing the
     * result yields exactly {@code code}.
     *
     * @param code The runtime code.
     * @return The init code followed by {@code code}.
     */
    public byte[] constructor(byte[] code) {
        byte[] preamble = build(List.of(
                op(Opcode.CODECOPY, 0, selfCodeSize(), code.length),
                op(Opcode.RETURN, 0, code.length)));
        ByteArrayOutputStream out = new ByteArrayOutputStream(preamble.length + code.length);
        out.writeBytes(preamble);
        out.writeBytes(code);
        return out.toByteArray();
    }

    /**
     * Returns a textual representation of a token, e.g. {@code PUSH1 0x37} or {@code ADD}.
     */
    public static String show(IrToken token) {
        return token.toString();
    }
}
