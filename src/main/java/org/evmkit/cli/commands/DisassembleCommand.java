package org.evmkit.cli.commands;

import java.io.PrintWriter;
import java.util.concurrent.Callable;

import org.evmkit.compiler.api.AssemblyException;
import org.evmkit.runtime.services.Disassembler;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

/**
 * Prints an instruction listing of bytecode.
 */
@Command(
    name = "disassemble",
    description = "Print one instruction per line: offset, mnemonic and immediate"
)
public class DisassembleCommand implements Callable<Integer> {

    @Parameters(index = "0", paramLabel = "<hex>", description = "Bytecode, with or without 0x prefix")
    private String code;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        final PrintWriter out = spec.commandLine().getOut();
        final PrintWriter err = spec.commandLine().getErr();
        try {
            final String listing = new Disassembler().listing(HexArgument.decode(code));
            if (!listing.isEmpty()) {
                out.println(listing);
            }
            out.flush();
            return 0;
        } catch (AssemblyException | IllegalArgumentException e) {
            err.println("Error: " + e.getMessage());
            return 1;
        }
    }
}
