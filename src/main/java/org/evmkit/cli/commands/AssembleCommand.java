package org.evmkit.cli.commands;

import java.io.File;
import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.concurrent.Callable;

import org.evmkit.cli.CommandLineInterface;
import org.evmkit.compiler.api.AssemblyException;
import org.evmkit.compiler.api.Assembly;
import org.evmkit.runtime.services.Disassembler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.ConfigException;

import picocli.CommandLine.ArgGroup;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

/**
 * Assembles s-expression source into bytecode.
 */
@Command(
    name = "assemble",
    description = "Assemble s-expression source into bytecode"
)
public class AssembleCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(AssembleCommand.class);

    /**
     * Source is read either from a file or from the command line.
     */
    static class SourceOptions {
        @Option(names = {"-f", "--file"}, description = "Source file")
        File file;

        @Option(names = {"-e", "--expression"}, description = "Source text, e.g. \"(mstore 0 55)\"")
        String expression;
    }

    @ArgGroup(exclusive = true, multiplicity = "1")
    SourceOptions source;

    @Option(names = {"--constructor"}, description = "Wrap the result in init code that returns it")
    private boolean constructor;

    @Option(names = {"--listing"}, description = "Print an instruction listing instead of hex")
    private boolean listing;

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        final PrintWriter out = spec.commandLine().getOut();
        final PrintWriter err = spec.commandLine().getErr();

        try {
            if (parent != null) {
                parent.getConfig();
            }
            final String text = source.file != null
                    ? Files.readString(source.file.toPath(), StandardCharsets.UTF_8)
                    : source.expression;

            final Assembly assembly = new Assembly();
            byte[] code = assembly.buildSource(text);
            if (constructor) {
                code = assembly.constructor(code);
            }
            log.debug("Assembled {} bytes", code.length);

            if (listing) {
                out.println(new Disassembler().listing(code));
            } else {
                out.println(HexArgument.encode(code));
            }
            out.flush();
            return 0;
        } catch (AssemblyException e) {
            err.println("Error: " + e.getMessage());
            return 1;
        } catch (IOException e) {
            err.println("Error: cannot read " + source.file + ": " + e.getMessage());
            return 1;
        } catch (IllegalArgumentException | ConfigException e) {
            err.println("Error: " + e.getMessage());
            return 1;
        }
    }
}
