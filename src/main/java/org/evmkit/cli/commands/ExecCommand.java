package org.evmkit.cli.commands;

import java.io.PrintWriter;
import java.math.BigInteger;
import java.util.concurrent.Callable;

import org.evmkit.cli.CommandLineInterface;
import org.evmkit.cli.TracePrinter;
import org.evmkit.compiler.api.AssemblyException;
import org.evmkit.runtime.ExecutionOutcome;
import org.evmkit.runtime.StepLimitExceededException;
import org.evmkit.runtime.VirtualMachine;
import org.evmkit.runtime.VmLimits;
import org.evmkit.runtime.internal.services.Keccak256HashFunction;
import org.evmkit.runtime.model.ExecutionResult;
import org.evmkit.runtime.services.StepLimitTracer;
import org.evmkit.runtime.spi.IExecutionTracer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

/**
 * Executes bytecode and prints the outcome as {@code ok 0x…}, {@code revert 0x…} or
 * {@code error <kind>}.
 */
@Command(
    name = "exec",
    description = "Execute bytecode in the pure interpreter"
)
public class ExecCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ExecCommand.class);

    @Parameters(index = "0", paramLabel = "<hex>", description = "Bytecode, with or without 0x prefix")
    private String code;

    @Option(names = {"--calldata"}, paramLabel = "<hex>", description = "Call data (default: empty)")
    private String calldata;

    @Option(names = {"--value"}, description = "Call value (default: ${DEFAULT-VALUE})", defaultValue = "0")
    private BigInteger value;

    @Option(names = {"--trace"}, description = "Print every instruction before it runs")
    private boolean trace;

    @Option(names = {"--max-steps"}, description = "Abort after this many instructions (default: cli.max-steps, 0 = unlimited)")
    private Long maxSteps;

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        final PrintWriter out = spec.commandLine().getOut();
        final PrintWriter err = spec.commandLine().getErr();

        final ExecutionOutcome outcome;
        try {
            final Config config = parent != null ? parent.getConfig() : null;
            final VmLimits limits = config != null ? VmLimits.fromConfig(config) : VmLimits.DEFAULTS;
            final long steps = maxSteps != null ? maxSteps
                    : config != null && config.hasPath("cli.max-steps") ? config.getLong("cli.max-steps") : 0L;
            if (value.signum() < 0) {
                err.println("Error: --value must not be negative");
                return 1;
            }

            IExecutionTracer tracer = trace ? new TracePrinter(out) : IExecutionTracer.NONE;
            if (steps > 0) {
                tracer = new StepLimitTracer(steps).andThen(tracer);
            }
            final VirtualMachine vm = new VirtualMachine(limits, new Keccak256HashFunction(), tracer);
            final byte[] input = calldata != null ? HexArgument.decode(calldata) : new byte[0];
            outcome = vm.exec(HexArgument.decode(code), input, value);
        } catch (StepLimitExceededException e) {
            out.flush();
            err.println("error step_limit_exceeded: " + e.getMessage());
            return CommandLineInterface.EXIT_VM_ERROR;
        } catch (AssemblyException | IllegalArgumentException | ConfigException e) {
            out.flush();
            err.println("Error: " + e.getMessage());
            return 1;
        }

        if (!outcome.isSuccess()) {
            log.debug("Execution failed: {}", outcome.error());
            out.println("error " + outcome.error());
            out.flush();
            return CommandLineInterface.EXIT_VM_ERROR;
        }
        final ExecutionResult result = outcome.result();
        out.println((result.reverted() ? "revert " : "ok ") + HexArgument.encode(result.returnData()));
        out.flush();
        return 0;
    }
}
