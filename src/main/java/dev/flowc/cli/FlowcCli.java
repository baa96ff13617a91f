package dev.flowc.cli;

import ch.qos.logback.classic.Level;
import dev.flowc.engine.CompileResult;
import dev.flowc.engine.Diagnostic;
import dev.flowc.engine.IrOutline;
import dev.flowc.engine.WorkflowCompiler;
import dev.flowc.ir.IrJson;
import dev.flowc.lower.WorkflowLowerer;
import dev.flowc.validate.CapabilityBudget;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;
import picocli.CommandLine.Model.CommandSpec;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * CLI entry point: compile a workflow document into IR JSON.
 */
@Command(
    name = "flowc",
    mixinStandardHelpOptions = true,
    version = "flowc 0.1.0",
    description = "Lower a visual workflow graph into a validated, structured execution plan."
)
public class FlowcCli implements Callable<Integer> {

    static final int EXIT_OK = 0;
    static final int EXIT_COMPILE_FAILURE = 1;
    static final int EXIT_IO = 2;

    private static final Logger log = LoggerFactory.getLogger(FlowcCli.class);

    @Spec
    private CommandSpec spec;

    @Parameters(index = "0", description = "Workflow document (JSON) to compile")
    private Path file;

    @Option(names = "--validate-only", description = "Report diagnostics without printing the IR")
    private boolean validateOnly;

    @Option(names = "--outline", description = "Print the step tree instead of IR JSON")
    private boolean outline;

    @Option(names = {"-o", "--output"}, description = "Write the IR JSON to this file instead of stdout")
    private Path output;

    @Option(names = "--max-http", description = "Override the HTTP/AI call ceiling (default: ${DEFAULT-VALUE})",
        defaultValue = "" + CapabilityBudget.DEFAULT_MAX_HTTP_CALLS)
    private int maxHttp;

    @Option(names = "--max-evm-reads", description = "Override the EVM read ceiling (default: ${DEFAULT-VALUE})",
        defaultValue = "" + CapabilityBudget.DEFAULT_MAX_EVM_READS)
    private int maxEvmReads;

    @Option(names = "--max-evm-writes", description = "Override the EVM write ceiling (default: ${DEFAULT-VALUE})",
        defaultValue = "" + CapabilityBudget.DEFAULT_MAX_EVM_WRITES)
    private int maxEvmWrites;

    @Option(names = "--verbose", description = "Log lowering decisions")
    private boolean verbose;

    @Override
    public Integer call() {
        if (verbose) {
            var logger = (ch.qos.logback.classic.Logger) LoggerFactory.getLogger("dev.flowc");
            logger.setLevel(Level.DEBUG);
        }
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        String json;
        try {
            json = Files.readString(file);
        } catch (IOException e) {
            err.println("Error: cannot read " + file + ": " + e.getMessage());
            return EXIT_IO;
        }

        var budget = new CapabilityBudget(maxHttp, maxEvmReads, maxEvmWrites);
        CompileResult result = new WorkflowCompiler(new WorkflowLowerer(), budget).compileString(json);

        if (result instanceof CompileResult.Failure failure) {
            for (Diagnostic diagnostic : failure.diagnostics()) {
                err.println(diagnostic.format());
            }
            err.printf("%d error(s) in %s%n", failure.diagnostics().size(), file);
            return EXIT_COMPILE_FAILURE;
        }

        var ir = ((CompileResult.Success) result).ir();
        if (validateOnly) {
            out.println("OK: " + file);
            return EXIT_OK;
        }
        if (outline) {
            out.print(IrOutline.render(ir));
            return EXIT_OK;
        }
        try {
            if (output != null) {
                IrJson.write(ir, output);
                log.info("Wrote IR to {}", output);
            } else {
                out.println(IrJson.write(ir));
            }
        } catch (IOException e) {
            err.println("Error: cannot write IR: " + e.getMessage());
            return EXIT_IO;
        }
        return EXIT_OK;
    }
}
