package dev.flowc.engine;

import dev.flowc.ir.WorkflowIR;

import java.util.List;

/**
 * Outcome of compiling one workflow document.
 */
public sealed interface CompileResult {

    record Success(WorkflowIR ir) implements CompileResult {}

    record Failure(List<Diagnostic> diagnostics) implements CompileResult {}
}
