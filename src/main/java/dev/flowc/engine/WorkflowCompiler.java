package dev.flowc.engine;

import com.fasterxml.jackson.core.JsonProcessingException;
import dev.flowc.ir.WorkflowIR;
import dev.flowc.lower.LoweringException;
import dev.flowc.lower.WorkflowLowerer;
import dev.flowc.model.Workflow;
import dev.flowc.validate.CapabilityBudget;
import dev.flowc.validate.IrValidator;
import dev.flowc.validate.Violation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.List;

/**
 * Runs the whole pipeline: load, lower, validate. Failures of any phase come back as diagnostics.
 */
public final class WorkflowCompiler {

    private static final Logger log = LoggerFactory.getLogger(WorkflowCompiler.class);

    static final String MALFORMED_JSON = "P001";
    static final String INVALID_DOCUMENT = "P002";

    private final WorkflowLowerer lowerer;
    private final CapabilityBudget budget;

    public WorkflowCompiler() {
        this(new WorkflowLowerer(), CapabilityBudget.defaults());
    }

    public WorkflowCompiler(WorkflowLowerer lowerer, CapabilityBudget budget) {
        this.lowerer = lowerer;
        this.budget = budget;
    }

    /** Compile a workflow document given as JSON text. */
    public CompileResult compileString(String json) {
        Workflow workflow;
        try {
            workflow = WorkflowLoader.loadFromString(json);
        } catch (JsonProcessingException e) {
            return failure(new Diagnostic(MALFORMED_JSON, Phase.PARSE, "Malformed JSON: " + e.getOriginalMessage(), null));
        } catch (IOException e) {
            return failure(new Diagnostic(MALFORMED_JSON, Phase.PARSE, e.getMessage(), null));
        } catch (IllegalArgumentException e) {
            return failure(new Diagnostic(INVALID_DOCUMENT, Phase.PARSE, e.getMessage(), null));
        }
        return compile(workflow);
    }

    public CompileResult compile(Workflow workflow) {
        WorkflowIR ir;
        try {
            ir = lowerer.lower(workflow);
        } catch (LoweringException e) {
            log.debug("Lowering of '{}' failed with {} diagnostic(s)", workflow.id(), e.diagnostics().size());
            return new CompileResult.Failure(e.diagnostics());
        }

        List<Violation> violations = IrValidator.validate(ir, budget);
        if (!violations.isEmpty()) {
            log.debug("IR of '{}' has {} violation(s)", workflow.id(), violations.size());
            return new CompileResult.Failure(toDiagnostics(violations));
        }
        return new CompileResult.Success(ir);
    }

    /** IR violations as validation-phase diagnostics, keyed by the step they concern. */
    public static List<Diagnostic> toDiagnostics(List<Violation> violations) {
        return violations.stream()
            .map(v -> new Diagnostic(v.code(), Phase.IR_VALIDATE, v.message(), v.stepId()))
            .toList();
    }

    private static CompileResult failure(Diagnostic diagnostic) {
        return new CompileResult.Failure(List.of(diagnostic));
    }
}
