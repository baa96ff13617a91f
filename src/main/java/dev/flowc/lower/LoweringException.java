package dev.flowc.lower;

import dev.flowc.engine.Diagnostic;
import dev.flowc.engine.Phase;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Lowering could not produce an IR. Carries every diagnostic collected before giving up.
 */
public class LoweringException extends Exception {

    private final List<Diagnostic> diagnostics;

    public LoweringException(String code, String message, String nodeId) {
        this(List.of(new Diagnostic(code, Phase.LOWER, message, nodeId)));
    }

    public LoweringException(List<Diagnostic> diagnostics) {
        super(diagnostics.stream().map(Diagnostic::format).collect(Collectors.joining("; ")));
        this.diagnostics = List.copyOf(diagnostics);
    }

    public List<Diagnostic> diagnostics() {
        return diagnostics;
    }
}
