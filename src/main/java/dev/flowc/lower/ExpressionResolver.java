package dev.flowc.lower;

import dev.flowc.ir.ValueExpr;

/**
 * Turns the raw strings found in node configuration into typed expressions.
 */
public interface ExpressionResolver {

    /** Resolve a configuration string. A null input yields a null literal. */
    ValueExpr resolve(String raw);

    /** Expression for the output of {@code nodeId}, narrowed to {@code fieldPath} (empty for the whole value). */
    ValueExpr reference(String nodeId, String fieldPath);

    /** Like {@link #resolve(String)} but keeps absent optional values absent. */
    default ValueExpr resolveOptional(String raw) {
        return raw == null ? null : resolve(raw);
    }
}
