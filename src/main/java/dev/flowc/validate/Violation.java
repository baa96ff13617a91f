package dev.flowc.validate;

/**
 * One broken IR invariant.
 */
public record Violation(
    String code,
    String message,
    String stepId // nullable, workflow-level violations have no step
) {}
