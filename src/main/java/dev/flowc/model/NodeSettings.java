package dev.flowc.model;

/**
 * Per-node options that apply regardless of the node kind.
 */
public record NodeSettings(
    String returnExpression, // nullable, value returned when the node ends a path
    LogSettings log // nullable
) {

    /** Emit a log line after the node runs. */
    public record LogSettings(String level, String messageTemplate) {}
}
