package dev.flowc.engine;

/**
 * One compiler message, tied to the visual node it concerns when there is one.
 */
public record Diagnostic(
    String code,
    Phase phase,
    String message,
    String nodeId // nullable
) {

    /** Single-line rendering, e.g. {@code [LOWER:L001] Cycle detected (node 'a')}. */
    public String format() {
        var sb = new StringBuilder();
        sb.append('[').append(phase).append(':').append(code).append("] ").append(message);
        if (nodeId != null) {
            sb.append(" (node '").append(nodeId).append("')");
        }
        return sb.toString();
    }
}
