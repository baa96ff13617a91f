package dev.flowc.model;

/**
 * A directed edge. Handles are only meaningful on the two outgoing edges of an {@code if} node.
 */
public record WorkflowEdge(
    String id,
    String source,
    String target,
    String sourceHandle, // nullable
    String targetHandle // nullable
) {}
