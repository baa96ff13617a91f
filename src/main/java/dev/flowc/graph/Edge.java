package dev.flowc.graph;

/**
 * Directed edge between two node ids. Handles label the port an edge leaves or enters, e.g. the
 * {@code "true"} and {@code "false"} outputs of a conditional.
 */
public record Edge(
    String source,
    String target,
    String sourceHandle, // nullable
    String targetHandle // nullable
) {}
