package dev.flowc.ir;

public record WorkflowMetadata(
    String id,
    String name,
    String description, // nullable
    String version,
    boolean testnet,
    String defaultChainSelector // nullable
) {}
