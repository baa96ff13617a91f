package dev.flowc.model;

/**
 * One node of the visual graph.
 */
public record WorkflowNode(
    String id,
    String label,
    NodeConfig config,
    NodeSettings settings // nullable
) {

    public NodeKind kind() {
        return config.kind();
    }

    public boolean isTrigger() {
        return kind().isTrigger();
    }

    public boolean isTerminal() {
        return kind().isTerminal();
    }
}
