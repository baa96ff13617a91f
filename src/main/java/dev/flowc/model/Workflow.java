package dev.flowc.model;

import java.util.List;

/**
 * A workflow document as authored in the visual editor: nodes, edges and global settings.
 */
public record Workflow(
    String id,
    String name,
    String description, // nullable
    String version,
    List<WorkflowNode> nodes,
    List<WorkflowEdge> edges,
    GlobalConfig globalConfig
) {

    /** The trigger node, or null when the document has none. */
    public WorkflowNode trigger() {
        return nodes.stream().filter(WorkflowNode::isTrigger).findFirst().orElse(null);
    }
}
