package dev.flowc.graph;

/**
 * The graph is not acyclic. {@link #nodeId()} lies on a cycle.
 */
public class CyclicGraphException extends Exception {

    private final String nodeId;

    public CyclicGraphException(String nodeId) {
        super("Cycle through node '%s'".formatted(nodeId));
        this.nodeId = nodeId;
    }

    public String nodeId() {
        return nodeId;
    }
}
