package dev.flowc.lower;

import dev.flowc.graph.CyclicGraphException;

/**
 * Lowering-phase form of {@link CyclicGraphException}. {@link #nodeId()} lies on a cycle.
 */
public class CycleDetectedException extends LoweringException {

    public static final String CODE = "L001";

    private final String nodeId;

    public CycleDetectedException(CyclicGraphException cause) {
        super(CODE, "Cycle detected in workflow graph", cause.nodeId());
        this.nodeId = cause.nodeId();
        initCause(cause);
    }

    public String nodeId() {
        return nodeId;
    }
}
