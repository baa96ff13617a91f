package dev.flowc.lower;

import java.util.HashSet;
import java.util.Set;

/**
 * Mutable state of one structuring pass. Owned by a single {@code build} call and passed explicitly
 * through the recursion over branch arms.
 */
final class StructuringState {
    private final Set<String> consumed = new HashSet<>();
    private int branchCount;
    private int synthesizedCount;

    boolean isConsumed(String nodeId) {
        return consumed.contains(nodeId);
    }

    /** Record that a node has been placed in a block. Returns false if it already was. */
    boolean consume(String nodeId) {
        return consumed.add(nodeId);
    }

    int consumedCount() { return consumed.size(); }
    int branchCount() { return branchCount; }
    int synthesizedCount() { return synthesizedCount; }

    void recordBranch() { branchCount++; }
    void recordSynthesized() { synthesizedCount++; }
}
