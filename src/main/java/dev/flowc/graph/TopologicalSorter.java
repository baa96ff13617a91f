package dev.flowc.graph;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Kahn's algorithm with declaration-order tie breaking.
 */
public final class TopologicalSorter {

    private TopologicalSorter() {}

    /**
     * Order every node so that each edge points forward. When {@code entryId} names a node with no
     * predecessors it is released first.
     *
     * @throws CyclicGraphException if the graph is not acyclic; the exception names a node on a cycle
     */
    public static List<String> sort(WorkflowGraph graph, String entryId) throws CyclicGraphException {
        Map<String, Integer> inDegree = new HashMap<>();
        for (String id : graph.nodeIds()) {
            inDegree.put(id, graph.predecessors(id).size());
        }

        var order = new ArrayList<String>(graph.size());
        var released = new HashSet<String>();
        if (entryId != null && graph.contains(entryId) && inDegree.get(entryId) == 0) {
            release(graph, entryId, inDegree, order, released);
        }

        boolean progress = true;
        while (order.size() < graph.size() && progress) {
            progress = false;
            // Rescan in declaration order so ties resolve to the earliest declared node.
            for (String id : graph.nodeIds()) {
                if (!released.contains(id) && inDegree.get(id) == 0) {
                    release(graph, id, inDegree, order, released);
                    progress = true;
                    break;
                }
            }
        }

        if (order.size() < graph.size()) {
            throw new CyclicGraphException(nodeOnCycle(graph, released));
        }
        return order;
    }

    private static void release(WorkflowGraph graph, String id, Map<String, Integer> inDegree,
                                List<String> order, Set<String> released) {
        order.add(id);
        released.add(id);
        for (String successor : graph.successors(id)) {
            inDegree.merge(successor, -1, Integer::sum);
        }
    }

    /**
     * Every unreleased node has an unreleased predecessor, so walking backwards through them must
     * eventually revisit a node. The revisited node lies on a cycle.
     */
    private static String nodeOnCycle(WorkflowGraph graph, Set<String> released) {
        String current = graph.nodeIds().stream()
            .filter(id -> !released.contains(id))
            .findFirst()
            .orElseThrow();
        var seen = new LinkedHashSet<String>();
        while (seen.add(current)) {
            String next = null;
            for (String predecessor : graph.predecessors(current)) {
                if (!released.contains(predecessor)) {
                    next = predecessor;
                    break;
                }
            }
            if (next == null) {
                break;
            }
            current = next;
        }
        return current;
    }
}
