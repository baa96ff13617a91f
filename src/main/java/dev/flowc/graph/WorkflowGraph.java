package dev.flowc.graph;

import dev.flowc.model.Workflow;
import dev.flowc.model.WorkflowEdge;
import dev.flowc.model.WorkflowNode;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Adjacency structure over node ids. Node insertion order is preserved and drives every ordering
 * decision downstream, so the same document always lowers to the same IR.
 */
public final class WorkflowGraph {

    private final Map<String, WorkflowNode> nodes = new LinkedHashMap<>();
    private final Map<String, List<Edge>> outgoing = new LinkedHashMap<>();
    private final Map<String, List<Edge>> incoming = new LinkedHashMap<>();

    /**
     * Build the graph of a loaded document. Edges whose endpoints are not declared nodes are ignored.
     */
    public static WorkflowGraph of(Workflow workflow) {
        var graph = new WorkflowGraph();
        workflow.nodes().forEach(graph::addNode);
        for (WorkflowEdge edge : workflow.edges()) {
            if (graph.contains(edge.source()) && graph.contains(edge.target())) {
                graph.addEdge(new Edge(edge.source(), edge.target(), edge.sourceHandle(), edge.targetHandle()));
            }
        }
        return graph;
    }

    public void addNode(WorkflowNode node) {
        nodes.putIfAbsent(node.id(), node);
        outgoing.putIfAbsent(node.id(), new ArrayList<>());
        incoming.putIfAbsent(node.id(), new ArrayList<>());
    }

    public void addEdge(Edge edge) {
        if (!contains(edge.source()) || !contains(edge.target())) {
            throw new IllegalArgumentException("Edge %s -> %s references an unknown node"
                .formatted(edge.source(), edge.target()));
        }
        outgoing.get(edge.source()).add(edge);
        incoming.get(edge.target()).add(edge);
    }

    public boolean contains(String id) {
        return nodes.containsKey(id);
    }

    /** The node with this id, or null. */
    public WorkflowNode node(String id) {
        return nodes.get(id);
    }

    /** Node ids in declaration order. */
    public List<String> nodeIds() {
        return List.copyOf(nodes.keySet());
    }

    public int size() {
        return nodes.size();
    }

    public List<Edge> outgoingEdges(String id) {
        return Collections.unmodifiableList(outgoing.getOrDefault(id, List.of()));
    }

    public List<Edge> incomingEdges(String id) {
        return Collections.unmodifiableList(incoming.getOrDefault(id, List.of()));
    }

    /** Distinct successor ids in edge order. */
    public List<String> successors(String id) {
        var result = new LinkedHashSet<String>();
        outgoingEdges(id).forEach(e -> result.add(e.target()));
        return List.copyOf(result);
    }

    /** Distinct predecessor ids in edge order. */
    public List<String> predecessors(String id) {
        var result = new LinkedHashSet<String>();
        incomingEdges(id).forEach(e -> result.add(e.source()));
        return List.copyOf(result);
    }

    public int outgoingCount(String id) {
        return outgoingEdges(id).size();
    }

    public int incomingCount(String id) {
        return incomingEdges(id).size();
    }

    /** Target of the first outgoing edge leaving through {@code handle}, or null. */
    public String successorVia(String id, String handle) {
        for (Edge edge : outgoingEdges(id)) {
            if (handle.equals(edge.sourceHandle())) {
                return edge.target();
            }
        }
        return null;
    }

    /**
     * Every node reachable from {@code start}, including {@code start} itself. Computed fresh on each
     * call. A null, empty or unknown start yields an empty set.
     */
    public Set<String> reachableFrom(String start) {
        var visited = new LinkedHashSet<String>();
        if (start == null || start.isEmpty() || !contains(start)) {
            return visited;
        }
        Deque<String> stack = new ArrayDeque<>();
        stack.push(start);
        while (!stack.isEmpty()) {
            String current = stack.pop();
            if (!visited.add(current)) {
                continue;
            }
            for (Edge edge : outgoingEdges(current)) {
                if (!visited.contains(edge.target())) {
                    stack.push(edge.target());
                }
            }
        }
        return visited;
    }
}
