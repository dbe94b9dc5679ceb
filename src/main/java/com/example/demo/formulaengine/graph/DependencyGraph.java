package com.example.demo.formulaengine.graph;

import com.example.demo.formulaengine.model.CellAddress;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Directed graph over formula cells. An edge u -> v means v reads the result of u.
 * Parallel edges collapse; self-loops are kept since they mark a cell reading itself.
 */
public class DependencyGraph {

    private final Map<CellAddress, Set<CellAddress>> successors = new LinkedHashMap<>();
    private final Map<CellAddress, Set<CellAddress>> predecessors = new LinkedHashMap<>();
    private int edgeCount;

    public void addNode(CellAddress node) {
        successors.computeIfAbsent(node, k -> new LinkedHashSet<>());
        predecessors.computeIfAbsent(node, k -> new LinkedHashSet<>());
    }

    /**
     * @throws IllegalArgumentException if either end is not a node of the graph
     */
    public void addEdge(CellAddress from, CellAddress to) {
        if (!contains(from) || !contains(to)) {
            throw new IllegalArgumentException("Edge " + from + " -> " + to + " joins a cell outside the graph");
        }
        if (successors.get(from).add(to)) {
            predecessors.get(to).add(from);
            edgeCount++;
        }
    }

    public boolean contains(CellAddress node) {
        return successors.containsKey(node);
    }

    public boolean hasEdge(CellAddress from, CellAddress to) {
        return contains(from) && successors.get(from).contains(to);
    }

    public Set<CellAddress> getNodes() {
        return Collections.unmodifiableSet(successors.keySet());
    }

    public Set<CellAddress> getSuccessors(CellAddress node) {
        return Collections.unmodifiableSet(successors.getOrDefault(node, Collections.emptySet()));
    }

    public Set<CellAddress> getPredecessors(CellAddress node) {
        return Collections.unmodifiableSet(predecessors.getOrDefault(node, Collections.emptySet()));
    }

    public int inDegree(CellAddress node) {
        return predecessors.getOrDefault(node, Collections.emptySet()).size();
    }

    public int nodeCount() {
        return successors.size();
    }

    public int edgeCount() {
        return edgeCount;
    }
}
