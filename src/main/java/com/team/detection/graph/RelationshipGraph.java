package com.team.detection.graph;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Undirected, unweighted graph over display names. Adding an existing edge or a self-loop is a
 * no-op, so the edge set never holds duplicates. Nodes and edges keep insertion order.
 */
public class RelationshipGraph {

    private final Set<String> nodes = new LinkedHashSet<>();
    private final Set<Edge> edges = new LinkedHashSet<>();

    public boolean addNode(String name) {
        return nodes.add(name);
    }

    /**
     * Adds an edge, adding missing end nodes.
     *
     * @return true if the edge was not present before
     */
    public boolean addEdge(String a, String b) {
        if (a.equals(b)) {
            nodes.add(a);
            return false;
        }
        nodes.add(a);
        nodes.add(b);
        return edges.add(Edge.of(a, b));
    }

    public boolean hasEdge(String a, String b) {
        return !a.equals(b) && edges.contains(Edge.of(a, b));
    }

    public boolean hasNode(String name) {
        return nodes.contains(name);
    }

    public Set<String> getNodes() {
        return Collections.unmodifiableSet(nodes);
    }

    public Set<Edge> getEdges() {
        return Collections.unmodifiableSet(edges);
    }

    List<String> neighbors(String name) {
        return edges.stream()
                .filter(edge -> edge.touches(name))
                .map(edge -> edge.other(name))
                .toList();
    }

    public int nodeCount() {
        return nodes.size();
    }

    public int edgeCount() {
        return edges.size();
    }

    @Override
    public String toString() {
        return "RelationshipGraph{nodes=" + nodes.size() + ", edges=" + edges.size() + '}';
    }
}
