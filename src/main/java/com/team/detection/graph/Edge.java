package com.team.detection.graph;

import java.util.Objects;

/**
 * Unordered pair of distinct node names. {@link #of(String, String)} normalizes the order so that
 * {@code of(a, b).equals(of(b, a))}.
 */
public record Edge(String first, String second) {

    public Edge {
        Objects.requireNonNull(first, "first is required");
        Objects.requireNonNull(second, "second is required");
        if (first.equals(second)) {
            throw new IllegalArgumentException("self-loop on '" + first + "'");
        }
        if (first.compareTo(second) > 0) {
            throw new IllegalArgumentException("use Edge.of for unordered pairs");
        }
    }

    public static Edge of(String a, String b) {
        return a.compareTo(b) <= 0 ? new Edge(a, b) : new Edge(b, a);
    }

    public boolean touches(String node) {
        return first.equals(node) || second.equals(node);
    }

    public String other(String node) {
        if (first.equals(node)) return second;
        if (second.equals(node)) return first;
        throw new IllegalArgumentException("'" + node + "' is not an end of " + this);
    }
}
