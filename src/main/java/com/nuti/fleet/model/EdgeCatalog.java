package com.nuti.fleet.model;

import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * Immutable view of the road graph: node count plus every edge keyed by id.
 */
public final class EdgeCatalog {

    private final int nodeCount;
    private final Map<Integer, Edge> edges;

    public EdgeCatalog(int nodeCount, Collection<Edge> edges) {
        if (nodeCount < 0) {
            throw new IllegalArgumentException("nodeCount must be >= 0");
        }
        Map<Integer, Edge> byId = new HashMap<>();
        for (Edge e : edges) {
            if (byId.putIfAbsent(e.id(), e) != null) {
                throw new IllegalArgumentException("Duplicate edge id " + e.id());
            }
        }
        this.nodeCount = nodeCount;
        this.edges = Collections.unmodifiableMap(byId);
    }

    public int nodeCount() {
        return nodeCount;
    }

    public int edgeCount() {
        return edges.size();
    }

    /**
     * @return the edge with this id, or {@code null} when the catalog has none
     */
    public Edge find(int edgeId) {
        return edges.get(edgeId);
    }

    public Collection<Edge> edges() {
        return edges.values();
    }
}
