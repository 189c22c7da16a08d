package com.nuti.fleet.model;

/**
 * Directed road segment. A length of zero means the edge is traversed instantly.
 */
public record Edge(
        int id,
        int fromNode,
        int toNode,
        double length,
        double speedLimit
) {

    public Edge {
        if (length < 0.0) {
            throw new IllegalArgumentException("length must be >= 0 for edge " + id);
        }
        if (speedLimit <= 0.0) {
            throw new IllegalArgumentException("speedLimit must be > 0 for edge " + id);
        }
    }
}
