package com.nuti.fleet.model;

import java.util.List;

/**
 * Route handed out by the routing server. {@code nodes} is empty unless the server
 * answered with the node-carrying reply form.
 */
public record Route(
        double eta,
        List<Integer> nodes,
        List<Integer> edges
) {

    public Route {
        nodes = List.copyOf(nodes);
        edges = List.copyOf(edges);
    }

    public static Route ofEdges(double eta, List<Integer> edges) {
        return new Route(eta, List.of(), edges);
    }

    public boolean isEmpty() {
        return edges.isEmpty();
    }
}
