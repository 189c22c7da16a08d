package com.nuti.fleet.protocol;

import com.nuti.fleet.model.Route;

final class RouteChecks {

    private RouteChecks() {
    }

    /**
     * An empty route only answers a request whose start is its destination.
     */
    static Route requireConsistent(RouteRequest request, Route route) throws ProtocolException {
        if (route.isEmpty() && request.startNode() != request.destinationNode()) {
            throw new ProtocolException("Empty route for " + request.startNode() + "->" + request.destinationNode());
        }
        return route;
    }
}
