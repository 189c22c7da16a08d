package com.nuti.fleet.protocol;

import com.nuti.fleet.model.Route;

import java.io.Closeable;
import java.io.IOException;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * One car's conversation with the routing/traffic server. Every call writes one
 * request and blocks for exactly one reply line.
 * <p>
 * Explicit rejections from the server are ordinary results. An {@link IOException}
 * (including {@link ProtocolException}) means the exchange is broken and the
 * channel should not be used again.
 * </p>
 */
public interface RouteChannel extends Closeable {

    /**
     * @return the route, or empty when the server reports that no route exists
     */
    Optional<Route> requestRoute(RouteRequest request) throws IOException;

    /**
     * @return true when the server acknowledged the report
     */
    boolean reportTraffic(TrafficReport report) throws IOException;

    /**
     * Predicted traversal time for one edge, in seconds.
     *
     * @return the prediction, or empty when the server rejects the query
     * @throws UnsupportedOperationException when the encoding has no such query
     */
    OptionalDouble predictTravelTime(int edgeId) throws IOException;

    @Override
    void close() throws IOException;
}
