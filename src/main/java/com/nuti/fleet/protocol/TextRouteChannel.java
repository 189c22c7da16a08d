package com.nuti.fleet.protocol;

import com.nuti.fleet.model.Route;

import java.io.IOException;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Line-oriented encoding. Car and user ids are implied by the connection and not sent.
 */
public final class TextRouteChannel implements RouteChannel {

    private final LineConnection connection;
    private final boolean reportPosition;

    public TextRouteChannel(LineConnection connection) {
        this(connection, true);
    }

    /**
     * @param reportPosition when false, updates use the two-field {@code UPD <edge> <speed>} form
     */
    public TextRouteChannel(LineConnection connection, boolean reportPosition) {
        this.connection = connection;
        this.reportPosition = reportPosition;
    }

    @Override
    public Optional<Route> requestRoute(RouteRequest request) throws IOException {
        String reply = connection.exchange(TextProtocol.encodeRouteRequest(request.startNode(), request.destinationNode()));
        Optional<Route> route = TextProtocol.parseRoute(reply);
        if (route.isPresent()) {
            RouteChecks.requireConsistent(request, route.get());
        }
        return route;
    }

    @Override
    public boolean reportTraffic(TrafficReport report) throws IOException {
        String line = reportPosition
                ? TextProtocol.encodeUpdate(report.edgeId(), report.speed(), report.positionOnEdge())
                : TextProtocol.encodeUpdate(report.edgeId(), report.speed());
        return TextProtocol.parseAck(connection.exchange(line));
    }

    @Override
    public OptionalDouble predictTravelTime(int edgeId) throws IOException {
        return TextProtocol.parsePrediction(edgeId, connection.exchange(TextProtocol.encodePrediction(edgeId)));
    }

    @Override
    public void close() throws IOException {
        connection.close();
    }
}
