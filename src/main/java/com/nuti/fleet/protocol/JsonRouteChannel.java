package com.nuti.fleet.protocol;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.nuti.fleet.model.Route;

import java.io.IOException;
import java.util.List;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Structured encoding: one JSON object per line in each direction.
 */
public final class JsonRouteChannel implements RouteChannel {

    private final LineConnection connection;
    private final ObjectMapper mapper;

    public JsonRouteChannel(LineConnection connection, ObjectMapper mapper) {
        this.connection = connection;
        this.mapper = mapper;
    }

    @Override
    public Optional<Route> requestRoute(RouteRequest request) throws IOException {
        String reply = connection.exchange(mapper.writeValueAsString(RouteRequestMessage.of(request)));
        RouteResponseMessage msg = decode(reply, RouteResponseMessage.class);
        if (msg.isError()) {
            return Optional.empty();
        }

        if (msg.userId() == null || msg.carId() == null) {
            throw new ProtocolException("Route reply without user_id/car_id: '" + reply + "'");
        }
        if (msg.userId() != request.userId() || msg.carId() != request.carId()) {
            throw new ProtocolException("Route reply for user " + msg.userId() + " car " + msg.carId()
                    + " does not match request for user " + request.userId() + " car " + request.carId());
        }
        List<Integer> edges = msg.routeEdges();
        if (edges == null || edges.contains(null)) {
            throw new ProtocolException("Route reply without usable route_edges: '" + reply + "'");
        }
        if (msg.eta() == null) {
            throw new ProtocolException("Route reply without eta: '" + reply + "'");
        }
        return Optional.of(RouteChecks.requireConsistent(request, Route.ofEdges(msg.eta(), edges)));
    }

    @Override
    public boolean reportTraffic(TrafficReport report) throws IOException {
        String reply = connection.exchange(mapper.writeValueAsString(TrafficReportMessage.of(report)));
        TrafficAckMessage msg = decode(reply, TrafficAckMessage.class);
        if (msg.error() != null && !msg.error().isNull()) {
            return false;
        }
        if (!"ACK".equals(msg.status())) {
            throw new ProtocolException("Expected status ACK, got '" + reply + "'");
        }
        return true;
    }

    @Override
    public OptionalDouble predictTravelTime(int edgeId) {
        throw new UnsupportedOperationException("Travel time prediction is only available over the text protocol");
    }

    @Override
    public void close() throws IOException {
        connection.close();
    }

    private <T> T decode(String reply, Class<T> type) throws ProtocolException {
        try {
            T value = mapper.readValue(reply, type);
            if (value == null) {
                throw new ProtocolException("Empty JSON reply");
            }
            return value;
        } catch (JsonProcessingException e) {
            throw new ProtocolException("Malformed JSON reply: '" + reply + "'", e);
        }
    }
}
