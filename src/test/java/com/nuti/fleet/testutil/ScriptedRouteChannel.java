package com.nuti.fleet.testutil;

import com.nuti.fleet.model.Route;
import com.nuti.fleet.protocol.RouteChannel;
import com.nuti.fleet.protocol.RouteRequest;
import com.nuti.fleet.protocol.TrafficReport;

import java.io.IOException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Answers route requests from a queue; an exhausted queue answers "no route".
 */
public final class ScriptedRouteChannel implements RouteChannel {

    private final Deque<Object> replies = new ArrayDeque<>();
    private final List<RouteRequest> routeRequests = new ArrayList<>();
    private final List<TrafficReport> reports = new ArrayList<>();
    private IOException reportFailure;
    private boolean closed;

    public ScriptedRouteChannel thenRoute(Integer... edges) {
        replies.add(Route.ofEdges(1.0, List.of(edges)));
        return this;
    }

    public ScriptedRouteChannel thenNoRoute() {
        replies.add(Optional.empty());
        return this;
    }

    public ScriptedRouteChannel thenFail(IOException e) {
        replies.add(e);
        return this;
    }

    public ScriptedRouteChannel failReportsWith(IOException e) {
        reportFailure = e;
        return this;
    }

    public List<RouteRequest> routeRequests() {
        return routeRequests;
    }

    public List<TrafficReport> reports() {
        return reports;
    }

    public boolean isClosed() {
        return closed;
    }

    @Override
    public Optional<Route> requestRoute(RouteRequest request) throws IOException {
        routeRequests.add(request);
        Object next = replies.poll();
        if (next instanceof IOException) {
            throw (IOException) next;
        }
        if (next instanceof Route) {
            return Optional.of((Route) next);
        }
        return Optional.empty();
    }

    @Override
    public boolean reportTraffic(TrafficReport report) throws IOException {
        if (reportFailure != null) {
            throw reportFailure;
        }
        reports.add(report);
        return true;
    }

    @Override
    public OptionalDouble predictTravelTime(int edgeId) {
        return OptionalDouble.empty();
    }

    @Override
    public void close() {
        closed = true;
    }
}
