package com.nuti.fleet.testutil;

import com.nuti.fleet.model.Edge;
import com.nuti.fleet.model.EdgeCatalog;
import com.nuti.fleet.model.Route;
import com.nuti.fleet.protocol.RouteChannel;
import com.nuti.fleet.protocol.RouteChannelFactory;
import com.nuti.fleet.protocol.RouteRequest;
import com.nuti.fleet.protocol.TrafficReport;

import java.io.EOFException;
import java.io.IOException;
import java.net.ConnectException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Deterministic in-memory routing server: fewest-edges routes, ties broken by edge id.
 */
public final class FakeRoutingServer implements RouteChannelFactory {

    private final EdgeCatalog catalog;
    private final Map<Integer, List<Edge>> outgoing = new HashMap<>();
    private final Set<Integer> refused = ConcurrentHashMap.newKeySet();
    private final Map<Integer, Integer> breakAfter = new ConcurrentHashMap<>();
    private final AtomicInteger routeRequests = new AtomicInteger();
    private final AtomicInteger reports = new AtomicInteger();
    private final AtomicInteger opened = new AtomicInteger();
    private final AtomicInteger closed = new AtomicInteger();

    public FakeRoutingServer(EdgeCatalog catalog) {
        this.catalog = catalog;
        List<Edge> sorted = new ArrayList<>(catalog.edges());
        sorted.sort(Comparator.comparingInt(Edge::id));
        for (Edge e : sorted) {
            outgoing.computeIfAbsent(e.fromNode(), k -> new ArrayList<>()).add(e);
        }
    }

    public FakeRoutingServer refuseConnection(int carId) {
        refused.add(carId);
        return this;
    }

    /**
     * The car's connection drops on the exchange after {@code exchanges} successful ones.
     */
    public FakeRoutingServer breakConnectionAfter(int carId, int exchanges) {
        breakAfter.put(carId, exchanges);
        return this;
    }

    public int routeRequests() {
        return routeRequests.get();
    }

    public int reports() {
        return reports.get();
    }

    public int openedConnections() {
        return opened.get();
    }

    public int closedConnections() {
        return closed.get();
    }

    @Override
    public RouteChannel open(int carId) throws IOException {
        if (refused.contains(carId)) {
            throw new ConnectException("Connection refused");
        }
        opened.incrementAndGet();
        return new Channel(carId);
    }

    public Optional<Route> shortestPath(int src, int dst) {
        if (src == dst) {
            return Optional.of(Route.ofEdges(0.0, List.of()));
        }
        int[] viaEdge = new int[catalog.nodeCount()];
        Arrays.fill(viaEdge, -1);
        boolean[] seen = new boolean[catalog.nodeCount()];
        Deque<Integer> queue = new ArrayDeque<>();
        queue.add(src);
        seen[src] = true;
        while (!queue.isEmpty()) {
            int node = queue.poll();
            if (node == dst) {
                break;
            }
            for (Edge e : outgoing.getOrDefault(node, List.of())) {
                if (!seen[e.toNode()]) {
                    seen[e.toNode()] = true;
                    viaEdge[e.toNode()] = e.id();
                    queue.add(e.toNode());
                }
            }
        }
        if (!seen[dst]) {
            return Optional.empty();
        }

        List<Integer> edges = new ArrayList<>();
        double eta = 0.0;
        int node = dst;
        while (node != src) {
            Edge e = catalog.find(viaEdge[node]);
            edges.add(e.id());
            eta += e.length() / e.speedLimit();
            node = e.fromNode();
        }
        Collections.reverse(edges);
        return Optional.of(Route.ofEdges(eta, edges));
    }

    private final class Channel implements RouteChannel {

        private final int carId;
        private int exchanges;
        private boolean isClosed;

        private Channel(int carId) {
            this.carId = carId;
        }

        @Override
        public Optional<Route> requestRoute(RouteRequest request) throws IOException {
            exchange();
            routeRequests.incrementAndGet();
            return shortestPath(request.startNode(), request.destinationNode());
        }

        @Override
        public boolean reportTraffic(TrafficReport report) throws IOException {
            exchange();
            reports.incrementAndGet();
            return catalog.find(report.edgeId()) != null;
        }

        @Override
        public OptionalDouble predictTravelTime(int edgeId) throws IOException {
            exchange();
            Edge e = catalog.find(edgeId);
            return (e == null) ? OptionalDouble.empty() : OptionalDouble.of(e.length() / e.speedLimit());
        }

        @Override
        public void close() {
            if (!isClosed) {
                isClosed = true;
                closed.incrementAndGet();
            }
        }

        private void exchange() throws IOException {
            if (isClosed) {
                throw new IOException("channel closed");
            }
            Integer limit = breakAfter.get(carId);
            if (limit != null && exchanges >= limit) {
                throw new EOFException("Server closed connection");
            }
            exchanges++;
        }
    }
}
