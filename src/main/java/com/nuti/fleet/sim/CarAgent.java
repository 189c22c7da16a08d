package com.nuti.fleet.sim;

import com.nuti.fleet.model.CarStatus;
import com.nuti.fleet.model.Edge;
import com.nuti.fleet.model.EdgeCatalog;
import com.nuti.fleet.model.Route;
import com.nuti.fleet.protocol.RouteChannel;
import com.nuti.fleet.protocol.ProtocolException;
import com.nuti.fleet.protocol.RouteChannelFactory;
import com.nuti.fleet.protocol.RouteRequest;
import com.nuti.fleet.protocol.TrafficReport;
import com.nuti.fleet.util.DeterministicRng;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.random.RandomGenerator;

/**
 * One simulated vehicle. All mutation happens on the thread executing {@link #step(int)};
 * the step boundary only reads it after every car has finished the step.
 */
public final class CarAgent {

    private static final Logger log = LoggerFactory.getLogger(CarAgent.class);

    static final double MIN_SPEED = 0.1;

    private final int carId;
    private final int userId;
    private final EdgeCatalog catalog;
    private final JamModel jams;
    private final DrivingSettings settings;
    private final RandomGenerator rnd;

    private RouteChannel channel;
    private IOException brokenChannel;

    private CarStatus status = CarStatus.WAITING_FOR_ROUTE;
    private List<Integer> route = List.of();
    private int edgeIndex;
    private double position;
    private double speed;
    private double desiredSpeed;
    private int speedHold;
    private int cooldown;
    private int totalDriveSteps;
    private int totalWaitSteps;
    private int arrivalStep = -1;
    private int src = -1;
    private int dst = -1;

    private boolean retired;
    private IOException failure;

    public CarAgent(int carId, EdgeCatalog catalog, JamModel jams, DrivingSettings settings, RandomGenerator rnd) {
        this.carId = carId;
        this.userId = carId;
        this.catalog = Objects.requireNonNull(catalog, "catalog");
        this.jams = Objects.requireNonNull(jams, "jams");
        this.settings = Objects.requireNonNull(settings, "settings");
        this.rnd = Objects.requireNonNull(rnd, "rnd");
    }

    public void connect(RouteChannelFactory channels) throws IOException {
        if (channel != null) {
            throw new IllegalStateException("car " + carId + " is already connected");
        }
        channel = channels.open(carId);
    }

    /**
     * Runs {@link #step(int)} and retires the car on a transport failure.
     *
     * @return false once the car no longer takes part in the run
     */
    public boolean advance(int step) {
        if (retired) {
            return false;
        }
        try {
            step(step);
            return true;
        } catch (IOException e) {
            retire(step, e);
            return false;
        }
    }

    public void step(int step) throws IOException {
        if (channel == null) {
            throw new IllegalStateException("car " + carId + " is not connected");
        }

        if (cooldown > 0) {
            cooldown--;
        }

        if ((status == CarStatus.WAITING_FOR_ROUTE || status == CarStatus.ARRIVED) && cooldown == 0) {
            requestNewRoute(step);
        }

        if (status == CarStatus.DRIVING) {
            drive(step);
        }

        if (speedHold > 0) {
            speedHold--;
        }

        if (status == CarStatus.DRIVING) {
            totalDriveSteps++;
        } else {
            totalWaitSteps++;
        }

        if (brokenChannel != null) {
            throw brokenChannel;
        }
    }

    private void requestNewRoute(int step) throws IOException {
        int nodeCount = catalog.nodeCount();
        int start = rnd.nextInt(Math.max(1, nodeCount));
        int destination = pickDestination(start, nodeCount);

        Optional<Route> reply = channel.requestRoute(new RouteRequest(userId, carId, start, destination, timestamp(step)));
        if (reply.isEmpty()) {
            status = CarStatus.WAITING_FOR_ROUTE;
            cooldown = settings.rerouteCooldown();
            return;
        }

        Route r = reply.get();
        route = r.edges();
        edgeIndex = 0;
        position = 0.0;
        status = route.isEmpty() ? CarStatus.WAITING_FOR_ROUTE : CarStatus.DRIVING;
        src = start;
        dst = destination;
        cooldown = settings.routeCooldown();
        log.debug("step {}: car {} route {}->{} eta={} edges={}", step, carId, start, destination, r.eta(), route.size());
    }

    private int pickDestination(int start, int nodeCount) {
        if (nodeCount <= 1) {
            return start;
        }
        int d = start;
        while (d == start) {
            d = rnd.nextInt(nodeCount);
        }
        return d;
    }

    private void drive(int step) throws IOException {
        if (edgeIndex >= route.size()) {
            status = CarStatus.ARRIVED;
            return;
        }
        int edgeId = route.get(edgeIndex);
        Edge edge = catalog.find(edgeId);
        if (edge == null) {
            status = CarStatus.WAITING_FOR_ROUTE;
            return;
        }

        if (settings.rerouteEvery() > 0 && step > 0 && step % settings.rerouteEvery() == 0) {
            rerouteAfter(edge, step);
        }

        jams.maybeStartJam(edgeId, carId, rnd);
        double jamFactor = jams.factor(edgeId);

        if (speedHold <= 0) {
            desiredSpeed = edge.speedLimit() * DeterministicRng.uniform(rnd, settings.minSpeedFactor(), settings.maxSpeedFactor());
            speedHold = DeterministicRng.uniformInt(rnd, settings.speedHoldMin(), settings.speedHoldMax());
        }
        double s = Math.max(MIN_SPEED, desiredSpeed * jamFactor);
        if (s > edge.speedLimit()) {
            s = edge.speedLimit();
        }
        speed = s;

        if (edge.length() <= 0.0) {
            position = 1.0;
        } else {
            position += (speed * settings.dt()) / edge.length();
        }

        if (brokenChannel == null && settings.reportEvery() > 0 && step % settings.reportEvery() == 0) {
            boolean acked = channel.reportTraffic(new TrafficReport(userId, carId, timestamp(step), edgeId, position, speed));
            if (!acked) {
                log.debug("step {}: car {} report for edge {} rejected", step, carId, edgeId);
            }
        }

        while (position >= 1.0 && status == CarStatus.DRIVING) {
            position -= 1.0;
            edgeIndex++;
            if (edgeIndex >= route.size()) {
                status = CarStatus.ARRIVED;
                cooldown = settings.arrivalCooldown();
                arrivalStep = step;
                log.info("step {}: car {} arrived {}->{}", step, carId, src, dst);
                break;
            }
        }
    }

    /**
     * Replaces everything after the current edge with a fresh route from the edge's end node.
     * Any failure keeps the existing route. A failure other than a bad reply leaves the
     * connection out of step with the server, so the car stops using it and retires once
     * the current step is done.
     */
    private void rerouteAfter(Edge current, int step) {
        int from = current.toNode();
        if (dst < 0 || from == dst) {
            return;
        }
        Optional<Route> reply;
        try {
            reply = channel.requestRoute(new RouteRequest(userId, carId, from, dst, timestamp(step)));
        } catch (ProtocolException e) {
            log.debug("step {}: car {} reroute {}->{} rejected, keeping current route: {}", step, carId, from, dst, e.getMessage());
            return;
        } catch (IOException e) {
            log.debug("step {}: car {} reroute {}->{} failed, keeping current route: {}", step, carId, from, dst, e.toString());
            brokenChannel = e;
            return;
        }
        if (reply.isEmpty() || reply.get().isEmpty()) {
            return;
        }
        List<Integer> spliced = new ArrayList<>(route.subList(0, edgeIndex + 1));
        spliced.addAll(reply.get().edges());
        route = List.copyOf(spliced);
    }

    private void retire(int step, IOException cause) {
        retired = true;
        failure = cause;
        log.warn("step {}: car {} left the run after a transport failure: {}", step, carId, cause.toString());
        try {
            close();
        } catch (IOException closeError) {
            cause.addSuppressed(closeError);
        }
    }

    private long timestamp(int step) {
        return Math.round(step * settings.dt() * 1000.0);
    }

    public void close() throws IOException {
        RouteChannel c = channel;
        channel = null;
        if (c != null) {
            c.close();
        }
    }

    public int carId() {
        return carId;
    }

    public int userId() {
        return userId;
    }

    public CarStatus status() {
        return status;
    }

    public List<Integer> route() {
        return route;
    }

    public int edgeIndex() {
        return edgeIndex;
    }

    /**
     * @return the edge the car is on, or {@code -1} past the end of its route
     */
    public int currentEdge() {
        return (edgeIndex < route.size()) ? route.get(edgeIndex) : -1;
    }

    public boolean isOnRoad() {
        return !retired && status == CarStatus.DRIVING && edgeIndex < route.size();
    }

    public double position() {
        return position;
    }

    public double speed() {
        return speed;
    }

    public int totalDriveSteps() {
        return totalDriveSteps;
    }

    public int totalWaitSteps() {
        return totalWaitSteps;
    }

    /**
     * @return the step of the latest arrival, or {@code -1}
     */
    public int arrivalStep() {
        return arrivalStep;
    }

    public boolean hasArrived() {
        return arrivalStep >= 0;
    }

    public int source() {
        return src;
    }

    public int destination() {
        return dst;
    }

    public int cooldown() {
        return cooldown;
    }

    public boolean isRetired() {
        return retired;
    }

    public IOException failure() {
        return failure;
    }

    public AgentSummary summary() {
        return new AgentSummary(carId, status, retired, arrivalStep, totalDriveSteps, totalWaitSteps, src, dst, route, edgeIndex);
    }
}
