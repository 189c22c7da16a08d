package com.nuti.fleet;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import com.nuti.fleet.graph.EdgeCatalogLoader;
import com.nuti.fleet.graph.GraphValidationException;
import com.nuti.fleet.model.EdgeCatalog;
import com.nuti.fleet.protocol.RouteChannelFactory;
import com.nuti.fleet.protocol.SocketRouteChannelFactory;
import com.nuti.fleet.protocol.WireProtocol;
import com.nuti.fleet.sim.DrivingSettings;
import com.nuti.fleet.sim.JamSettings;
import com.nuti.fleet.sim.RunMode;
import com.nuti.fleet.sim.SimulationAbortedException;
import com.nuti.fleet.sim.SimulationConfig;
import com.nuti.fleet.sim.SimulationEngine;
import com.nuti.fleet.sim.SimulationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.Locale;
import java.util.concurrent.Callable;

@Command(
        name = "fleet-sim",
        mixinStandardHelpOptions = true,
        description = "Time-stepped fleet of cars driving against a routing/traffic server."
)
public class Main implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(Main.class);

    @Option(names = "--host", defaultValue = "127.0.0.1", description = "Routing server host")
    private String host;

    @Option(names = "--port", defaultValue = "8080", description = "Routing server port")
    private int port;

    @Option(names = "--timeout", defaultValue = "3.0", description = "Connect and read timeout (seconds)")
    private double timeoutSeconds;

    @Option(names = "--protocol", defaultValue = "text", description = "Wire encoding: text|json")
    private String protocol;

    @Option(names = "--graph-dir", defaultValue = "data", description = "Directory holding graph.meta and edges.csv")
    private Path graphDir;

    @Option(names = "--mode", defaultValue = "barrier", description = "Scheduling: seq|barrier|pool")
    private String mode;

    @Option(names = "--threads", defaultValue = "4", description = "Worker threads for mode=pool")
    private int threads;

    @Option(names = "--cars", defaultValue = "10", description = "Number of cars")
    private int cars;

    @Option(names = "--steps", defaultValue = "200", description = "Number of simulated steps")
    private int steps;

    @Option(names = "--dt", defaultValue = "1.0", description = "Simulated seconds per step")
    private double dt;

    @Option(names = "--report-every", defaultValue = "5", description = "Traffic report interval in steps (0 disables)")
    private int reportEvery;

    @Option(names = "--reroute-every", defaultValue = "0", description = "Mid-route reroute interval in steps (0 disables)")
    private int rerouteEvery;

    @Option(names = "--sleep-ms", defaultValue = "0", description = "Pacing delay after every step")
    private long sleepMs;

    @Option(names = "--log-every", defaultValue = "10", description = "Progress log interval in steps (0 disables)")
    private int logEvery;

    @Option(names = "--seed", defaultValue = "1", description = "Run seed")
    private long seed;

    @Option(names = "--min-speed-factor", defaultValue = "0.4")
    private double minSpeedFactor;

    @Option(names = "--max-speed-factor", defaultValue = "1.0")
    private double maxSpeedFactor;

    @Option(names = "--jam-prob", defaultValue = "0.02")
    private double jamProb;

    @Option(names = "--jam-min-factor", defaultValue = "0.2")
    private double jamMinFactor;

    @Option(names = "--jam-max-factor", defaultValue = "0.6")
    private double jamMaxFactor;

    @Option(names = "--jam-min-steps", defaultValue = "5")
    private int jamMinSteps;

    @Option(names = "--jam-max-steps", defaultValue = "20")
    private int jamMaxSteps;

    @Option(names = "--jam-min-cars", defaultValue = "3")
    private int jamMinCars;

    @Option(names = "--speed-hold-min", defaultValue = "3")
    private int speedHoldMin;

    @Option(names = "--speed-hold-max", defaultValue = "10")
    private int speedHoldMax;

    @Option(names = "--route-cooldown-steps", defaultValue = "0")
    private int routeCooldown;

    @Option(names = "--reroute-cooldown-steps", defaultValue = "3")
    private int rerouteCooldown;

    @Option(names = "--arrival-cooldown-steps", defaultValue = "5")
    private int arrivalCooldown;

    @Option(names = "--out", description = "Per-step metrics CSV")
    private Path out;

    @Override
    public Integer call() {
        validateArgs();

        SimulationConfig config;
        WireProtocol wire;
        try {
            wire = parseProtocol(protocol);
            config = new SimulationConfig(
                    cars,
                    steps,
                    seed,
                    parseMode(mode),
                    threads,
                    sleepMs,
                    logEvery,
                    new DrivingSettings(dt, minSpeedFactor, maxSpeedFactor, speedHoldMin, speedHoldMax,
                            routeCooldown, rerouteCooldown, arrivalCooldown, rerouteEvery, reportEvery),
                    new JamSettings(jamProb, jamMinFactor, jamMaxFactor, jamMinSteps, jamMaxSteps, jamMinCars),
                    out
            );
        } catch (IllegalArgumentException e) {
            throw new CommandLine.ParameterException(new CommandLine(this), e.getMessage(), e);
        }

        EdgeCatalog catalog;
        try {
            catalog = new EdgeCatalogLoader().load(graphDir);
        } catch (GraphValidationException e) {
            log.error("Cannot load graph from {}: {}", graphDir, e.getMessage());
            return 2;
        }
        log.info("Loaded graph {} nodes={} edges={}", graphDir, catalog.nodeCount(), catalog.edgeCount());

        RouteChannelFactory channels = new SocketRouteChannelFactory(
                host, port, (int) Math.round(timeoutSeconds * 1000.0), wire);

        SimulationResult result;
        try {
            result = SimulationEngine.forMode(config.mode()).run(catalog, channels, config);
        } catch (SimulationAbortedException e) {
            log.error("Simulation aborted: {}", e.getMessage());
            return 1;
        }

        printSummary(result);
        return 0;
    }

    private void validateArgs() {
        if (port <= 0 || port > 65535) {
            throw new CommandLine.ParameterException(new CommandLine(this), "--port must be in [1,65535]");
        }
        if (timeoutSeconds < 0.0) {
            throw new CommandLine.ParameterException(new CommandLine(this), "--timeout must be >= 0");
        }
        if (cars < 0) {
            throw new CommandLine.ParameterException(new CommandLine(this), "--cars must be >= 0");
        }
        if (steps <= 0) {
            throw new CommandLine.ParameterException(new CommandLine(this), "--steps must be > 0");
        }
        if (threads <= 0) {
            throw new CommandLine.ParameterException(new CommandLine(this), "--threads must be > 0");
        }
    }

    private static void printSummary(SimulationResult r) {
        System.out.println();
        System.out.println("Simulation summary (" + r.mode() + ", " + r.timeMs() + " ms):");
        System.out.println("cars_total=" + r.cars() + " arrived=" + r.arrived() + " driving=" + r.driving()
                + " waiting=" + r.waiting() + " failed=" + r.failed());
        System.out.println(String.format(Locale.ROOT, "avg_drive_steps=%.2f", r.avgDriveSteps()));
        System.out.println(String.format(Locale.ROOT, "avg_wait_steps=%.2f", r.avgWaitSteps()));
        if (r.arrived() > 0) {
            System.out.println(String.format(Locale.ROOT, "avg_steps_to_arrive=%.2f", r.avgStepsToArrive()));
        }
    }

    static RunMode parseMode(String mode) {
        if (mode == null) {
            return RunMode.BARRIER;
        }
        return switch (mode.toLowerCase(Locale.ROOT)) {
            case "seq" -> RunMode.SEQUENTIAL;
            case "barrier" -> RunMode.BARRIER;
            case "pool" -> RunMode.POOLED;
            default -> throw new IllegalArgumentException("Invalid --mode: " + mode + " (expected seq|barrier|pool)");
        };
    }

    static WireProtocol parseProtocol(String protocol) {
        if (protocol == null) {
            return WireProtocol.TEXT;
        }
        return switch (protocol.toLowerCase(Locale.ROOT)) {
            case "text" -> WireProtocol.TEXT;
            case "json" -> WireProtocol.JSON;
            default -> throw new IllegalArgumentException("Invalid --protocol: " + protocol + " (expected text|json)");
        };
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new Main()).execute(args);
        System.exit(exitCode);
    }
}
