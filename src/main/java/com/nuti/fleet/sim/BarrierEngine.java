package com.nuti.fleet.sim;

import com.nuti.fleet.model.EdgeCatalog;
import com.nuti.fleet.protocol.RouteChannelFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Phaser;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * One long-lived worker per car, all meeting the coordinator on a {@link Phaser}.
 * <p>
 * Every step takes two phases: a start gate the coordinator opens once the previous boundary
 * is done, and a done gate it waits on before running the next boundary. A car that fails
 * mid-run deregisters, so later phases no longer wait for it. A car that cannot connect
 * terminates the phaser, which releases everyone and aborts the run. Each worker closes
 * its own car's connection.
 * </p>
 */
public final class BarrierEngine implements SimulationEngine {

    private static final Logger log = LoggerFactory.getLogger(BarrierEngine.class);

    private static final long SHUTDOWN_WAIT_SECONDS = 5;

    @Override
    public SimulationResult run(EdgeCatalog catalog, RouteChannelFactory channels, SimulationConfig config) {
        int n = config.cars();
        int steps = config.steps();

        JamModel jams = new LockingJamModel(config.jams());
        List<CarAgent> cars = Fleet.create(catalog, jams, config);
        MetricsCollector metrics = new MetricsCollector(steps);
        StepBoundary boundary = new StepBoundary(cars, jams, metrics, config);

        Phaser phaser = new Phaser(n + 1);
        AtomicReference<Throwable> workerError = new AtomicReference<>();

        ExecutorService pool = Executors.newFixedThreadPool(Math.max(1, n));
        try {
            log.info("START BARRIER run cars={} steps={} seed={}", n, steps, config.seed());
            long startNs = System.nanoTime();

            for (CarAgent car : cars) {
                pool.execute(() -> runCar(car, channels, steps, phaser, workerError));
            }

            for (int step = 0; step < steps; step++) {
                awaitPhase(phaser, workerError);
                awaitPhase(phaser, workerError);
                boundary.complete(step);
            }

            pool.shutdown();
            awaitWorkers(pool);
            Throwable t = workerError.get();
            if (t != null) {
                throw abort(t);
            }

            long elapsedMs = (System.nanoTime() - startNs) / 1_000_000L;
            log.info("END BARRIER run elapsed={} ms", elapsedMs);

            Fleet.writeSteps(config, metrics);
            return SimulationResult.of(RunMode.BARRIER, steps, n, elapsedMs, cars);
        } finally {
            phaser.forceTermination();
            pool.shutdown();
            awaitWorkers(pool);
        }
    }

    private static void runCar(
            CarAgent car,
            RouteChannelFactory channels,
            int steps,
            Phaser phaser,
            AtomicReference<Throwable> workerError
    ) {
        try {
            try {
                car.connect(channels);
            } catch (IOException e) {
                workerError.compareAndSet(null, Fleet.connectFailure(car.carId(), e));
                phaser.forceTermination();
                return;
            }

            for (int step = 0; step < steps; step++) {
                if (phaser.arriveAndAwaitAdvance() < 0) {
                    return;
                }
                if (!car.advance(step)) {
                    phaser.arriveAndDeregister();
                    return;
                }
                if (phaser.arriveAndAwaitAdvance() < 0) {
                    return;
                }
            }
        } catch (Throwable t) {
            workerError.compareAndSet(null, t);
            phaser.forceTermination();
        } finally {
            try {
                car.close();
            } catch (IOException e) {
                log.warn("Failed to close connection of car {}", car.carId(), e);
            }
        }
    }

    private static void awaitPhase(Phaser phaser, AtomicReference<Throwable> workerError) {
        int phase = phaser.arriveAndAwaitAdvance();
        Throwable t = workerError.get();
        if (phase < 0 || t != null) {
            throw abort(t);
        }
    }

    private static SimulationAbortedException abort(Throwable t) {
        if (t instanceof SimulationAbortedException) {
            return (SimulationAbortedException) t;
        }
        if (t != null) {
            return new SimulationAbortedException("Car worker failed: " + t, t);
        }
        return new SimulationAbortedException("Car phaser terminated unexpectedly");
    }

    private static void awaitWorkers(ExecutorService pool) {
        try {
            if (!pool.awaitTermination(SHUTDOWN_WAIT_SECONDS, TimeUnit.SECONDS)) {
                log.warn("Car workers still running {} s after shutdown", SHUTDOWN_WAIT_SECONDS);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
