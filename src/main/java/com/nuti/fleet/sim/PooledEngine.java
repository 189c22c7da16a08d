package com.nuti.fleet.sim;

import com.nuti.fleet.model.EdgeCatalog;
import com.nuti.fleet.protocol.RouteChannelFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

/**
 * Bounded pool: every step submits one task per active car and waits for all of them
 * before running the boundary.
 */
public final class PooledEngine implements SimulationEngine {

    private static final Logger log = LoggerFactory.getLogger(PooledEngine.class);

    @Override
    public SimulationResult run(EdgeCatalog catalog, RouteChannelFactory channels, SimulationConfig config) {
        int threads = config.threads();
        int steps = config.steps();

        JamModel jams = new LockingJamModel(config.jams());
        List<CarAgent> cars = Fleet.create(catalog, jams, config);
        MetricsCollector metrics = new MetricsCollector(steps);
        StepBoundary boundary = new StepBoundary(cars, jams, metrics, config);

        ExecutorService pool = Executors.newFixedThreadPool(threads);
        try {
            connectAll(pool, cars, channels);

            log.info("START POOLED run cars={} steps={} threads={} seed={}", cars.size(), steps, threads, config.seed());
            long startNs = System.nanoTime();

            List<Callable<Boolean>> tasks = new ArrayList<>(cars.size());
            for (int step = 0; step < steps; step++) {
                tasks.clear();
                int s = step;
                for (CarAgent car : cars) {
                    if (!car.isRetired()) {
                        tasks.add(() -> car.advance(s));
                    }
                }
                for (Future<Boolean> f : pool.invokeAll(tasks)) {
                    await(f, "Car task failed at step " + step);
                }
                boundary.complete(step);
            }

            long elapsedMs = (System.nanoTime() - startNs) / 1_000_000L;
            log.info("END POOLED run elapsed={} ms", elapsedMs);

            Fleet.writeSteps(config, metrics);
            return SimulationResult.of(RunMode.POOLED, steps, threads, elapsedMs, cars);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SimulationAbortedException("Interrupted while waiting for car tasks", e);
        } finally {
            pool.shutdownNow();
            try {
                pool.awaitTermination(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            Fleet.closeAll(cars);
        }
    }

    private static void connectAll(ExecutorService pool, List<CarAgent> cars, RouteChannelFactory channels) throws InterruptedException {
        List<Callable<Void>> tasks = new ArrayList<>(cars.size());
        for (CarAgent car : cars) {
            tasks.add(() -> {
                car.connect(channels);
                return null;
            });
        }
        List<Future<Void>> futures = pool.invokeAll(tasks);
        for (int i = 0; i < futures.size(); i++) {
            try {
                futures.get(i).get();
            } catch (ExecutionException e) {
                Throwable cause = e.getCause();
                if (cause instanceof IOException) {
                    throw Fleet.connectFailure(cars.get(i).carId(), (IOException) cause);
                }
                throw new SimulationAbortedException("Setup failed for car " + cars.get(i).carId() + ": " + cause, cause);
            }
        }
    }

    private static <T> T await(Future<T> future, String context) throws InterruptedException {
        try {
            return future.get();
        } catch (ExecutionException e) {
            throw new SimulationAbortedException(context + ": " + e.getCause(), e.getCause());
        }
    }
}
