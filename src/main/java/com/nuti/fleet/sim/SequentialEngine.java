package com.nuti.fleet.sim;

import com.nuti.fleet.model.EdgeCatalog;
import com.nuti.fleet.protocol.RouteChannelFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.List;

/**
 * Single-threaded reference: cars step one after another in id order.
 */
public final class SequentialEngine implements SimulationEngine {

    private static final Logger log = LoggerFactory.getLogger(SequentialEngine.class);

    @Override
    public SimulationResult run(EdgeCatalog catalog, RouteChannelFactory channels, SimulationConfig config) {
        JamModel jams = new LockingJamModel(config.jams());
        List<CarAgent> cars = Fleet.create(catalog, jams, config);
        MetricsCollector metrics = new MetricsCollector(config.steps());
        StepBoundary boundary = new StepBoundary(cars, jams, metrics, config);

        try {
            for (CarAgent car : cars) {
                try {
                    car.connect(channels);
                } catch (IOException e) {
                    throw Fleet.connectFailure(car.carId(), e);
                }
            }

            log.info("START SEQUENTIAL run cars={} steps={} seed={}", config.cars(), config.steps(), config.seed());
            long startNs = System.nanoTime();

            for (int step = 0; step < config.steps(); step++) {
                for (CarAgent car : cars) {
                    car.advance(step);
                }
                boundary.complete(step);
            }

            long elapsedMs = (System.nanoTime() - startNs) / 1_000_000L;
            log.info("END SEQUENTIAL run elapsed={} ms", elapsedMs);

            Fleet.writeSteps(config, metrics);
            return SimulationResult.of(RunMode.SEQUENTIAL, config.steps(), 1, elapsedMs, cars);
        } finally {
            Fleet.closeAll(cars);
        }
    }
}
