package com.nuti.fleet.sim;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Work done between two steps while no car is stepping.
 */
final class StepBoundary {

    private static final Logger log = LoggerFactory.getLogger(StepBoundary.class);

    private final List<CarAgent> cars;
    private final JamModel jams;
    private final MetricsCollector metrics;
    private final SimulationConfig config;

    StepBoundary(List<CarAgent> cars, JamModel jams, MetricsCollector metrics, SimulationConfig config) {
        this.cars = cars;
        this.jams = jams;
        this.metrics = metrics;
        this.config = config;
    }

    void complete(int step) {
        jams.updateOccupancy(cars);
        jams.tick();
        metrics.record(step, cars);

        int completed = step + 1;
        if (config.logEvery() > 0 && completed % config.logEvery() == 0) {
            log.info("step {}: driving={} arrived={} waiting={} failed={} jams={}",
                    completed,
                    metrics.drivingPerStep()[step],
                    metrics.arrivedPerStep()[step],
                    metrics.waitingPerStep()[step],
                    metrics.failedPerStep()[step],
                    jams.activeJamCount());
        }

        if (config.tickMillis() > 0) {
            try {
                Thread.sleep(config.tickMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new SimulationAbortedException("Interrupted while pacing step " + step, e);
            }
        }
    }
}
