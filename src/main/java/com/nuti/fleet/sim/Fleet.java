package com.nuti.fleet.sim;

import com.nuti.fleet.io.CsvStepsWriter;
import com.nuti.fleet.model.EdgeCatalog;
import com.nuti.fleet.util.DeterministicRng;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Setup and teardown shared by the engines.
 */
final class Fleet {

    private static final Logger log = LoggerFactory.getLogger(Fleet.class);

    private Fleet() {
    }

    static List<CarAgent> create(EdgeCatalog catalog, JamModel jams, SimulationConfig config) {
        List<CarAgent> cars = new ArrayList<>(config.cars());
        for (int carId = 0; carId < config.cars(); carId++) {
            cars.add(new CarAgent(carId, catalog, jams, config.driving(), DeterministicRng.forAgent(config.seed(), carId)));
        }
        return cars;
    }

    static SimulationAbortedException connectFailure(int carId, IOException cause) {
        return new SimulationAbortedException("connect failed for car " + carId + ": " + cause, cause);
    }

    static void closeAll(List<CarAgent> cars) {
        for (CarAgent car : cars) {
            try {
                car.close();
            } catch (IOException e) {
                log.warn("Failed to close connection of car {}", car.carId(), e);
            }
        }
    }

    static void writeSteps(SimulationConfig config, MetricsCollector metrics) {
        if (config.outStepsCsv() == null) {
            return;
        }
        new CsvStepsWriter().write(
                config.outStepsCsv(),
                metrics.drivingPerStep(),
                metrics.arrivedPerStep(),
                metrics.waitingPerStep(),
                metrics.failedPerStep()
        );
        log.info("Wrote per-step metrics to {}", config.outStepsCsv());
    }
}
