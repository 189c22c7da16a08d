package com.nuti.fleet.sim;

import com.nuti.fleet.model.EdgeCatalog;
import com.nuti.fleet.testutil.FakeRoutingServer;
import com.nuti.fleet.testutil.GraphFixtures;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class StepBoundaryTest {

    private static final EdgeCatalog GRID = GraphFixtures.grid(4, 4);

    private static SimulationConfig config(int cars, int steps, Path out) {
        return new SimulationConfig(cars, steps, 5L, RunMode.SEQUENTIAL, 1, 0, 1,
                DrivingSettings.defaults(), JamSettings.defaults(), out);
    }

    @Test
    void complete_publishesOccupancyOfCurrentEdges() throws IOException {
        SimulationConfig config = config(12, 30, null);
        JamModel jams = new LockingJamModel(config.jams());
        List<CarAgent> cars = Fleet.create(GRID, jams, config);
        MetricsCollector metrics = new MetricsCollector(config.steps());
        StepBoundary boundary = new StepBoundary(cars, jams, metrics, config);
        FakeRoutingServer server = new FakeRoutingServer(GRID);
        for (CarAgent car : cars) {
            car.connect(server);
        }

        for (int step = 0; step < config.steps(); step++) {
            for (CarAgent car : cars) {
                car.advance(step);
            }
            boundary.complete(step);

            Map<Integer, Integer> expected = new HashMap<>();
            for (CarAgent car : cars) {
                if (car.isOnRoad()) {
                    expected.merge(car.currentEdge(), 1, Integer::sum);
                }
            }
            for (int edgeId = 0; edgeId < GRID.edgeCount(); edgeId++) {
                assertEquals(expected.getOrDefault(edgeId, 0).intValue(), jams.occupancy(edgeId), "edge " + edgeId);
            }
            assertEquals(cars.size(), metrics.drivingPerStep()[step] + metrics.arrivedPerStep()[step]
                    + metrics.waitingPerStep()[step] + metrics.failedPerStep()[step]);
        }
        Fleet.closeAll(cars);
        assertEquals(12, server.closedConnections());
    }

    @Test
    void sequentialRun_writesOneCsvRowPerStep(@TempDir Path dir) throws IOException {
        Path out = dir.resolve("metrics").resolve("steps.csv");

        SimulationResult r = new SequentialEngine().run(GRID, new FakeRoutingServer(GRID), config(5, 25, out));

        List<String> lines = Files.readAllLines(out);
        assertEquals(26, lines.size());
        assertEquals("step,driving,arrived,waiting,failed", lines.get(0));
        assertTrue(lines.get(1).startsWith("0,"));
        assertTrue(lines.get(25).startsWith("24,"));
        for (String line : lines.subList(1, lines.size())) {
            String[] cols = line.split(",");
            assertEquals(5, cols.length);
            int total = Integer.parseInt(cols[1]) + Integer.parseInt(cols[2]) + Integer.parseInt(cols[3]) + Integer.parseInt(cols[4]);
            assertEquals(r.cars(), total);
        }
    }
}
