package com.nuti.fleet.sim;

import com.nuti.fleet.model.EdgeCatalog;
import com.nuti.fleet.protocol.RouteChannelFactory;

/**
 * Runs every car through {@code config.steps()} steps with a step boundary after each one.
 */
public interface SimulationEngine {

    /**
     * @throws SimulationAbortedException when a car cannot connect or a worker fails unexpectedly
     */
    SimulationResult run(EdgeCatalog catalog, RouteChannelFactory channels, SimulationConfig config);

    static SimulationEngine forMode(RunMode mode) {
        return switch (mode) {
            case SEQUENTIAL -> new SequentialEngine();
            case BARRIER -> new BarrierEngine();
            case POOLED -> new PooledEngine();
        };
    }
}
