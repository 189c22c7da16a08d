package com.nuti.fleet.sim;

import com.nuti.fleet.model.CarStatus;

import java.util.List;

/**
 * End-of-run trajectory of one car.
 */
public record AgentSummary(
        int carId,
        CarStatus status,
        boolean retired,
        int arrivalStep,
        int totalDriveSteps,
        int totalWaitSteps,
        int source,
        int destination,
        List<Integer> route,
        int edgeIndex
) {

    public AgentSummary {
        route = List.copyOf(route);
    }
}
