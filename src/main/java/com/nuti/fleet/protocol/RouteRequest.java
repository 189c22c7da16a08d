package com.nuti.fleet.protocol;

/**
 * @param timestamp simulated clock in milliseconds
 */
public record RouteRequest(
        int userId,
        int carId,
        int startNode,
        int destinationNode,
        long timestamp
) {
}
