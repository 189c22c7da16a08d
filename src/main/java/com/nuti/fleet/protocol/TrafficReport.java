package com.nuti.fleet.protocol;

/**
 * @param timestamp simulated clock in milliseconds
 */
public record TrafficReport(
        int userId,
        int carId,
        long timestamp,
        int edgeId,
        double positionOnEdge,
        double speed
) {
}
