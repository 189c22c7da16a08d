package com.nuti.fleet.sim;

/**
 * Per-car behaviour knobs. Durations are in steps, {@code dt} in seconds per step.
 *
 * @param rerouteEvery periodic mid-route reroute interval, {@code 0} disables it
 * @param reportEvery traffic report interval, {@code 0} disables reporting
 */
public record DrivingSettings(
        double dt,
        double minSpeedFactor,
        double maxSpeedFactor,
        int speedHoldMin,
        int speedHoldMax,
        int routeCooldown,
        int rerouteCooldown,
        int arrivalCooldown,
        int rerouteEvery,
        int reportEvery
) {

    public DrivingSettings {
        if (dt <= 0.0) {
            throw new IllegalArgumentException("dt must be > 0");
        }
        if (minSpeedFactor <= 0.0 || maxSpeedFactor < minSpeedFactor) {
            throw new IllegalArgumentException("speed factor range must satisfy 0 < min <= max");
        }
        if (speedHoldMin < 0 || speedHoldMax < speedHoldMin) {
            throw new IllegalArgumentException("speed hold range must satisfy 0 <= min <= max");
        }
        if (routeCooldown < 0 || rerouteCooldown < 0 || arrivalCooldown < 0) {
            throw new IllegalArgumentException("cooldowns must be >= 0");
        }
        if (rerouteEvery < 0 || reportEvery < 0) {
            throw new IllegalArgumentException("rerouteEvery and reportEvery must be >= 0");
        }
    }

    public static DrivingSettings defaults() {
        return new DrivingSettings(1.0, 0.4, 1.0, 3, 10, 0, 3, 5, 0, 5);
    }

    public DrivingSettings withRerouteEvery(int steps) {
        return new DrivingSettings(dt, minSpeedFactor, maxSpeedFactor, speedHoldMin, speedHoldMax, routeCooldown, rerouteCooldown, arrivalCooldown, steps, reportEvery);
    }

    public DrivingSettings withReportEvery(int steps) {
        return new DrivingSettings(dt, minSpeedFactor, maxSpeedFactor, speedHoldMin, speedHoldMax, routeCooldown, rerouteCooldown, arrivalCooldown, rerouteEvery, steps);
    }

    public DrivingSettings withCooldowns(int route, int reroute, int arrival) {
        return new DrivingSettings(dt, minSpeedFactor, maxSpeedFactor, speedHoldMin, speedHoldMax, route, reroute, arrival, rerouteEvery, reportEvery);
    }

    public DrivingSettings withSpeedFactors(double min, double max) {
        return new DrivingSettings(dt, min, max, speedHoldMin, speedHoldMax, routeCooldown, rerouteCooldown, arrivalCooldown, rerouteEvery, reportEvery);
    }
}
