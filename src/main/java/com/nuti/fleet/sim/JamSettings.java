package com.nuti.fleet.sim;

/**
 * @param minOccupancy cars that must be on the edge, as of the last step boundary, before a jam can start
 */
public record JamSettings(
        double probability,
        double minFactor,
        double maxFactor,
        int minSteps,
        int maxSteps,
        int minOccupancy
) {

    public JamSettings {
        if (probability < 0.0 || probability > 1.0) {
            throw new IllegalArgumentException("jam probability must be in [0,1]");
        }
        if (minFactor <= 0.0 || maxFactor > 1.0 || maxFactor < minFactor) {
            throw new IllegalArgumentException("jam factor range must satisfy 0 < min <= max <= 1");
        }
        if (minSteps < 1 || maxSteps < minSteps) {
            throw new IllegalArgumentException("jam duration range must satisfy 1 <= min <= max");
        }
        if (minOccupancy < 0) {
            throw new IllegalArgumentException("jam minOccupancy must be >= 0");
        }
    }

    public static JamSettings defaults() {
        return new JamSettings(0.02, 0.2, 0.6, 5, 20, 3);
    }

    public static JamSettings disabled() {
        return new JamSettings(0.0, 1.0, 1.0, 1, 1, Integer.MAX_VALUE);
    }
}
