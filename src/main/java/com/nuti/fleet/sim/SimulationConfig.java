package com.nuti.fleet.sim;

import java.nio.file.Path;
import java.util.Objects;

/**
 * @param threads worker pool size for {@link RunMode#POOLED}; ignored by the other modes
 * @param tickMillis pacing delay at the end of every step boundary
 * @param logEvery progress log interval in steps, {@code 0} disables it
 * @param outStepsCsv per-step metrics output, or {@code null}
 */
public record SimulationConfig(
        int cars,
        int steps,
        long seed,
        RunMode mode,
        int threads,
        long tickMillis,
        int logEvery,
        DrivingSettings driving,
        JamSettings jams,
        Path outStepsCsv
) {

    public SimulationConfig {
        if (cars < 0) {
            throw new IllegalArgumentException("cars must be >= 0");
        }
        if (steps < 0) {
            throw new IllegalArgumentException("steps must be >= 0");
        }
        if (threads <= 0) {
            throw new IllegalArgumentException("threads must be > 0");
        }
        if (tickMillis < 0 || logEvery < 0) {
            throw new IllegalArgumentException("tickMillis and logEvery must be >= 0");
        }
        Objects.requireNonNull(mode, "mode");
        Objects.requireNonNull(driving, "driving");
        Objects.requireNonNull(jams, "jams");
    }

    public SimulationConfig withMode(RunMode newMode, int newThreads) {
        return new SimulationConfig(cars, steps, seed, newMode, newThreads, tickMillis, logEvery, driving, jams, outStepsCsv);
    }
}
