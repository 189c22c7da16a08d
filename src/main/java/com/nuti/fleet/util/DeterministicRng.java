package com.nuti.fleet.util;

import java.util.SplittableRandom;
import java.util.random.RandomGenerator;

public final class DeterministicRng {

    private static final long AGENT_SEED_OFFSET = 1000L;

    private DeterministicRng() {
    }

    public static long mix64(long z) {
        z = (z ^ (z >>> 33)) * 0xff51afd7ed558ccdL;
        z = (z ^ (z >>> 33)) * 0xc4ceb9fe1a85ec53L;
        return z ^ (z >>> 33);
    }

    /**
     * Seed of one car's private generator; a function of the run seed and the car id only.
     */
    public static long agentSeed(long runSeed, int carId) {
        return mix64(runSeed + AGENT_SEED_OFFSET + carId);
    }

    public static RandomGenerator forAgent(long runSeed, int carId) {
        return new SplittableRandom(agentSeed(runSeed, carId));
    }

    /**
     * Uniform draw in {@code [lo, hi]}; a degenerate range returns {@code lo} and still consumes one draw.
     */
    public static double uniform(RandomGenerator rnd, double lo, double hi) {
        double u = rnd.nextDouble();
        if (hi <= lo) {
            return lo;
        }
        return lo + (hi - lo) * u;
    }

    /**
     * Uniform integer in {@code [lo, hi]} inclusive.
     */
    public static int uniformInt(RandomGenerator rnd, int lo, int hi) {
        if (hi <= lo) {
            rnd.nextInt();
            return lo;
        }
        return lo + rnd.nextInt(hi - lo + 1);
    }
}
