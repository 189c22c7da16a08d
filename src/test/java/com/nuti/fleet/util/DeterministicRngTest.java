package com.nuti.fleet.util;

import org.junit.jupiter.api.Test;

import java.util.random.RandomGenerator;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class DeterministicRngTest {

    @Test
    void agentSeed_dependsOnRunSeedAndCarIdOnly() {
        assertEquals(DeterministicRng.agentSeed(42L, 3), DeterministicRng.agentSeed(42L, 3));
        assertNotEquals(DeterministicRng.agentSeed(42L, 3), DeterministicRng.agentSeed(42L, 4));
        assertNotEquals(DeterministicRng.agentSeed(42L, 3), DeterministicRng.agentSeed(43L, 3));
        assertEquals(DeterministicRng.mix64(1042L + 3), DeterministicRng.agentSeed(42L, 3));
    }

    @Test
    void forAgent_sameInputs_sameSequence() {
        RandomGenerator a = DeterministicRng.forAgent(7L, 2);
        RandomGenerator b = DeterministicRng.forAgent(7L, 2);

        for (int i = 0; i < 100; i++) {
            assertEquals(a.nextLong(), b.nextLong());
        }
    }

    @Test
    void uniform_staysInRange() {
        RandomGenerator rnd = DeterministicRng.forAgent(1L, 0);

        for (int i = 0; i < 1000; i++) {
            double v = DeterministicRng.uniform(rnd, 0.4, 1.0);
            assertTrue(v >= 0.4 && v <= 1.0, "value " + v);
            int k = DeterministicRng.uniformInt(rnd, 3, 10);
            assertTrue(k >= 3 && k <= 10, "value " + k);
        }
    }

    @Test
    void degenerateRanges_returnLowerBoundAndStillConsumeADraw() {
        RandomGenerator a = DeterministicRng.forAgent(5L, 1);
        RandomGenerator b = DeterministicRng.forAgent(5L, 1);

        assertEquals(0.5, DeterministicRng.uniform(a, 0.5, 0.5), 0.0);
        b.nextDouble();
        assertEquals(4, DeterministicRng.uniformInt(a, 4, 4));
        b.nextInt();

        assertEquals(b.nextLong(), a.nextLong());
    }
}
