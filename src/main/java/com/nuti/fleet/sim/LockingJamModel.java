package com.nuti.fleet.sim;

import com.nuti.fleet.util.DeterministicRng;

import java.util.Collection;
import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalInt;
import java.util.concurrent.locks.ReentrantLock;
import java.util.random.RandomGenerator;

/**
 * {@link JamModel} guarded by one lock. A jam's factor and remaining steps live in one
 * immutable entry, so they are always present or absent together.
 */
public final class LockingJamModel implements JamModel {

    private static final class ActiveJam {
        private final double factor;
        private final int remaining;

        private ActiveJam(double factor, int remaining) {
            this.factor = factor;
            this.remaining = remaining;
        }
    }

    private static final class ProposedJam {
        private final int carId;
        private final double factor;
        private final int steps;

        private ProposedJam(int carId, double factor, int steps) {
            this.carId = carId;
            this.factor = factor;
            this.steps = steps;
        }
    }

    private final JamSettings settings;
    private final ReentrantLock lock = new ReentrantLock();
    private final Map<Integer, ActiveJam> active = new HashMap<>();
    private final Map<Integer, ProposedJam> proposed = new HashMap<>();
    private volatile Map<Integer, Integer> occupancy = Map.of();

    public LockingJamModel(JamSettings settings) {
        this.settings = Objects.requireNonNull(settings, "settings");
    }

    @Override
    public boolean maybeStartJam(int edgeId, int carId, RandomGenerator rnd) {
        if (isActive(edgeId)) {
            return false;
        }
        if (occupancy(edgeId) < settings.minOccupancy()) {
            return false;
        }
        if (rnd.nextDouble() > settings.probability()) {
            return false;
        }
        double factor = DeterministicRng.uniform(rnd, settings.minFactor(), settings.maxFactor());
        int steps = DeterministicRng.uniformInt(rnd, settings.minSteps(), settings.maxSteps());

        lock.lock();
        try {
            // Lowest car id wins so the outcome does not depend on thread order.
            ProposedJam current = proposed.get(edgeId);
            if (current != null && current.carId < carId) {
                return false;
            }
            proposed.put(edgeId, new ProposedJam(carId, factor, steps));
            return true;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public double factor(int edgeId) {
        lock.lock();
        try {
            ActiveJam jam = active.get(edgeId);
            return (jam == null) ? NO_JAM : jam.factor;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void tick() {
        lock.lock();
        try {
            if (active.isEmpty() && proposed.isEmpty()) {
                return;
            }
            Iterator<Map.Entry<Integer, ActiveJam>> it = active.entrySet().iterator();
            while (it.hasNext()) {
                Map.Entry<Integer, ActiveJam> e = it.next();
                int left = e.getValue().remaining - 1;
                if (left <= 0) {
                    it.remove();
                } else {
                    e.setValue(new ActiveJam(e.getValue().factor, left));
                }
            }
            for (Map.Entry<Integer, ProposedJam> e : proposed.entrySet()) {
                active.put(e.getKey(), new ActiveJam(e.getValue().factor, e.getValue().steps));
            }
            proposed.clear();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void updateOccupancy(Collection<CarAgent> cars) {
        Map<Integer, Integer> counts = new HashMap<>();
        for (CarAgent car : cars) {
            if (!car.isOnRoad()) {
                continue;
            }
            counts.merge(car.currentEdge(), 1, Integer::sum);
        }
        occupancy = Map.copyOf(counts);
    }

    @Override
    public int occupancy(int edgeId) {
        return occupancy.getOrDefault(edgeId, 0);
    }

    @Override
    public OptionalInt remainingSteps(int edgeId) {
        lock.lock();
        try {
            ActiveJam jam = active.get(edgeId);
            return (jam == null) ? OptionalInt.empty() : OptionalInt.of(jam.remaining);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int activeJamCount() {
        lock.lock();
        try {
            return active.size();
        } finally {
            lock.unlock();
        }
    }

    private boolean isActive(int edgeId) {
        lock.lock();
        try {
            return active.containsKey(edgeId);
        } finally {
            lock.unlock();
        }
    }
}
