package com.nuti.fleet.sim;

import java.util.Collection;
import java.util.OptionalInt;
import java.util.random.RandomGenerator;

/**
 * Shared road state: transient jams and the per-edge occupancy snapshot.
 * <p>
 * {@link #tick()} and {@link #updateOccupancy(Collection)} belong to the step boundary and
 * never run while cars are stepping. {@link #maybeStartJam} and {@link #factor} are called by
 * cars during a step and only ever see state committed at the previous boundary.
 * </p>
 */
public interface JamModel {

    double NO_JAM = 1.0;

    /**
     * Proposes a jam on {@code edgeId} if none is active, the edge held at least the configured
     * number of cars at the last boundary, and a draw from {@code rnd} falls under the jam
     * probability. A proposed jam becomes readable after the next {@link #tick()}.
     *
     * @return true when this car's proposal is the one currently staged for the edge
     */
    boolean maybeStartJam(int edgeId, int carId, RandomGenerator rnd);

    /**
     * @return the speed multiplier of the active jam, or {@link #NO_JAM}
     */
    double factor(int edgeId);

    /**
     * Ages every active jam by one step, drops the expired ones, then activates jams
     * proposed during the step that just ended.
     */
    void tick();

    /**
     * Replaces the occupancy snapshot with counts of driving, non-retired cars per current edge.
     */
    void updateOccupancy(Collection<CarAgent> cars);

    int occupancy(int edgeId);

    OptionalInt remainingSteps(int edgeId);

    int activeJamCount();
}
