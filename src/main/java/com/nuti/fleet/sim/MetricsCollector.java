package com.nuti.fleet.sim;

import com.nuti.fleet.model.CarStatus;

import java.util.Collection;

public final class MetricsCollector {

    private final int[] driving;
    private final int[] arrived;
    private final int[] waiting;
    private final int[] failed;

    public MetricsCollector(int steps) {
        this.driving = new int[steps];
        this.arrived = new int[steps];
        this.waiting = new int[steps];
        this.failed = new int[steps];
    }

    /**
     * Counts cars by status at the end of {@code step}; retired cars count only as failed.
     */
    public void record(int step, Collection<CarAgent> cars) {
        int d = 0;
        int a = 0;
        int w = 0;
        int f = 0;
        for (CarAgent car : cars) {
            if (car.isRetired()) {
                f++;
                continue;
            }
            CarStatus s = car.status();
            if (s == CarStatus.DRIVING) {
                d++;
            } else if (s == CarStatus.ARRIVED) {
                a++;
            } else {
                w++;
            }
        }
        driving[step] = d;
        arrived[step] = a;
        waiting[step] = w;
        failed[step] = f;
    }

    public int[] drivingPerStep() {
        return driving;
    }

    public int[] arrivedPerStep() {
        return arrived;
    }

    public int[] waitingPerStep() {
        return waiting;
    }

    public int[] failedPerStep() {
        return failed;
    }
}
