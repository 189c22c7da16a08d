package com.nuti.fleet.sim;

import com.nuti.fleet.model.CarStatus;

import java.util.ArrayList;
import java.util.List;

/**
 * Run summary. Retired cars count only in {@code failed}. Among the others,
 * {@code arrived} counts cars that arrived at least once, so a car that arrived and set
 * off again is counted in both {@code arrived} and {@code driving}; {@code waiting}
 * counts the rest that never arrived.
 *
 * @param avgStepsToArrive mean arrival step over arrived, non-retired cars, {@code 0} when none arrived
 */
public record SimulationResult(
        RunMode mode,
        int cars,
        int steps,
        int threads,
        long timeMs,
        int arrived,
        int driving,
        int waiting,
        int failed,
        double avgDriveSteps,
        double avgWaitSteps,
        double avgStepsToArrive,
        List<AgentSummary> agents
) {

    public SimulationResult {
        agents = List.copyOf(agents);
    }

    static SimulationResult of(RunMode mode, int steps, int threads, long timeMs, List<CarAgent> cars) {
        int arrived = 0;
        int driving = 0;
        int waiting = 0;
        int failed = 0;
        long driveSum = 0;
        long waitSum = 0;
        long arrivalSum = 0;
        List<AgentSummary> agents = new ArrayList<>(cars.size());

        for (CarAgent car : cars) {
            driveSum += car.totalDriveSteps();
            waitSum += car.totalWaitSteps();
            agents.add(car.summary());
            if (car.isRetired()) {
                failed++;
                continue;
            }
            if (car.hasArrived()) {
                arrived++;
                arrivalSum += car.arrivalStep();
            }
            if (car.status() == CarStatus.DRIVING) {
                driving++;
            } else if (!car.hasArrived()) {
                waiting++;
            }
        }

        int n = cars.size();
        return new SimulationResult(
                mode,
                n,
                steps,
                threads,
                timeMs,
                arrived,
                driving,
                waiting,
                failed,
                (n > 0) ? driveSum / (double) n : 0.0,
                (n > 0) ? waitSum / (double) n : 0.0,
                (arrived > 0) ? arrivalSum / (double) arrived : 0.0,
                agents
        );
    }
}
