package com.nuti.fleet.sim;

public class SimulationAbortedException extends RuntimeException {

    public SimulationAbortedException(String message) {
        super(message);
    }

    public SimulationAbortedException(String message, Throwable cause) {
        super(message, cause);
    }
}
