package com.nuti.fleet.sim;

public enum RunMode {
    SEQUENTIAL,
    BARRIER,
    POOLED
}
