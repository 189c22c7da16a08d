package com.nuti.fleet.model;

public enum CarStatus {
    WAITING_FOR_ROUTE,
    DRIVING,
    ARRIVED
}
