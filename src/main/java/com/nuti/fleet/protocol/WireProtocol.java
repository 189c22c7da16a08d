package com.nuti.fleet.protocol;

public enum WireProtocol {
    TEXT,
    JSON
}
