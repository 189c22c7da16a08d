package com.nuti.fleet.protocol;

import java.io.IOException;

@FunctionalInterface
public interface RouteChannelFactory {

    /**
     * Opens the dedicated connection for one car.
     */
    RouteChannel open(int carId) throws IOException;
}
