package com.nuti.fleet.protocol;

import com.fasterxml.jackson.annotation.JsonProperty;

record RouteRequestMessage(
        @JsonProperty("user_id") int userId,
        @JsonProperty("car_id") int carId,
        @JsonProperty("start_node") int startNode,
        @JsonProperty("destination_node") int destinationNode,
        @JsonProperty("timestamp") long timestamp
) {

    static RouteRequestMessage of(RouteRequest request) {
        return new RouteRequestMessage(
                request.userId(),
                request.carId(),
                request.startNode(),
                request.destinationNode(),
                request.timestamp()
        );
    }
}
