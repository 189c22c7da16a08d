package com.nuti.fleet.protocol;

import com.fasterxml.jackson.annotation.JsonProperty;

record TrafficReportMessage(
        @JsonProperty("user_id") int userId,
        @JsonProperty("car_id") int carId,
        @JsonProperty("timestamp") long timestamp,
        @JsonProperty("edge_id") int edgeId,
        @JsonProperty("position_on_edge") double positionOnEdge,
        @JsonProperty("speed") double speed
) {

    static TrafficReportMessage of(TrafficReport report) {
        return new TrafficReportMessage(
                report.userId(),
                report.carId(),
                report.timestamp(),
                report.edgeId(),
                report.positionOnEdge(),
                report.speed()
        );
    }
}
