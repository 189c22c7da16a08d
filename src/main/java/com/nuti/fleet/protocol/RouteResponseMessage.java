package com.nuti.fleet.protocol;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/**
 * Either the route fields or {@code error} are set.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
record RouteResponseMessage(
        @JsonProperty("user_id") Integer userId,
        @JsonProperty("car_id") Integer carId,
        @JsonProperty("route_edges") List<Integer> routeEdges,
        @JsonProperty("eta") Double eta,
        @JsonProperty("error") JsonNode error
) {

    boolean isError() {
        return error != null && !error.isNull();
    }
}
