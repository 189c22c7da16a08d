package com.nuti.fleet.protocol;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

@JsonIgnoreProperties(ignoreUnknown = true)
record TrafficAckMessage(
        @JsonProperty("status") String status,
        @JsonProperty("error") JsonNode error
) {
}
