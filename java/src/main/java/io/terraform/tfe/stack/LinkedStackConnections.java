package io.terraform.tfe.stack;

import com.fasterxml.jackson.annotation.JsonProperty;

public record LinkedStackConnections(
    @JsonProperty("upstream-count") int upstreamCount,
    @JsonProperty("downstream-count") int downstreamCount,
    @JsonProperty("inputs-count") int inputsCount,
    @JsonProperty("outputs-count") int outputsCount
) {
}
