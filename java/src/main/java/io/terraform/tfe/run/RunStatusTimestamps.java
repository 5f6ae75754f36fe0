package io.terraform.tfe.run;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Moments at which a run entered some of its states. States the run never reached are {@code null}.
 */
public record RunStatusTimestamps(
    @JsonProperty("plan-queueable-at") Instant planQueueableAt,
    @JsonProperty("planning-at") Instant planningAt,
    @JsonProperty("planned-at") Instant plannedAt,
    @JsonProperty("applying-at") Instant applyingAt,
    @JsonProperty("applied-at") Instant appliedAt,
    @JsonProperty("canceled-at") Instant canceledAt,
    @JsonProperty("discarded-at") Instant discardedAt,
    @JsonProperty("errored-at") Instant erroredAt
) {
}
