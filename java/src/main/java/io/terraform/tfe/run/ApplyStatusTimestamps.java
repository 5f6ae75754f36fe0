package io.terraform.tfe.run;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

public record ApplyStatusTimestamps(
    @JsonProperty("canceled-at") Instant canceledAt,
    @JsonProperty("errored-at") Instant erroredAt,
    @JsonProperty("finished-at") Instant finishedAt,
    @JsonProperty("force-canceled-at") Instant forceCanceledAt,
    @JsonProperty("queued-at") Instant queuedAt,
    @JsonProperty("started-at") Instant startedAt
) {
}
