package io.terraform.tfe.run;

import com.fasterxml.jackson.annotation.JsonProperty;

public record RunActions(
    @JsonProperty("is-cancelable") boolean cancelable,
    @JsonProperty("is-confirmable") boolean confirmable,
    @JsonProperty("is-discardable") boolean discardable,
    @JsonProperty("is-force-cancelable") boolean forceCancelable
) {
}
