package io.terraform.tfe.run;

import com.fasterxml.jackson.annotation.JsonProperty;

public record RunPermissions(
    @JsonProperty("can-apply") boolean canApply,
    @JsonProperty("can-cancel") boolean canCancel,
    @JsonProperty("can-discard") boolean canDiscard,
    @JsonProperty("can-force-execute") boolean canForceExecute,
    @JsonProperty("can-force-cancel") boolean canForceCancel
) {
}
