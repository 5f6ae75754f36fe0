package io.terraform.tfe.team;

import com.fasterxml.jackson.annotation.JsonProperty;

public record TeamPermissions(
    @JsonProperty("can-destroy") boolean canDestroy,
    @JsonProperty("can-update-membership") boolean canUpdateMembership
) {
}
