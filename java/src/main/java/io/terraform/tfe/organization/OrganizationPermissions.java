package io.terraform.tfe.organization;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * What the current token may do with an organization.
 */
public record OrganizationPermissions(
    @JsonProperty("can-create-team") boolean canCreateTeam,
    @JsonProperty("can-create-workspace") boolean canCreateWorkspace,
    @JsonProperty("can-destroy") boolean canDestroy,
    @JsonProperty("can-manage-run-tasks") boolean canManageRunTasks,
    @JsonProperty("can-manage-subscription") boolean canManageSubscription,
    @JsonProperty("can-update") boolean canUpdate,
    @JsonProperty("can-update-api-token") boolean canUpdateApiToken
) {
}
