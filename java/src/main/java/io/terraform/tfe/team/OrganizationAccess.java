package io.terraform.tfe.team;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Organization-wide permissions granted to a team. Unset entries are omitted when sent.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record OrganizationAccess(
    @JsonProperty("manage-policies") Boolean managePolicies,
    @JsonProperty("manage-policy-overrides") Boolean managePolicyOverrides,
    @JsonProperty("manage-workspaces") Boolean manageWorkspaces,
    @JsonProperty("manage-vcs-settings") Boolean manageVcsSettings,
    @JsonProperty("manage-providers") Boolean manageProviders,
    @JsonProperty("manage-modules") Boolean manageModules,
    @JsonProperty("manage-run-tasks") Boolean manageRunTasks,
    @JsonProperty("manage-projects") Boolean manageProjects,
    @JsonProperty("manage-membership") Boolean manageMembership
) {
}
