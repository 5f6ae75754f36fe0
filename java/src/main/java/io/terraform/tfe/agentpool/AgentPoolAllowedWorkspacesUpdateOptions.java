package io.terraform.tfe.agentpool;

import io.terraform.tfe.jsonapi.JsonApiRelation;
import io.terraform.tfe.jsonapi.JsonApiResource;
import io.terraform.tfe.workspace.Workspace;

import java.util.List;

/**
 * Replaces the pool's allowed workspaces. An empty list clears them.
 */
@JsonApiResource("agent-pools")
public final class AgentPoolAllowedWorkspacesUpdateOptions {

    @JsonApiRelation("allowed-workspaces")
    private List<Workspace> allowedWorkspaces = List.of();

    public AgentPoolAllowedWorkspacesUpdateOptions allowedWorkspaces(List<Workspace> allowedWorkspaces) {
        this.allowedWorkspaces = allowedWorkspaces == null ? List.of() : List.copyOf(allowedWorkspaces);
        return this;
    }
}
