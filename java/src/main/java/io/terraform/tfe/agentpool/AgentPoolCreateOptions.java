package io.terraform.tfe.agentpool;

import io.terraform.tfe.jsonapi.JsonApiAttribute;
import io.terraform.tfe.jsonapi.JsonApiRelation;
import io.terraform.tfe.jsonapi.JsonApiResource;
import io.terraform.tfe.workspace.Workspace;

import java.util.List;

@JsonApiResource("agent-pools")
public final class AgentPoolCreateOptions {

    @JsonApiAttribute("name")
    private String name;

    @JsonApiAttribute("organization-scoped")
    private Boolean organizationScoped;

    @JsonApiRelation("allowed-workspaces")
    private List<Workspace> allowedWorkspaces;

    public AgentPoolCreateOptions name(String name) {
        this.name = name;
        return this;
    }

    public AgentPoolCreateOptions organizationScoped(Boolean organizationScoped) {
        this.organizationScoped = organizationScoped;
        return this;
    }

    public AgentPoolCreateOptions allowedWorkspaces(List<Workspace> allowedWorkspaces) {
        this.allowedWorkspaces = allowedWorkspaces == null ? null : List.copyOf(allowedWorkspaces);
        return this;
    }

    public String getName() {
        return name;
    }
}
