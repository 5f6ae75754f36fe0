package io.terraform.tfe.agentpool;

import io.terraform.tfe.jsonapi.JsonApiAttribute;
import io.terraform.tfe.jsonapi.JsonApiId;
import io.terraform.tfe.jsonapi.JsonApiRelation;
import io.terraform.tfe.jsonapi.JsonApiResource;
import io.terraform.tfe.organization.Organization;
import io.terraform.tfe.workspace.Workspace;

import java.time.Instant;
import java.util.List;

@JsonApiResource("agent-pools")
public final class AgentPool {

    @JsonApiId
    private String id;

    @JsonApiAttribute("name")
    private String name;

    @JsonApiAttribute("agent-count")
    private Integer agentCount;

    @JsonApiAttribute("organization-scoped")
    private Boolean organizationScoped;

    @JsonApiAttribute("created-at")
    private Instant createdAt;

    @JsonApiRelation("organization")
    private Organization organization;

    @JsonApiRelation("workspaces")
    private List<Workspace> workspaces;

    @JsonApiRelation("allowed-workspaces")
    private List<Workspace> allowedWorkspaces;

    public AgentPool() {
    }

    public static AgentPool reference(String id) {
        AgentPool pool = new AgentPool();
        pool.id = id;
        return pool;
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public int getAgentCount() {
        return agentCount == null ? 0 : agentCount;
    }

    /**
     * @return whether every workspace of the organization may use the pool.
     */
    public boolean isOrganizationScoped() {
        return Boolean.TRUE.equals(organizationScoped);
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Organization getOrganization() {
        return organization;
    }

    /**
     * @return workspaces currently configured to run on the pool.
     */
    public List<Workspace> getWorkspaces() {
        return workspaces == null ? List.of() : workspaces;
    }

    public List<Workspace> getAllowedWorkspaces() {
        return allowedWorkspaces == null ? List.of() : allowedWorkspaces;
    }
}
