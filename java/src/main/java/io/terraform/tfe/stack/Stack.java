package io.terraform.tfe.stack;

import io.terraform.tfe.agentpool.AgentPool;
import io.terraform.tfe.jsonapi.JsonApiAttribute;
import io.terraform.tfe.jsonapi.JsonApiId;
import io.terraform.tfe.jsonapi.JsonApiRelation;
import io.terraform.tfe.jsonapi.JsonApiResource;
import io.terraform.tfe.project.Project;

import java.time.Instant;

@JsonApiResource("stacks")
public final class Stack {

    @JsonApiId
    private String id;

    @JsonApiAttribute("name")
    private String name;

    @JsonApiAttribute("description")
    private String description;

    @JsonApiAttribute("vcs-repo")
    private StackVcsRepo vcsRepo;

    @JsonApiAttribute("speculative-enabled")
    private Boolean speculativeEnabled;

    @JsonApiAttribute("created-at")
    private Instant createdAt;

    @JsonApiAttribute("updated-at")
    private Instant updatedAt;

    @JsonApiAttribute("linked-stack-connections")
    private LinkedStackConnections linkedStackConnections;

    @JsonApiRelation("project")
    private Project project;

    @JsonApiRelation("agent-pool")
    private AgentPool agentPool;

    public Stack() {
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public String getDescription() {
        return description;
    }

    public StackVcsRepo getVcsRepo() {
        return vcsRepo;
    }

    public boolean isSpeculativeEnabled() {
        return Boolean.TRUE.equals(speculativeEnabled);
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public LinkedStackConnections getLinkedStackConnections() {
        return linkedStackConnections;
    }

    public Project getProject() {
        return project;
    }

    public AgentPool getAgentPool() {
        return agentPool;
    }
}
