package io.terraform.tfe.stack;

import io.terraform.tfe.agentpool.AgentPool;
import io.terraform.tfe.jsonapi.JsonApiAttribute;
import io.terraform.tfe.jsonapi.JsonApiRelation;
import io.terraform.tfe.jsonapi.JsonApiResource;
import io.terraform.tfe.project.Project;

@JsonApiResource("stacks")
public final class StackCreateOptions {

    @JsonApiAttribute("name")
    private String name;

    @JsonApiAttribute("description")
    private String description;

    @JsonApiAttribute("vcs-repo")
    private StackVcsRepo vcsRepo;

    @JsonApiRelation("project")
    private Project project;

    @JsonApiRelation("agent-pool")
    private AgentPool agentPool;

    public StackCreateOptions name(String name) {
        this.name = name;
        return this;
    }

    public StackCreateOptions description(String description) {
        this.description = description;
        return this;
    }

    public StackCreateOptions vcsRepo(StackVcsRepo vcsRepo) {
        this.vcsRepo = vcsRepo;
        return this;
    }

    public StackCreateOptions project(Project project) {
        this.project = project;
        return this;
    }

    public StackCreateOptions agentPool(AgentPool agentPool) {
        this.agentPool = agentPool;
        return this;
    }

    public String getName() {
        return name;
    }

    public Project getProject() {
        return project;
    }
}
