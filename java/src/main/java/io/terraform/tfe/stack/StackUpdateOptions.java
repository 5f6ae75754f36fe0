package io.terraform.tfe.stack;

import io.terraform.tfe.agentpool.AgentPool;
import io.terraform.tfe.jsonapi.JsonApiAttribute;
import io.terraform.tfe.jsonapi.JsonApiRelation;
import io.terraform.tfe.jsonapi.JsonApiResource;

@JsonApiResource("stacks")
public final class StackUpdateOptions {

    @JsonApiAttribute("name")
    private String name;

    @JsonApiAttribute("description")
    private String description;

    @JsonApiAttribute("vcs-repo")
    private StackVcsRepo vcsRepo;

    @JsonApiRelation("agent-pool")
    private AgentPool agentPool;

    public StackUpdateOptions name(String name) {
        this.name = name;
        return this;
    }

    public StackUpdateOptions description(String description) {
        this.description = description;
        return this;
    }

    public StackUpdateOptions vcsRepo(StackVcsRepo vcsRepo) {
        this.vcsRepo = vcsRepo;
        return this;
    }

    public StackUpdateOptions agentPool(AgentPool agentPool) {
        this.agentPool = agentPool;
        return this;
    }
}
