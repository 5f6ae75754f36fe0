package io.terraform.tfe.workspace;

import io.terraform.tfe.agentpool.AgentPool;
import io.terraform.tfe.jsonapi.JsonApiAttribute;
import io.terraform.tfe.jsonapi.JsonApiRelation;
import io.terraform.tfe.jsonapi.JsonApiResource;
import io.terraform.tfe.project.Project;

@JsonApiResource("workspaces")
public final class WorkspaceCreateOptions {

    @JsonApiAttribute("name")
    private String name;

    @JsonApiAttribute("description")
    private String description;

    @JsonApiAttribute("auto-apply")
    private Boolean autoApply;

    @JsonApiAttribute("allow-destroy-plan")
    private Boolean allowDestroyPlan;

    @JsonApiAttribute("execution-mode")
    private String executionMode;

    @JsonApiAttribute("file-triggers-enabled")
    private Boolean fileTriggersEnabled;

    @JsonApiAttribute("queue-all-runs")
    private Boolean queueAllRuns;

    @JsonApiAttribute("speculative-enabled")
    private Boolean speculativeEnabled;

    @JsonApiAttribute("terraform-version")
    private String terraformVersion;

    @JsonApiAttribute("working-directory")
    private String workingDirectory;

    @JsonApiRelation("project")
    private Project project;

    @JsonApiRelation("agent-pool")
    private AgentPool agentPool;

    public WorkspaceCreateOptions name(String name) {
        this.name = name;
        return this;
    }

    public WorkspaceCreateOptions description(String description) {
        this.description = description;
        return this;
    }

    public WorkspaceCreateOptions autoApply(Boolean autoApply) {
        this.autoApply = autoApply;
        return this;
    }

    public WorkspaceCreateOptions allowDestroyPlan(Boolean allowDestroyPlan) {
        this.allowDestroyPlan = allowDestroyPlan;
        return this;
    }

    /**
     * One of {@code remote}, {@code local} or {@code agent}; {@code agent} requires an agent pool.
     */
    public WorkspaceCreateOptions executionMode(String executionMode) {
        this.executionMode = executionMode;
        return this;
    }

    public WorkspaceCreateOptions fileTriggersEnabled(Boolean fileTriggersEnabled) {
        this.fileTriggersEnabled = fileTriggersEnabled;
        return this;
    }

    public WorkspaceCreateOptions queueAllRuns(Boolean queueAllRuns) {
        this.queueAllRuns = queueAllRuns;
        return this;
    }

    public WorkspaceCreateOptions speculativeEnabled(Boolean speculativeEnabled) {
        this.speculativeEnabled = speculativeEnabled;
        return this;
    }

    public WorkspaceCreateOptions terraformVersion(String terraformVersion) {
        this.terraformVersion = terraformVersion;
        return this;
    }

    public WorkspaceCreateOptions workingDirectory(String workingDirectory) {
        this.workingDirectory = workingDirectory;
        return this;
    }

    public WorkspaceCreateOptions project(Project project) {
        this.project = project;
        return this;
    }

    public WorkspaceCreateOptions agentPool(AgentPool agentPool) {
        this.agentPool = agentPool;
        return this;
    }

    public String getName() {
        return name;
    }
}
