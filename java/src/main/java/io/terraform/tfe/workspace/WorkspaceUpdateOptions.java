package io.terraform.tfe.workspace;

import io.terraform.tfe.agentpool.AgentPool;
import io.terraform.tfe.jsonapi.JsonApiAttribute;
import io.terraform.tfe.jsonapi.JsonApiRelation;
import io.terraform.tfe.jsonapi.JsonApiResource;
import io.terraform.tfe.project.Project;

/**
 * Settings to change on a workspace. Unset settings are left untouched; a new name renames the workspace.
 */
@JsonApiResource("workspaces")
public final class WorkspaceUpdateOptions {

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

    public WorkspaceUpdateOptions name(String name) {
        this.name = name;
        return this;
    }

    public WorkspaceUpdateOptions description(String description) {
        this.description = description;
        return this;
    }

    public WorkspaceUpdateOptions autoApply(Boolean autoApply) {
        this.autoApply = autoApply;
        return this;
    }

    public WorkspaceUpdateOptions allowDestroyPlan(Boolean allowDestroyPlan) {
        this.allowDestroyPlan = allowDestroyPlan;
        return this;
    }

    /**
     * One of {@code remote}, {@code local} or {@code agent}; {@code agent} requires an agent pool.
     */
    public WorkspaceUpdateOptions executionMode(String executionMode) {
        this.executionMode = executionMode;
        return this;
    }

    public WorkspaceUpdateOptions fileTriggersEnabled(Boolean fileTriggersEnabled) {
        this.fileTriggersEnabled = fileTriggersEnabled;
        return this;
    }

    public WorkspaceUpdateOptions queueAllRuns(Boolean queueAllRuns) {
        this.queueAllRuns = queueAllRuns;
        return this;
    }

    public WorkspaceUpdateOptions speculativeEnabled(Boolean speculativeEnabled) {
        this.speculativeEnabled = speculativeEnabled;
        return this;
    }

    public WorkspaceUpdateOptions terraformVersion(String terraformVersion) {
        this.terraformVersion = terraformVersion;
        return this;
    }

    public WorkspaceUpdateOptions workingDirectory(String workingDirectory) {
        this.workingDirectory = workingDirectory;
        return this;
    }

    public WorkspaceUpdateOptions project(Project project) {
        this.project = project;
        return this;
    }

    public WorkspaceUpdateOptions agentPool(AgentPool agentPool) {
        this.agentPool = agentPool;
        return this;
    }

    public String getName() {
        return name;
    }
}
