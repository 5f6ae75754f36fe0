package io.terraform.tfe.workspace;

import io.terraform.tfe.agentpool.AgentPool;
import io.terraform.tfe.jsonapi.JsonApiAttribute;
import io.terraform.tfe.jsonapi.JsonApiId;
import io.terraform.tfe.jsonapi.JsonApiRelation;
import io.terraform.tfe.jsonapi.JsonApiResource;
import io.terraform.tfe.organization.Organization;
import io.terraform.tfe.project.Project;
import io.terraform.tfe.run.Run;

import java.time.Instant;
import java.util.List;

@JsonApiResource("workspaces")
public final class Workspace {

    @JsonApiId
    private String id;

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

    @JsonApiAttribute("locked")
    private Boolean locked;

    @JsonApiAttribute("queue-all-runs")
    private Boolean queueAllRuns;

    @JsonApiAttribute("resource-count")
    private Integer resourceCount;

    @JsonApiAttribute("speculative-enabled")
    private Boolean speculativeEnabled;

    @JsonApiAttribute("terraform-version")
    private String terraformVersion;

    @JsonApiAttribute("working-directory")
    private String workingDirectory;

    @JsonApiAttribute("tag-names")
    private List<String> tagNames;

    @JsonApiAttribute("environment")
    private String environment;

    @JsonApiAttribute("created-at")
    private Instant createdAt;

    @JsonApiAttribute("updated-at")
    private Instant updatedAt;

    @JsonApiAttribute("actions")
    private WorkspaceActions actions;

    @JsonApiAttribute("permissions")
    private WorkspacePermissions permissions;

    @JsonApiRelation("organization")
    private Organization organization;

    @JsonApiRelation("project")
    private Project project;

    @JsonApiRelation("agent-pool")
    private AgentPool agentPool;

    @JsonApiRelation("current-run")
    private Run currentRun;

    public Workspace() {
    }

    /**
     * @return a workspace carrying only its ID, for use as a relationship reference.
     */
    public static Workspace reference(String id) {
        Workspace workspace = new Workspace();
        workspace.id = id;
        return workspace;
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

    public boolean isAutoApply() {
        return Boolean.TRUE.equals(autoApply);
    }

    public boolean isAllowDestroyPlan() {
        return Boolean.TRUE.equals(allowDestroyPlan);
    }

    public String getExecutionMode() {
        return executionMode;
    }

    public boolean isFileTriggersEnabled() {
        return Boolean.TRUE.equals(fileTriggersEnabled);
    }

    public boolean isLocked() {
        return Boolean.TRUE.equals(locked);
    }

    public boolean isQueueAllRuns() {
        return Boolean.TRUE.equals(queueAllRuns);
    }

    public int getResourceCount() {
        return resourceCount == null ? 0 : resourceCount;
    }

    public boolean isSpeculativeEnabled() {
        return Boolean.TRUE.equals(speculativeEnabled);
    }

    public String getTerraformVersion() {
        return terraformVersion;
    }

    public String getWorkingDirectory() {
        return workingDirectory;
    }

    public List<String> getTagNames() {
        return tagNames == null ? List.of() : tagNames;
    }

    public String getEnvironment() {
        return environment;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public WorkspaceActions getActions() {
        return actions;
    }

    public WorkspacePermissions getPermissions() {
        return permissions;
    }

    public Organization getOrganization() {
        return organization;
    }

    public Project getProject() {
        return project;
    }

    public AgentPool getAgentPool() {
        return agentPool;
    }

    public Run getCurrentRun() {
        return currentRun;
    }
}
