package io.terraform.tfe.variableset;

import io.terraform.tfe.jsonapi.JsonApiAttribute;
import io.terraform.tfe.jsonapi.JsonApiId;
import io.terraform.tfe.jsonapi.JsonApiRelation;
import io.terraform.tfe.jsonapi.JsonApiResource;
import io.terraform.tfe.organization.Organization;
import io.terraform.tfe.project.Project;
import io.terraform.tfe.workspace.Workspace;

import java.time.Instant;
import java.util.List;

/**
 * A named group of variables shared by several workspaces or projects, or by the whole organization when global.
 */
@JsonApiResource("varsets")
public final class VariableSet {

    @JsonApiId
    private String id;

    @JsonApiAttribute("name")
    private String name;

    @JsonApiAttribute("description")
    private String description;

    @JsonApiAttribute("global")
    private Boolean global;

    @JsonApiAttribute("priority")
    private Boolean priority;

    @JsonApiAttribute("var-count")
    private Integer variableCount;

    @JsonApiAttribute("workspace-count")
    private Integer workspaceCount;

    @JsonApiAttribute("project-count")
    private Integer projectCount;

    @JsonApiAttribute("updated-at")
    private Instant updatedAt;

    @JsonApiRelation("organization")
    private Organization organization;

    @JsonApiRelation("workspaces")
    private List<Workspace> workspaces;

    @JsonApiRelation("projects")
    private List<Project> projects;

    public VariableSet() {
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

    public boolean isGlobal() {
        return Boolean.TRUE.equals(global);
    }

    /**
     * @return whether the set's values override workspace variables of the same key.
     */
    public boolean isPriority() {
        return Boolean.TRUE.equals(priority);
    }

    public int getVariableCount() {
        return variableCount == null ? 0 : variableCount;
    }

    public int getWorkspaceCount() {
        return workspaceCount == null ? 0 : workspaceCount;
    }

    public int getProjectCount() {
        return projectCount == null ? 0 : projectCount;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public Organization getOrganization() {
        return organization;
    }

    public List<Workspace> getWorkspaces() {
        return workspaces == null ? List.of() : workspaces;
    }

    public List<Project> getProjects() {
        return projects == null ? List.of() : projects;
    }
}
