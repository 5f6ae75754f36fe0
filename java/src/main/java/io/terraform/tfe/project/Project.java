package io.terraform.tfe.project;

import io.terraform.tfe.jsonapi.JsonApiAttribute;
import io.terraform.tfe.jsonapi.JsonApiId;
import io.terraform.tfe.jsonapi.JsonApiRelation;
import io.terraform.tfe.jsonapi.JsonApiResource;
import io.terraform.tfe.organization.Organization;

/**
 * A project groups workspaces and stacks inside an organization.
 */
@JsonApiResource("projects")
public final class Project {

    @JsonApiId
    private String id;

    @JsonApiAttribute("name")
    private String name;

    @JsonApiAttribute("description")
    private String description;

    @JsonApiAttribute("auto-destroy-activity-duration")
    private String autoDestroyActivityDuration;

    @JsonApiRelation("organization")
    private Organization organization;

    public Project() {
    }

    public static Project reference(String id) {
        Project project = new Project();
        project.id = id;
        return project;
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

    public String getAutoDestroyActivityDuration() {
        return autoDestroyActivityDuration;
    }

    public Organization getOrganization() {
        return organization;
    }
}
