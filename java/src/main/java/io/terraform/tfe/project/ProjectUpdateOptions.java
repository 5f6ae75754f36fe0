package io.terraform.tfe.project;

import io.terraform.tfe.jsonapi.JsonApiAttribute;
import io.terraform.tfe.jsonapi.JsonApiResource;

@JsonApiResource("projects")
public final class ProjectUpdateOptions {

    @JsonApiAttribute("name")
    private String name;

    @JsonApiAttribute("description")
    private String description;

    @JsonApiAttribute("auto-destroy-activity-duration")
    private String autoDestroyActivityDuration;

    public ProjectUpdateOptions name(String name) {
        this.name = name;
        return this;
    }

    public ProjectUpdateOptions description(String description) {
        this.description = description;
        return this;
    }

    /**
     * Inactivity period after which workspaces in the project are destroyed, such as {@code 14d} or {@code 2h}.
     */
    public ProjectUpdateOptions autoDestroyActivityDuration(String duration) {
        this.autoDestroyActivityDuration = duration;
        return this;
    }

    public String getName() {
        return name;
    }
}
