package io.terraform.tfe.organization;

import io.terraform.tfe.jsonapi.JsonApiAttribute;
import io.terraform.tfe.jsonapi.JsonApiId;
import io.terraform.tfe.jsonapi.JsonApiResource;

/**
 * Runs currently queued and executing across an organization.
 */
@JsonApiResource("organization-capacity")
public final class OrganizationCapacity {

    @JsonApiId
    private String organization;

    @JsonApiAttribute("pending")
    private Integer pending;

    @JsonApiAttribute("running")
    private Integer running;

    public String getOrganization() {
        return organization;
    }

    public int getPending() {
        return pending == null ? 0 : pending;
    }

    public int getRunning() {
        return running == null ? 0 : running;
    }
}
