package io.terraform.tfe.team;

import io.terraform.tfe.jsonapi.JsonApiAttribute;
import io.terraform.tfe.jsonapi.JsonApiResource;

@JsonApiResource("teams")
public final class TeamUpdateOptions {

    @JsonApiAttribute("name")
    private String name;

    @JsonApiAttribute("visibility")
    private String visibility;

    @JsonApiAttribute("sso-team-id")
    private String ssoTeamId;

    @JsonApiAttribute("allow-member-token-management")
    private Boolean allowMemberTokenManagement;

    @JsonApiAttribute("organization-access")
    private OrganizationAccess organizationAccess;

    public TeamUpdateOptions name(String name) {
        this.name = name;
        return this;
    }

    public TeamUpdateOptions visibility(String visibility) {
        this.visibility = visibility;
        return this;
    }

    public TeamUpdateOptions ssoTeamId(String ssoTeamId) {
        this.ssoTeamId = ssoTeamId;
        return this;
    }

    public TeamUpdateOptions allowMemberTokenManagement(Boolean allowMemberTokenManagement) {
        this.allowMemberTokenManagement = allowMemberTokenManagement;
        return this;
    }

    public TeamUpdateOptions organizationAccess(OrganizationAccess organizationAccess) {
        this.organizationAccess = organizationAccess;
        return this;
    }

    public String getName() {
        return name;
    }
}
