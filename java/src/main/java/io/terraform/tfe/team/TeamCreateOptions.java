package io.terraform.tfe.team;

import io.terraform.tfe.jsonapi.JsonApiAttribute;
import io.terraform.tfe.jsonapi.JsonApiResource;

@JsonApiResource("teams")
public final class TeamCreateOptions {

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

    public TeamCreateOptions name(String name) {
        this.name = name;
        return this;
    }

    public TeamCreateOptions visibility(String visibility) {
        this.visibility = visibility;
        return this;
    }

    public TeamCreateOptions ssoTeamId(String ssoTeamId) {
        this.ssoTeamId = ssoTeamId;
        return this;
    }

    public TeamCreateOptions allowMemberTokenManagement(Boolean allowMemberTokenManagement) {
        this.allowMemberTokenManagement = allowMemberTokenManagement;
        return this;
    }

    public TeamCreateOptions organizationAccess(OrganizationAccess organizationAccess) {
        this.organizationAccess = organizationAccess;
        return this;
    }

    public String getName() {
        return name;
    }
}
