package io.terraform.tfe.team;

import io.terraform.tfe.jsonapi.JsonApiAttribute;
import io.terraform.tfe.jsonapi.JsonApiId;
import io.terraform.tfe.jsonapi.JsonApiRelation;
import io.terraform.tfe.jsonapi.JsonApiResource;
import io.terraform.tfe.organization.Organization;
import io.terraform.tfe.user.User;

import java.util.List;

@JsonApiResource("teams")
public final class Team {

    @JsonApiId
    private String id;

    @JsonApiAttribute("name")
    private String name;

    @JsonApiAttribute("users-count")
    private Integer userCount;

    @JsonApiAttribute("visibility")
    private String visibility;

    @JsonApiAttribute("sso-team-id")
    private String ssoTeamId;

    @JsonApiAttribute("allow-member-token-management")
    private Boolean allowMemberTokenManagement;

    @JsonApiAttribute("permissions")
    private TeamPermissions permissions;

    @JsonApiAttribute("organization-access")
    private OrganizationAccess organizationAccess;

    @JsonApiRelation("organization")
    private Organization organization;

    @JsonApiRelation("users")
    private List<User> users;

    public Team() {
    }

    public static Team reference(String id) {
        Team team = new Team();
        team.id = id;
        return team;
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public int getUserCount() {
        return userCount == null ? 0 : userCount;
    }

    /**
     * @return {@code secret} or {@code organization}.
     */
    public String getVisibility() {
        return visibility;
    }

    public String getSsoTeamId() {
        return ssoTeamId;
    }

    public boolean isAllowMemberTokenManagement() {
        return Boolean.TRUE.equals(allowMemberTokenManagement);
    }

    public TeamPermissions getPermissions() {
        return permissions;
    }

    public OrganizationAccess getOrganizationAccess() {
        return organizationAccess;
    }

    public Organization getOrganization() {
        return organization;
    }

    public List<User> getUsers() {
        return users == null ? List.of() : users;
    }
}
