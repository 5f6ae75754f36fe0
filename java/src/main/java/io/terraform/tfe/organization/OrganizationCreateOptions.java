package io.terraform.tfe.organization;

import io.terraform.tfe.jsonapi.JsonApiAttribute;
import io.terraform.tfe.jsonapi.JsonApiResource;

@JsonApiResource("organizations")
public final class OrganizationCreateOptions {

    @JsonApiAttribute("name")
    private String name;

    @JsonApiAttribute("email")
    private String email;

    @JsonApiAttribute("session-timeout")
    private Integer sessionTimeout;

    @JsonApiAttribute("session-remember")
    private Integer sessionRemember;

    @JsonApiAttribute("collaborator-auth-policy")
    private String collaboratorAuthPolicy;

    @JsonApiAttribute("cost-estimation-enabled")
    private Boolean costEstimationEnabled;

    @JsonApiAttribute("owners-team-saml-role-id")
    private String ownersTeamSamlRoleId;

    @JsonApiAttribute("default-execution-mode")
    private String defaultExecutionMode;

    public OrganizationCreateOptions name(String name) {
        this.name = name;
        return this;
    }

    public OrganizationCreateOptions email(String email) {
        this.email = email;
        return this;
    }

    public OrganizationCreateOptions sessionTimeout(Integer minutes) {
        this.sessionTimeout = minutes;
        return this;
    }

    public OrganizationCreateOptions sessionRemember(Integer minutes) {
        this.sessionRemember = minutes;
        return this;
    }

    public OrganizationCreateOptions collaboratorAuthPolicy(String collaboratorAuthPolicy) {
        this.collaboratorAuthPolicy = collaboratorAuthPolicy;
        return this;
    }

    public OrganizationCreateOptions costEstimationEnabled(Boolean costEstimationEnabled) {
        this.costEstimationEnabled = costEstimationEnabled;
        return this;
    }

    public OrganizationCreateOptions ownersTeamSamlRoleId(String ownersTeamSamlRoleId) {
        this.ownersTeamSamlRoleId = ownersTeamSamlRoleId;
        return this;
    }

    public OrganizationCreateOptions defaultExecutionMode(String defaultExecutionMode) {
        this.defaultExecutionMode = defaultExecutionMode;
        return this;
    }

    public String getName() {
        return name;
    }

    public String getEmail() {
        return email;
    }
}
