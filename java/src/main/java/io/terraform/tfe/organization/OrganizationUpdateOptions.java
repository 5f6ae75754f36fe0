package io.terraform.tfe.organization;

import io.terraform.tfe.jsonapi.JsonApiAttribute;
import io.terraform.tfe.jsonapi.JsonApiResource;

/**
 * Attributes to change on an organization. Unset attributes are left untouched.
 */
@JsonApiResource("organizations")
public final class OrganizationUpdateOptions {

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

    @JsonApiAttribute("assessments-enforced")
    private Boolean assessmentsEnforced;

    @JsonApiAttribute("default-execution-mode")
    private String defaultExecutionMode;

    public OrganizationUpdateOptions name(String name) {
        this.name = name;
        return this;
    }

    public OrganizationUpdateOptions email(String email) {
        this.email = email;
        return this;
    }

    public OrganizationUpdateOptions sessionTimeout(Integer minutes) {
        this.sessionTimeout = minutes;
        return this;
    }

    public OrganizationUpdateOptions sessionRemember(Integer minutes) {
        this.sessionRemember = minutes;
        return this;
    }

    public OrganizationUpdateOptions collaboratorAuthPolicy(String collaboratorAuthPolicy) {
        this.collaboratorAuthPolicy = collaboratorAuthPolicy;
        return this;
    }

    public OrganizationUpdateOptions costEstimationEnabled(Boolean costEstimationEnabled) {
        this.costEstimationEnabled = costEstimationEnabled;
        return this;
    }

    public OrganizationUpdateOptions assessmentsEnforced(Boolean assessmentsEnforced) {
        this.assessmentsEnforced = assessmentsEnforced;
        return this;
    }

    public OrganizationUpdateOptions defaultExecutionMode(String defaultExecutionMode) {
        this.defaultExecutionMode = defaultExecutionMode;
        return this;
    }

    public String getName() {
        return name;
    }
}
