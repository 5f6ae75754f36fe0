package io.terraform.tfe.organization;

import io.terraform.tfe.jsonapi.JsonApiAttribute;
import io.terraform.tfe.jsonapi.JsonApiId;
import io.terraform.tfe.jsonapi.JsonApiRelation;
import io.terraform.tfe.jsonapi.JsonApiResource;

import java.time.Instant;

/**
 * An organization. Its name is its identifier and is unique within an installation.
 */
@JsonApiResource("organizations")
public final class Organization {

    @JsonApiId
    private String name;

    @JsonApiAttribute("email")
    private String email;

    @JsonApiAttribute("external-id")
    private String externalId;

    @JsonApiAttribute("collaborator-auth-policy")
    private String collaboratorAuthPolicy;

    @JsonApiAttribute("cost-estimation-enabled")
    private Boolean costEstimationEnabled;

    @JsonApiAttribute("created-at")
    private Instant createdAt;

    @JsonApiAttribute("trial-expires-at")
    private Instant trialExpiresAt;

    @JsonApiAttribute("saml-enabled")
    private Boolean samlEnabled;

    @JsonApiAttribute("owners-team-saml-role-id")
    private String ownersTeamSamlRoleId;

    @JsonApiAttribute("session-remember")
    private Integer sessionRemember;

    @JsonApiAttribute("session-timeout")
    private Integer sessionTimeout;

    @JsonApiAttribute("two-factor-conformant")
    private Boolean twoFactorConformant;

    @JsonApiAttribute("assessments-enforced")
    private Boolean assessmentsEnforced;

    @JsonApiAttribute("default-execution-mode")
    private String defaultExecutionMode;

    @JsonApiAttribute("permissions")
    private OrganizationPermissions permissions;

    @JsonApiRelation("entitlement-set")
    private Entitlements entitlements;

    public Organization() {
    }

    /**
     * @return an organization carrying only its name, for use as a relationship reference.
     */
    public static Organization reference(String name) {
        Organization organization = new Organization();
        organization.name = name;
        return organization;
    }

    public String getName() {
        return name;
    }

    public String getEmail() {
        return email;
    }

    public String getExternalId() {
        return externalId;
    }

    public String getCollaboratorAuthPolicy() {
        return collaboratorAuthPolicy;
    }

    public boolean isCostEstimationEnabled() {
        return Boolean.TRUE.equals(costEstimationEnabled);
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getTrialExpiresAt() {
        return trialExpiresAt;
    }

    public boolean isSamlEnabled() {
        return Boolean.TRUE.equals(samlEnabled);
    }

    public String getOwnersTeamSamlRoleId() {
        return ownersTeamSamlRoleId;
    }

    public int getSessionRemember() {
        return sessionRemember == null ? 0 : sessionRemember;
    }

    public int getSessionTimeout() {
        return sessionTimeout == null ? 0 : sessionTimeout;
    }

    public boolean isTwoFactorConformant() {
        return Boolean.TRUE.equals(twoFactorConformant);
    }

    public boolean isAssessmentsEnforced() {
        return Boolean.TRUE.equals(assessmentsEnforced);
    }

    public String getDefaultExecutionMode() {
        return defaultExecutionMode;
    }

    public OrganizationPermissions getPermissions() {
        return permissions;
    }

    /**
     * @return the entitlement set, populated only when requested through {@code include=entitlement-set}.
     */
    public Entitlements getEntitlements() {
        return entitlements;
    }
}
