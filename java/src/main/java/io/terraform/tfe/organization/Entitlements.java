package io.terraform.tfe.organization;

import io.terraform.tfe.jsonapi.JsonApiAttribute;
import io.terraform.tfe.jsonapi.JsonApiId;
import io.terraform.tfe.jsonapi.JsonApiResource;

/**
 * Features an organization's plan entitles it to.
 */
@JsonApiResource("entitlement-sets")
public final class Entitlements {

    @JsonApiId
    private String id;

    @JsonApiAttribute("agents")
    private Boolean agents;

    @JsonApiAttribute("audit-logging")
    private Boolean auditLogging;

    @JsonApiAttribute("cost-estimation")
    private Boolean costEstimation;

    @JsonApiAttribute("operations")
    private Boolean operations;

    @JsonApiAttribute("private-module-registry")
    private Boolean privateModuleRegistry;

    @JsonApiAttribute("private-run-tasks")
    private Boolean privateRunTasks;

    @JsonApiAttribute("sentinel")
    private Boolean sentinel;

    @JsonApiAttribute("state-storage")
    private Boolean stateStorage;

    @JsonApiAttribute("teams")
    private Boolean teams;

    @JsonApiAttribute("vcs-integrations")
    private Boolean vcsIntegrations;

    public String getId() {
        return id;
    }

    public boolean isAgents() {
        return Boolean.TRUE.equals(agents);
    }

    public boolean isAuditLogging() {
        return Boolean.TRUE.equals(auditLogging);
    }

    public boolean isCostEstimation() {
        return Boolean.TRUE.equals(costEstimation);
    }

    public boolean isOperations() {
        return Boolean.TRUE.equals(operations);
    }

    public boolean isPrivateModuleRegistry() {
        return Boolean.TRUE.equals(privateModuleRegistry);
    }

    public boolean isPrivateRunTasks() {
        return Boolean.TRUE.equals(privateRunTasks);
    }

    public boolean isSentinel() {
        return Boolean.TRUE.equals(sentinel);
    }

    public boolean isStateStorage() {
        return Boolean.TRUE.equals(stateStorage);
    }

    public boolean isTeams() {
        return Boolean.TRUE.equals(teams);
    }

    public boolean isVcsIntegrations() {
        return Boolean.TRUE.equals(vcsIntegrations);
    }
}
