package io.terraform.tfe.admin;

import io.terraform.tfe.jsonapi.JsonApiAttribute;
import io.terraform.tfe.jsonapi.JsonApiResource;

@JsonApiResource("general-settings")
public final class AdminGeneralSettingsUpdateOptions {

    @JsonApiAttribute("limit-user-organization-creation")
    private Boolean limitUserOrganizationCreation;

    @JsonApiAttribute("api-rate-limiting-enabled")
    private Boolean apiRateLimitingEnabled;

    @JsonApiAttribute("api-rate-limit")
    private Integer apiRateLimit;

    @JsonApiAttribute("send-passing-statuses-for-untriggered-speculative-plans")
    private Boolean sendPassingStatusesEnabled;

    @JsonApiAttribute("allow-speculative-plans-on-pull-requests-from-forks")
    private Boolean allowSpeculativePlansOnPullRequestsFromForks;

    @JsonApiAttribute("default-remote-state-access")
    private Boolean defaultRemoteStateAccess;

    public AdminGeneralSettingsUpdateOptions limitUserOrganizationCreation(Boolean value) {
        this.limitUserOrganizationCreation = value;
        return this;
    }

    public AdminGeneralSettingsUpdateOptions apiRateLimitingEnabled(Boolean value) {
        this.apiRateLimitingEnabled = value;
        return this;
    }

    public AdminGeneralSettingsUpdateOptions apiRateLimit(Integer value) {
        this.apiRateLimit = value;
        return this;
    }

    public AdminGeneralSettingsUpdateOptions sendPassingStatusesEnabled(Boolean value) {
        this.sendPassingStatusesEnabled = value;
        return this;
    }

    public AdminGeneralSettingsUpdateOptions allowSpeculativePlansOnPullRequestsFromForks(Boolean value) {
        this.allowSpeculativePlansOnPullRequestsFromForks = value;
        return this;
    }

    public AdminGeneralSettingsUpdateOptions defaultRemoteStateAccess(Boolean value) {
        this.defaultRemoteStateAccess = value;
        return this;
    }
}
