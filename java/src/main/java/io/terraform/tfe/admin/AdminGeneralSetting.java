package io.terraform.tfe.admin;

import io.terraform.tfe.jsonapi.JsonApiAttribute;
import io.terraform.tfe.jsonapi.JsonApiId;
import io.terraform.tfe.jsonapi.JsonApiResource;

/**
 * Installation-wide settings of a Terraform Enterprise instance.
 */
@JsonApiResource("general-settings")
public final class AdminGeneralSetting {

    @JsonApiId
    private String id;

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

    public AdminGeneralSetting() {
    }

    public String getId() {
        return id;
    }

    public boolean isLimitUserOrganizationCreation() {
        return Boolean.TRUE.equals(limitUserOrganizationCreation);
    }

    public boolean isApiRateLimitingEnabled() {
        return Boolean.TRUE.equals(apiRateLimitingEnabled);
    }

    /**
     * @return requests per second allowed per client when rate limiting is enabled.
     */
    public int getApiRateLimit() {
        return apiRateLimit == null ? 0 : apiRateLimit;
    }

    public boolean isSendPassingStatusesEnabled() {
        return Boolean.TRUE.equals(sendPassingStatusesEnabled);
    }

    public boolean isAllowSpeculativePlansOnPullRequestsFromForks() {
        return Boolean.TRUE.equals(allowSpeculativePlansOnPullRequestsFromForks);
    }

    public boolean isDefaultRemoteStateAccess() {
        return Boolean.TRUE.equals(defaultRemoteStateAccess);
    }
}
