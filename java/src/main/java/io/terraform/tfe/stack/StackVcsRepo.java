package io.terraform.tfe.stack;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Repository a stack reads its configuration from. Either an OAuth token or a GitHub App installation grants
 * access.
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record StackVcsRepo(
    @JsonProperty("identifier") String identifier,
    @JsonProperty("branch") String branch,
    @JsonProperty("github-app-installation-id") String githubAppInstallationId,
    @JsonProperty("oauth-token-id") String oauthTokenId
) {
}
