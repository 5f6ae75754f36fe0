package io.terraform.tfe.workspace;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Body of the lock action, sent as plain JSON.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record WorkspaceLockOptions(@JsonProperty("reason") String reason) {
}
