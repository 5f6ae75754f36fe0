package io.terraform.tfe.user;

import com.fasterxml.jackson.annotation.JsonProperty;

public record TwoFactor(@JsonProperty("enabled") boolean enabled, @JsonProperty("verified") boolean verified) {
}
