package io.terraform.tfe.run;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Body of the apply, cancel and discard actions.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RunActionOptions(@JsonProperty("comment") String comment) {
}
