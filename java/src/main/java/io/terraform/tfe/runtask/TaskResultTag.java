package io.terraform.tfe.runtask;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Label shown next to an outcome. {@code level} is one of {@code none}, {@code info}, {@code warning} or
 * {@code error}, or {@code null} for the default.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TaskResultTag(@JsonProperty("label") String label, @JsonProperty("level") String level) {
}
