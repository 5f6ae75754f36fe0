package io.terraform.tfe.workspace;

import com.fasterxml.jackson.annotation.JsonProperty;

public record WorkspaceActions(@JsonProperty("is-destroyable") boolean isDestroyable) {
}
