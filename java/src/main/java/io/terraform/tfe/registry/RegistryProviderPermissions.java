package io.terraform.tfe.registry;

import com.fasterxml.jackson.annotation.JsonProperty;

public record RegistryProviderPermissions(@JsonProperty("can-delete") boolean canDelete) {
}
