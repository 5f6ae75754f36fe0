package io.terraform.tfe.registry;

/**
 * Identifies a provider within an organization's registry. Providers have no stable ID of their own in the API
 * paths; the four parts together address one.
 */
public record RegistryProviderId(String organizationName, RegistryName registryName, String namespace, String name) {
}
