package io.terraform.tfe.registry;

import io.terraform.tfe.jsonapi.JsonApiAttribute;
import io.terraform.tfe.jsonapi.JsonApiId;
import io.terraform.tfe.jsonapi.JsonApiRelation;
import io.terraform.tfe.jsonapi.JsonApiResource;
import io.terraform.tfe.organization.Organization;

import java.time.Instant;

@JsonApiResource("registry-providers")
public final class RegistryProvider {

    @JsonApiId
    private String id;

    @JsonApiAttribute("namespace")
    private String namespace;

    @JsonApiAttribute("name")
    private String name;

    @JsonApiAttribute("registry-name")
    private RegistryName registryName;

    @JsonApiAttribute("permissions")
    private RegistryProviderPermissions permissions;

    @JsonApiAttribute("created-at")
    private Instant createdAt;

    @JsonApiAttribute("updated-at")
    private Instant updatedAt;

    @JsonApiRelation("organization")
    private Organization organization;

    public RegistryProvider() {
    }

    public String getId() {
        return id;
    }

    public String getNamespace() {
        return namespace;
    }

    public String getName() {
        return name;
    }

    public RegistryName getRegistryName() {
        return registryName;
    }

    public RegistryProviderPermissions getPermissions() {
        return permissions;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public Organization getOrganization() {
        return organization;
    }
}
