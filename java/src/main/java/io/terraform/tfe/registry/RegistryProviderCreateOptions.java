package io.terraform.tfe.registry;

import io.terraform.tfe.jsonapi.JsonApiAttribute;
import io.terraform.tfe.jsonapi.JsonApiResource;

@JsonApiResource("registry-providers")
public final class RegistryProviderCreateOptions {

    @JsonApiAttribute("namespace")
    private String namespace;

    @JsonApiAttribute("name")
    private String name;

    @JsonApiAttribute("registry-name")
    private RegistryName registryName;

    public RegistryProviderCreateOptions namespace(String namespace) {
        this.namespace = namespace;
        return this;
    }

    public RegistryProviderCreateOptions name(String name) {
        this.name = name;
        return this;
    }

    public RegistryProviderCreateOptions registryName(RegistryName registryName) {
        this.registryName = registryName;
        return this;
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
}
