package io.terraform.tfe.registry;

import io.terraform.tfe.ListOptions;
import io.terraform.tfe.QueryValues;

public final class RegistryProviderListOptions extends ListOptions<RegistryProviderListOptions> {

    private RegistryName registryName;
    private String organizationName;
    private String search;

    public RegistryProviderListOptions registryName(RegistryName registryName) {
        this.registryName = registryName;
        return this;
    }

    public RegistryProviderListOptions organizationName(String organizationName) {
        this.organizationName = organizationName;
        return this;
    }

    /**
     * Fuzzy match on namespace and name.
     */
    public RegistryProviderListOptions search(String search) {
        this.search = search;
        return this;
    }

    @Override
    public void appendTo(QueryValues values) {
        super.appendTo(values);
        values.add("filter[registry_name]", registryName == null ? null : registryName.value());
        values.add("filter[organization_name]", organizationName);
        values.add("q", search);
    }

    @Override
    protected RegistryProviderListOptions self() {
        return this;
    }
}
