package io.terraform.tfe.registry;

import io.terraform.tfe.ResourceList;
import io.terraform.tfe.TfeClient;
import io.terraform.tfe.TfeError;
import io.terraform.tfe.TfeException;

import java.util.Objects;

import static io.terraform.tfe.internal.QueryEncoder.escape;
import static io.terraform.tfe.internal.Validation.validString;
import static io.terraform.tfe.internal.Validation.validStringId;

/**
 * Providers published to an organization's private registry, or public providers it curates.
 */
public final class RegistryProviders {

    private final TfeClient client;

    public RegistryProviders(TfeClient client) {
        this.client = Objects.requireNonNull(client, "client");
    }

    public ResourceList<RegistryProvider> list(String organization, RegistryProviderListOptions options)
        throws TfeException {
        return client.newRequest("GET", organizationPath(organization), null, options)
            .decodeList(RegistryProvider.class);
    }

    public RegistryProvider create(String organization, RegistryProviderCreateOptions options) throws TfeException {
        String path = organizationPath(organization);
        Objects.requireNonNull(options, "options");
        checkName(options.getName());
        checkNamespace(options.getNamespace());
        if (options.getRegistryName() == null) {
            throw new TfeException(TfeError.INVALID_REGISTRY_NAME);
        }
        if (options.getRegistryName() == RegistryName.PRIVATE && !organization.equals(options.getNamespace())) {
            throw new TfeException(TfeError.PRIVATE_NAMESPACE_MISMATCH);
        }
        return client.newRequest("POST", path, options, null).decode(RegistryProvider.class);
    }

    public RegistryProvider read(RegistryProviderId providerId) throws TfeException {
        return client.newRequest("GET", providerPath(providerId), null, null).decode(RegistryProvider.class);
    }

    public void delete(RegistryProviderId providerId) throws TfeException {
        client.newRequest("DELETE", providerPath(providerId), null, null).execute();
    }

    /**
     * Lists the versions the registry protocol advertises for a provider, served under the registry base path.
     */
    public ProviderVersions listVersions(String namespace, String name) throws TfeException {
        checkNamespace(namespace);
        checkName(name);
        String path = "v1/providers/" + escape(namespace) + "/" + escape(name) + "/versions";
        return client.newRegistryRequest("GET", path, null, null).decodeJson(ProviderVersions.class);
    }

    private static String providerPath(RegistryProviderId providerId) throws TfeException {
        Objects.requireNonNull(providerId, "providerId");
        String path = organizationPath(providerId.organizationName());
        checkName(providerId.name());
        checkNamespace(providerId.namespace());
        if (providerId.registryName() == null) {
            throw new TfeException(TfeError.INVALID_REGISTRY_NAME);
        }
        return path + "/" + escape(providerId.registryName().value())
            + "/" + escape(providerId.namespace())
            + "/" + escape(providerId.name());
    }

    private static void checkName(String name) throws TfeException {
        if (!validString(name)) {
            throw new TfeException(TfeError.REQUIRED_NAME);
        }
        if (!validStringId(name)) {
            throw new TfeException(TfeError.INVALID_NAME);
        }
    }

    private static void checkNamespace(String namespace) throws TfeException {
        if (!validString(namespace)) {
            throw new TfeException(TfeError.REQUIRED_NAMESPACE);
        }
        if (!validStringId(namespace)) {
            throw new TfeException(TfeError.INVALID_NAMESPACE);
        }
    }

    private static String organizationPath(String organization) throws TfeException {
        if (!validStringId(organization)) {
            throw new TfeException(TfeError.INVALID_ORG);
        }
        return "organizations/" + escape(organization) + "/registry-providers";
    }
}
