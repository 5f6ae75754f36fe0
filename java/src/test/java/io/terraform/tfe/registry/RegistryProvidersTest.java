package io.terraform.tfe.registry;

import com.fasterxml.jackson.databind.JsonNode;
import io.terraform.tfe.ApiServer;
import io.terraform.tfe.ResourceList;
import io.terraform.tfe.TfeClient;
import io.terraform.tfe.TfeError;
import io.terraform.tfe.TfeException;
import io.terraform.tfe.internal.Json;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;

import static io.terraform.tfe.TfeAssertions.assertSentinel;
import static org.junit.jupiter.api.Assertions.*;

class RegistryProvidersTest {

    private static final String PROVIDER = "{\"id\":\"prov-1\",\"type\":\"registry-providers\","
        + "\"attributes\":{\"namespace\":\"acme\",\"name\":\"widgets\",\"registry-name\":\"private\","
        + "\"permissions\":{\"can-delete\":true},\"created-at\":\"2024-01-05T09:00:00.000Z\"},"
        + "\"relationships\":{\"organization\":{\"data\":{\"id\":\"acme\",\"type\":\"organizations\"}}}}";

    private ApiServer server;
    private TfeClient client;
    private RegistryProviders providers;

    @BeforeEach
    void setUp() throws Exception {
        server = ApiServer.start();
        client = server.client();
        providers = client.registryProviders();
    }

    @AfterEach
    void tearDown() {
        client.close();
        server.close();
    }

    @Test
    void listSendsRegistryFilters() throws Exception {
        server.respond("GET", "/api/v2/organizations/acme/registry-providers", 200, "{\"data\":[" + PROVIDER + "]}");

        ResourceList<RegistryProvider> list = providers.list("acme", new RegistryProviderListOptions()
            .registryName(RegistryName.PRIVATE)
            .search("wid"));

        RegistryProvider provider = list.getItems().get(0);
        assertEquals(RegistryName.PRIVATE, provider.getRegistryName());
        assertTrue(provider.getPermissions().canDelete());
        assertEquals("acme", provider.getOrganization().getName());
        assertEquals("filter[registry_name]=private&q=wid",
            URLDecoder.decode(server.lastRequest().query(), StandardCharsets.UTF_8));
    }

    @Test
    void createValidatesNameNamespaceAndRegistry() {
        assertSentinel(TfeError.REQUIRED_NAME, () -> providers.create("acme",
            new RegistryProviderCreateOptions().namespace("acme").registryName(RegistryName.PRIVATE)));
        assertSentinel(TfeError.INVALID_NAME, () -> providers.create("acme",
            new RegistryProviderCreateOptions().name("wid gets").namespace("acme").registryName(RegistryName.PRIVATE)));
        assertSentinel(TfeError.REQUIRED_NAMESPACE, () -> providers.create("acme",
            new RegistryProviderCreateOptions().name("widgets").registryName(RegistryName.PRIVATE)));
        assertSentinel(TfeError.INVALID_NAMESPACE, () -> providers.create("acme",
            new RegistryProviderCreateOptions().name("widgets").namespace("a/b").registryName(RegistryName.PRIVATE)));
        assertSentinel(TfeError.INVALID_REGISTRY_NAME, () -> providers.create("acme",
            new RegistryProviderCreateOptions().name("widgets").namespace("acme")));
        assertSentinel(TfeError.INVALID_ORG, () -> providers.create("",
            new RegistryProviderCreateOptions().name("widgets").namespace("acme").registryName(RegistryName.PRIVATE)));

        TfeException mismatch = assertSentinel(TfeError.PRIVATE_NAMESPACE_MISMATCH, () -> providers.create("acme",
            new RegistryProviderCreateOptions().name("widgets").namespace("other").registryName(RegistryName.PRIVATE)));
        assertEquals("namespace must match organization name for private providers", mismatch.getMessage());
        assertTrue(server.requests().isEmpty());
    }

    @Test
    void createPublicProviderUnderAnyNamespace() throws Exception {
        server.respond("POST", "/api/v2/organizations/acme/registry-providers", 201, "{\"data\":" + PROVIDER + "}");

        providers.create("acme", new RegistryProviderCreateOptions()
            .name("aws").namespace("hashicorp").registryName(RegistryName.PUBLIC));

        JsonNode attributes = Json.mapper().readTree(server.lastRequest().body()).at("/data/attributes");
        assertEquals("hashicorp", attributes.path("namespace").asText());
        assertEquals("public", attributes.path("registry-name").asText());
    }

    @Test
    void readAndDeleteAddressProviderByFourParts() throws Exception {
        String path = "/api/v2/organizations/acme/registry-providers/private/acme/widgets";
        server.respond("GET", path, 200, "{\"data\":" + PROVIDER + "}");
        server.respond("DELETE", path, 204, "");
        RegistryProviderId id = new RegistryProviderId("acme", RegistryName.PRIVATE, "acme", "widgets");

        assertEquals("widgets", providers.read(id).getName());
        providers.delete(id);

        assertEquals(path, server.lastRequest().path());
        assertSentinel(TfeError.INVALID_REGISTRY_NAME,
            () -> providers.read(new RegistryProviderId("acme", null, "acme", "widgets")));
    }

    @Test
    void listVersionsUsesRegistryBasePath() throws Exception {
        server.respond("GET", "/api/registry/v1/providers/hashicorp/aws/versions", 200,
            "{\"id\":\"hashicorp/aws\",\"versions\":[{\"version\":\"5.1.0\",\"protocols\":[\"5.0\"],"
                + "\"platforms\":[{\"os\":\"linux\",\"arch\":\"amd64\"}]}]}");

        ProviderVersions versions = providers.listVersions("hashicorp", "aws");

        assertEquals("hashicorp/aws", versions.id());
        assertEquals("5.1.0", versions.versions().get(0).version());
        assertEquals("amd64", versions.versions().get(0).platforms().get(0).arch());
        assertTrue(versions.warnings().isEmpty());
        assertSentinel(TfeError.REQUIRED_NAMESPACE, () -> providers.listVersions("", "aws"));
    }
}
