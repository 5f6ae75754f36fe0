package io.terraform.tfe.agentpool;

import com.fasterxml.jackson.databind.JsonNode;
import io.terraform.tfe.ApiServer;
import io.terraform.tfe.ResourceList;
import io.terraform.tfe.TfeError;
import io.terraform.tfe.internal.Json;
import io.terraform.tfe.workspace.Workspace;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static io.terraform.tfe.TfeAssertions.assertSentinel;
import static org.junit.jupiter.api.Assertions.*;

class AgentPoolsTest {

    private static final String POOL = "{\"id\":\"apool-1\",\"type\":\"agent-pools\",\"attributes\":{"
        + "\"name\":\"builders\",\"agent-count\":4,\"organization-scoped\":false,"
        + "\"created-at\":\"2024-02-10T09:00:00Z\"},"
        + "\"relationships\":{\"allowed-workspaces\":{\"data\":[{\"id\":\"ws-1\",\"type\":\"workspaces\"}]},"
        + "\"workspaces\":{\"data\":[]}}}";

    private ApiServer server;
    private AgentPools agentPools;

    @BeforeEach
    void setUp() throws Exception {
        server = ApiServer.start();
        agentPools = server.client().agentPools();
    }

    @AfterEach
    void tearDown() {
        server.close();
    }

    @Test
    void listFiltersByAllowedWorkspaceName() throws Exception {
        server.respond("GET", "/api/v2/organizations/acme/agent-pools", 200, "{\"data\":[" + POOL + "]}");

        ResourceList<AgentPool> list = agentPools.list("acme", new AgentPoolListOptions()
            .allowedWorkspacesName("network")
            .include(AgentPoolIncludeOpt.WORKSPACES));

        AgentPool pool = list.getItems().get(0);
        assertEquals("builders", pool.getName());
        assertEquals(4, pool.getAgentCount());
        assertFalse(pool.isOrganizationScoped());
        assertEquals("ws-1", pool.getAllowedWorkspaces().get(0).getId());
        assertTrue(pool.getWorkspaces().isEmpty());
        assertEquals("filter[allowed_workspaces][name]=network&include=workspaces",
            URLDecoder.decode(server.lastRequest().query(), StandardCharsets.UTF_8));
    }

    @Test
    void createSendsAllowedWorkspaces() throws Exception {
        server.respond("POST", "/api/v2/organizations/acme/agent-pools", 201, "{\"data\":" + POOL + "}");

        agentPools.create("acme", new AgentPoolCreateOptions()
            .name("builders")
            .organizationScoped(false)
            .allowedWorkspaces(List.of(Workspace.reference("ws-1"))));

        JsonNode data = Json.mapper().readTree(server.lastRequest().body()).path("data");
        assertEquals("agent-pools", data.path("type").asText());
        assertFalse(data.at("/attributes/organization-scoped").asBoolean(true));
        assertEquals("ws-1", data.at("/relationships/allowed-workspaces/data/0/id").asText());
    }

    @Test
    void clearingAllowedWorkspacesSendsEmptyList() throws Exception {
        server.respond("PATCH", "/api/v2/agent-pools/apool-1", 200, "{\"data\":" + POOL + "}");

        agentPools.updateAllowedWorkspaces("apool-1", new AgentPoolAllowedWorkspacesUpdateOptions());

        JsonNode relation = Json.mapper().readTree(server.lastRequest().body())
            .at("/data/relationships/allowed-workspaces/data");
        assertTrue(relation.isArray());
        assertEquals(0, relation.size());
    }

    @Test
    void readUpdateDelete() throws Exception {
        server.respond("GET", "/api/v2/agent-pools/apool-1", 200, "{\"data\":" + POOL + "}");
        server.respond("PATCH", "/api/v2/agent-pools/apool-1", 200, "{\"data\":" + POOL + "}");
        server.respond("DELETE", "/api/v2/agent-pools/apool-1", 204, "");

        AgentPool pool = agentPools.readWithOptions("apool-1",
            new AgentPoolReadOptions().include(AgentPoolIncludeOpt.WORKSPACES));
        assertEquals("include=workspaces", server.lastRequest().query());
        assertEquals("apool-1", pool.getId());

        agentPools.update("apool-1", new AgentPoolUpdateOptions().name("runners"));
        assertEquals("runners",
            Json.mapper().readTree(server.lastRequest().body()).at("/data/attributes/name").asText());

        agentPools.delete("apool-1");
        assertEquals(3, server.requests().size());
    }

    @Test
    void validatesBeforeSending() {
        assertSentinel(TfeError.INVALID_ORG, () -> agentPools.list(null, null));
        assertSentinel(TfeError.REQUIRED_NAME, () -> agentPools.create("acme", new AgentPoolCreateOptions()));
        assertSentinel(TfeError.INVALID_NAME,
            () -> agentPools.create("acme", new AgentPoolCreateOptions().name("bad name")));
        assertSentinel(TfeError.INVALID_AGENT_POOL_ID, () -> agentPools.read(""));
        assertSentinel(TfeError.INVALID_NAME,
            () -> agentPools.update("apool-1", new AgentPoolUpdateOptions().name("a/b")));
        assertSentinel(TfeError.INVALID_AGENT_POOL_ID,
            () -> agentPools.updateAllowedWorkspaces("x y", new AgentPoolAllowedWorkspacesUpdateOptions()));
        assertTrue(server.requests().isEmpty());
    }
}
