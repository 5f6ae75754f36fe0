package io.terraform.tfe.stack;

import com.fasterxml.jackson.databind.JsonNode;
import io.terraform.tfe.ApiServer;
import io.terraform.tfe.TfeClient;
import io.terraform.tfe.TfeError;
import io.terraform.tfe.agentpool.AgentPool;
import io.terraform.tfe.internal.Json;
import io.terraform.tfe.project.Project;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;

import static io.terraform.tfe.TfeAssertions.assertSentinel;
import static org.junit.jupiter.api.Assertions.*;

class StacksTest {

    private static final String STACK = "{\"id\":\"st-1\",\"type\":\"stacks\",\"attributes\":{\"name\":\"network\","
        + "\"speculative-enabled\":true,\"vcs-repo\":{\"identifier\":\"acme/network\",\"branch\":\"main\"},"
        + "\"linked-stack-connections\":{\"upstream-count\":1,\"downstream-count\":2}},"
        + "\"relationships\":{\"project\":{\"data\":{\"id\":\"prj-core\",\"type\":\"projects\"}}}}";

    private ApiServer server;
    private TfeClient client;
    private Stacks stacks;

    @BeforeEach
    void setUp() throws Exception {
        server = ApiServer.start();
        client = server.client();
        stacks = client.stacks();
    }

    @AfterEach
    void tearDown() {
        client.close();
        server.close();
    }

    @Test
    void listFiltersByProjectAndSorts() throws Exception {
        server.respond("GET", "/api/v2/organizations/acme/stacks", 200, "{\"data\":[" + STACK + "]}");

        Stack stack = stacks.list("acme", new StackListOptions()
            .projectId("prj-core")
            .sort(StackSortColumn.UPDATED_AT_DESC)
            .searchByName("net")).getItems().get(0);

        assertEquals("filter[project[id]]=prj-core&search[name]=net&sort=-updated-at",
            URLDecoder.decode(server.lastRequest().query(), StandardCharsets.UTF_8));
        assertEquals("acme/network", stack.getVcsRepo().identifier());
        assertEquals(2, stack.getLinkedStackConnections().downstreamCount());
        assertTrue(stack.isSpeculativeEnabled());
        assertEquals("prj-core", stack.getProject().getId());
        assertNull(stack.getAgentPool());
    }

    @Test
    void createRequiresNameAndProject() throws Exception {
        assertSentinel(TfeError.REQUIRED_NAME,
            () -> stacks.create(new StackCreateOptions().project(Project.reference("prj-core"))));
        assertSentinel(TfeError.REQUIRED_PROJECT, () -> stacks.create(new StackCreateOptions().name("network")));
        assertSentinel(TfeError.REQUIRED_PROJECT,
            () -> stacks.create(new StackCreateOptions().name("network").project(new Project())));
        assertTrue(server.requests().isEmpty());

        server.respond("POST", "/api/v2/stacks", 201, "{\"data\":" + STACK + "}");
        stacks.create(new StackCreateOptions()
            .name("network")
            .vcsRepo(new StackVcsRepo("acme/network", null, null, "ot-1"))
            .project(Project.reference("prj-core"))
            .agentPool(AgentPool.reference("apool-1")));

        JsonNode data = Json.mapper().readTree(server.lastRequest().body()).path("data");
        assertEquals("acme/network", data.at("/attributes/vcs-repo/identifier").asText());
        assertFalse(data.at("/attributes/vcs-repo").has("branch"));
        assertEquals("prj-core", data.at("/relationships/project/data/id").asText());
        assertEquals("apool-1", data.at("/relationships/agent-pool/data/id").asText());
    }

    @Test
    void readUpdateAndFetch() throws Exception {
        server.respond("GET", "/api/v2/stacks/st-1", 200, "{\"data\":" + STACK + "}");
        server.respond("PATCH", "/api/v2/stacks/st-1", 200, "{\"data\":" + STACK + "}");
        server.respond("POST", "/api/v2/stacks/st-1/fetch-latest-from-vcs", 200, "{\"data\":" + STACK + "}");

        assertEquals("network", stacks.read("st-1").getName());

        stacks.update("st-1", new StackUpdateOptions().description("core network"));
        assertEquals("core network",
            Json.mapper().readTree(server.lastRequest().body()).at("/data/attributes/description").asText());

        assertEquals("st-1", stacks.fetchLatestFromVcs("st-1").getId());
    }

    @Test
    void deleteAndForceDelete() throws Exception {
        server.respond("DELETE", "/api/v2/stacks/st-1", 204, "");

        stacks.delete("st-1");
        assertNull(server.lastRequest().query());

        stacks.forceDelete("st-1");
        assertEquals("force=true", server.lastRequest().query());
        assertEquals("/api/v2/stacks/st-1", server.lastRequest().path());
    }

    @Test
    void invalidIdentifiersAreRejected() {
        assertSentinel(TfeError.INVALID_STACK_ID, () -> stacks.read(""));
        assertSentinel(TfeError.INVALID_STACK_ID, () -> stacks.forceDelete("st 1"));
        assertSentinel(TfeError.INVALID_ORG, () -> stacks.list(null, null));
    }
}
