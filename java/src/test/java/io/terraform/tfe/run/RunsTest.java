package io.terraform.tfe.run;

import com.fasterxml.jackson.databind.JsonNode;
import io.terraform.tfe.ApiServer;
import io.terraform.tfe.NextPrevList;
import io.terraform.tfe.ResourceList;
import io.terraform.tfe.TfeClient;
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

class RunsTest {

    private ApiServer server;
    private TfeClient client;
    private Runs runs;

    @BeforeEach
    void setUp() throws Exception {
        server = ApiServer.start();
        client = server.client();
        runs = client.runs();
    }

    @AfterEach
    void tearDown() {
        client.close();
        server.close();
    }

    @Test
    void readResolvesIncludedPlan() throws Exception {
        server.respondWithFixture("GET", "/api/v2/runs/run-CZcmD7eagjhyX0vN", "run-with-plan.json");

        Run run = runs.readWithOptions("run-CZcmD7eagjhyX0vN", new RunReadOptions().include(RunIncludeOpt.PLAN));

        assertEquals("include=plan", server.lastRequest().query());
        assertEquals(RunStatus.PLANNED, run.getStatus());
        assertEquals(RunSource.API, run.getSource());
        assertTrue(run.hasChanges());
        assertEquals(List.of("module.vpc"), run.getTargetAddrs());
        assertTrue(run.getActions().confirmable());
        assertFalse(run.getActions().forceCancelable());
        assertEquals("ws-alpha", run.getWorkspace().getId());

        Plan plan = run.getPlan();
        assertEquals(PlanStatus.FINISHED, plan.getStatus());
        assertEquals(3, plan.getResourceAdditions());
        assertEquals(1, plan.getResourceChanges());

        assertEquals("apply-1", run.getApply().getId());
        assertNull(run.getApply().getStatus());
    }

    @Test
    void listSendsFiltersAndSearch() throws Exception {
        server.respond("GET", "/api/v2/workspaces/ws-alpha/runs", 200, "{\"data\":[]}");

        ResourceList<Run> list = runs.list("ws-alpha", new RunListOptions()
            .status(RunStatus.PLANNED, RunStatus.ERRORED)
            .operation("plan_only")
            .search("abc123")
            .include(RunIncludeOpt.CREATED_BY));

        assertTrue(list.getItems().isEmpty());
        String query = URLDecoder.decode(server.lastRequest().query(), StandardCharsets.UTF_8);
        assertEquals("filter[operation]=plan_only&filter[status]=planned,errored&include=created_by"
            + "&search[basic]=abc123", query);
    }

    @Test
    void listForOrganizationUsesNextPrevPagination() throws Exception {
        server.respond("GET", "/api/v2/organizations/acme/runs", 200,
            "{\"data\":[{\"id\":\"run-1\",\"type\":\"runs\",\"attributes\":{\"status\":\"applied\"}}],"
                + "\"meta\":{\"pagination\":{\"current-page\":1,\"prev-page\":null,\"next-page\":2}}}");

        NextPrevList<Run> page = runs.listForOrganization("acme", null);

        assertEquals(RunStatus.APPLIED, page.getItems().get(0).getStatus());
        assertTrue(page.hasNextPage());
        assertSentinel(TfeError.INVALID_ORG, () -> runs.listForOrganization("", null));
    }

    @Test
    void createRequiresWorkspaceAndSendsRelation() throws Exception {
        assertSentinel(TfeError.REQUIRED_WORKSPACE, () -> runs.create(new RunCreateOptions().message("m")));
        assertSentinel(TfeError.REQUIRED_WORKSPACE, () -> runs.create(null));

        server.respondWithFixture("POST", "/api/v2/runs", "run-with-plan.json");
        runs.create(new RunCreateOptions()
            .workspace(Workspace.reference("ws-alpha"))
            .message("Queued manually")
            .targetAddrs("module.vpc")
            .planOnly(true));

        JsonNode data = Json.mapper().readTree(server.lastRequest().body()).path("data");
        assertEquals("runs", data.path("type").asText());
        assertEquals("Queued manually", data.at("/attributes/message").asText());
        assertTrue(data.at("/attributes/plan-only").asBoolean());
        assertEquals("module.vpc", data.at("/attributes/target-addrs/0").asText());
        assertFalse(data.path("attributes").has("is-destroy"));
        assertEquals("ws-alpha", data.at("/relationships/workspace/data/id").asText());
    }

    @Test
    void actionsPostCommentBodies() throws Exception {
        server.respond("POST", "/api/v2/runs/run-1/actions/apply", 202, "");
        server.respond("POST", "/api/v2/runs/run-1/actions/cancel", 202, "");
        server.respond("POST", "/api/v2/runs/run-1/actions/discard", 202, "");

        runs.apply("run-1", "looks good");
        assertEquals("{\"comment\":\"looks good\"}", server.lastRequest().body());

        runs.cancel("run-1", null);
        assertEquals("{}", server.lastRequest().body());

        runs.discard("run-1", "not needed");
        assertEquals("/api/v2/runs/run-1/actions/discard", server.lastRequest().path());
    }

    @Test
    void invalidRunIdIsRejectedBeforeSending() {
        assertSentinel(TfeError.INVALID_RUN_ID, () -> runs.read(""));
        assertSentinel(TfeError.INVALID_RUN_ID, () -> runs.apply("run/1", null));
        assertSentinel(TfeError.INVALID_WORKSPACE_ID, () -> runs.list(null, null));
        assertTrue(server.requests().isEmpty());
    }

    @Test
    void missingRunIsNotFound() {
        assertSentinel(TfeError.RESOURCE_NOT_FOUND, () -> runs.read("run-missing"));
    }
}
