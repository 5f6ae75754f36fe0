package io.terraform.tfe.project;

import com.fasterxml.jackson.databind.JsonNode;
import io.terraform.tfe.ApiServer;
import io.terraform.tfe.ResourceList;
import io.terraform.tfe.TfeError;
import io.terraform.tfe.internal.Json;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static io.terraform.tfe.TfeAssertions.assertSentinel;
import static org.junit.jupiter.api.Assertions.*;

class ProjectsTest {

    private static final String RESOURCE = "{\"id\":\"prj-1\",\"type\":\"projects\","
        + "\"attributes\":{\"name\":\"core\",\"description\":\"shared\",\"auto-destroy-activity-duration\":\"14d\"},"
        + "\"relationships\":{\"organization\":{\"data\":{\"id\":\"acme\",\"type\":\"organizations\"}}}}";
    private static final String PROJECT = "{\"data\":" + RESOURCE + "}";

    private ApiServer server;
    private Projects projects;

    @BeforeEach
    void setUp() throws Exception {
        server = ApiServer.start();
        projects = server.client().projects();
    }

    @AfterEach
    void tearDown() {
        server.close();
    }

    @Test
    void listFiltersByName() throws Exception {
        server.respond("GET", "/api/v2/organizations/acme/projects", 200,
            "{\"data\":[" + RESOURCE + "]}");

        ResourceList<Project> list = projects.list("acme", new ProjectListOptions().name("core"));

        assertEquals(1, list.getItems().size());
        assertEquals("acme", list.getItems().get(0).getOrganization().getName());
        assertEquals("filter%5Bnames%5D=core", server.lastRequest().query());
    }

    @Test
    void createReadUpdateDelete() throws Exception {
        server.respond("POST", "/api/v2/organizations/acme/projects", 201, PROJECT);
        server.respond("GET", "/api/v2/projects/prj-1", 200, PROJECT);
        server.respond("PATCH", "/api/v2/projects/prj-1", 200, PROJECT);
        server.respond("DELETE", "/api/v2/projects/prj-1", 204, "");

        Project created = projects.create("acme", new ProjectCreateOptions().name("core").description("shared"));
        JsonNode data = Json.mapper().readTree(server.lastRequest().body()).path("data");
        assertEquals("projects", data.path("type").asText());
        assertEquals("shared", data.at("/attributes/description").asText());

        Project read = projects.read("prj-1");
        assertEquals(created.getId(), read.getId());
        assertEquals("14d", read.getAutoDestroyActivityDuration());

        projects.update("prj-1", new ProjectUpdateOptions().description("renamed"));
        assertEquals("PATCH", server.lastRequest().method());

        projects.delete("prj-1");
        assertEquals("DELETE", server.lastRequest().method());
    }

    @Test
    void validatesBeforeSending() {
        assertSentinel(TfeError.INVALID_ORG, () -> projects.list("", null));
        assertSentinel(TfeError.REQUIRED_NAME, () -> projects.create("acme", new ProjectCreateOptions()));
        assertSentinel(TfeError.INVALID_NAME, () -> projects.create("acme", new ProjectCreateOptions().name("a b")));
        assertSentinel(TfeError.INVALID_PROJECT_ID, () -> projects.read("prj 1"));
        assertSentinel(TfeError.INVALID_PROJECT_ID, () -> projects.delete(null));
        assertSentinel(TfeError.INVALID_NAME, () -> projects.update("prj-1", new ProjectUpdateOptions().name("a/b")));
        assertTrue(server.requests().isEmpty());
    }
}
