package io.terraform.tfe;

import io.terraform.tfe.workspace.Workspace;
import io.terraform.tfe.workspace.WorkspaceIncludeOpt;
import io.terraform.tfe.workspace.WorkspaceListOptions;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class TfeClientTest {

    private ApiServer server;
    private TfeClient client;

    @BeforeEach
    void setUp() throws Exception {
        server = ApiServer.start();
        client = server.client();
    }

    @AfterEach
    void tearDown() {
        client.close();
        server.close();
    }

    @Test
    void pingReadsServerMetadataAndConfiguresLimiter() throws Exception {
        server.on("GET", "/api/v2/ping", exchange -> {
            exchange.getResponseHeaders().add("TFP-API-Version", "2.6");
            exchange.getResponseHeaders().add("X-TFE-Version", "v202405-1");
            exchange.getResponseHeaders().add("TFP-AppName", "Terraform Enterprise");
            exchange.getResponseHeaders().add("X-RateLimit-Limit", "30");
            ApiServer.reply(exchange, 204, "");
        });

        RemoteMetadata metadata = client.ping();

        assertEquals("2.6", metadata.apiVersion());
        assertEquals("v202405-1", metadata.tfeVersion());
        assertEquals("Terraform Enterprise", metadata.appName());
        assertTrue(metadata.isEnterprise());
        assertSame(metadata, client.getRemoteMetadata());
        assertEquals(9, client.limiter().burst());
        assertEquals(19.8, client.limiter().ratePerSecond(), 1e-9);
    }

    @Test
    void missingRateLimitHeaderLeavesClientUnlimited() throws Exception {
        server.respond("GET", "/api/v2/ping", 204, "");

        RemoteMetadata metadata = client.ping();

        assertEquals("", metadata.rateLimit());
        assertFalse(metadata.isEnterprise());
        assertTrue(client.limiter().isUnlimited());
    }

    @Test
    void initPingsOnlyOnce() throws Exception {
        server.respond("GET", "/api/v2/ping", 204, "");

        client.init();
        client.init();

        assertEquals(1, server.requests().size());
    }

    @Test
    void initMemoisesFailure() {
        server.respond("GET", "/api/v2/ping", 401, "");

        TfeException first = assertThrows(TfeException.class, client::init);
        assertTrue(first.is(TfeError.UNAUTHORIZED));

        server.respond("GET", "/api/v2/ping", 204, "");
        TfeException second = assertThrows(TfeException.class, client::init);

        assertSame(first, second);
        assertEquals(1, server.requests().size());
    }

    @Test
    void requestsCarryDefaultHeadersAndBearerToken() throws Exception {
        server.respond("GET", "/api/v2/ping", 204, "");

        client.ping();

        ApiServer.Recorded request = server.lastRequest();
        assertEquals("Bearer " + ApiServer.TOKEN, request.header("Authorization"));
        assertEquals("application/vnd.api+json", request.header("Accept"));
        assertEquals(Config.DEFAULT_USER_AGENT, request.header("User-Agent"));
        assertNull(request.header("Content-Type"));
    }

    @Test
    void tokenIsNotSentToOtherHosts() throws Exception {
        server.respond("GET", "/elsewhere", 200, "{}");
        String foreign = "http://127.0.0.1:" + server.address().getPort() + "/elsewhere";

        client.newRequest("GET", foreign, null, null).execute();

        ApiServer.Recorded request = server.lastRequest();
        assertEquals("/elsewhere", request.path());
        assertNull(request.header("Authorization"));
    }

    @Test
    void customHeadersAreSentWithEveryRequest() throws Exception {
        server.respond("GET", "/api/v2/ping", 204, "");
        TfeClient custom = new TfeClient(server.config().header("X-Request-Source", "ci").build());

        custom.ping();

        assertEquals("ci", server.lastRequest().header("X-Request-Source"));
    }

    @Test
    void queryIsEncodedAndAppendedToExistingQuery() throws Exception {
        server.respond("GET", "/api/v2/things", 200, "{}");
        WorkspaceListOptions options = new WorkspaceListOptions()
            .pageNumber(2)
            .include(WorkspaceIncludeOpt.ORGANIZATION, WorkspaceIncludeOpt.CURRENT_RUN);

        client.newRequest("GET", "things?force=true", null, options).execute();

        String query = decode(server.lastRequest().query());
        assertEquals("force=true&include=organization,current_run&page[number]=2", query);
    }

    @Test
    void bodyIsOnlySentForWritingMethods() throws Exception {
        server.respond("GET", "/api/v2/workspaces/ws-1", 200,
            "{\"data\":{\"id\":\"ws-1\",\"type\":\"workspaces\"}}");
        server.respond("PATCH", "/api/v2/workspaces/ws-1", 200,
            "{\"data\":{\"id\":\"ws-1\",\"type\":\"workspaces\"}}");

        client.newRequest("GET", "workspaces/ws-1", Workspace.reference("ws-1"), null).execute();
        assertEquals("", server.lastRequest().body());

        ClientRequest patch = client.newRequest("PATCH", "workspaces/ws-1", Workspace.reference("ws-1"), null);
        assertEquals("application/vnd.api+json", patch.getHeaders().get("Content-Type"));
        patch.execute();
        assertEquals("{\"data\":{\"type\":\"workspaces\",\"id\":\"ws-1\"}}", server.lastRequest().body());
    }

    @Test
    void getWithNonQueryValueIsRejected() {
        TfeException ex = assertThrows(TfeException.class,
            () -> client.newRequest("GET", "workspaces", Workspace.reference("ws-1")));

        assertTrue(ex.getMessage().contains("QueryOptions"));
        assertTrue(server.requests().isEmpty());
    }

    @Test
    void headerOverrideReplacesAndRemoves() throws Exception {
        ClientRequest request = client.newRequest("GET", "ping", null, null)
            .header("authorization", "Bearer other")
            .header("Accept", null);

        assertEquals("Bearer other", request.getHeaders().get("Authorization"));
        assertFalse(request.getHeaders().containsKey("accept"));
    }

    @Test
    void pageBeyondTheLastReturnsEmptyItems() throws Exception {
        server.respond("GET", "/api/v2/organizations/acme/workspaces", 200,
            "{\"data\":[],\"meta\":{\"pagination\":{\"current-page\":999,\"prev-page\":998,\"next-page\":null,"
                + "\"total-pages\":1,\"total-count\":2}}}");

        ResourceList<Workspace> page = client.workspaces().list("acme",
            new WorkspaceListOptions().pageNumber(999).pageSize(100));

        assertTrue(page.getItems().isEmpty());
        assertEquals(999, page.getCurrentPage());
        assertEquals(2, page.getTotalCount());
        assertFalse(page.hasNextPage());
        assertEquals("page[number]=999&page[size]=100", decode(server.lastRequest().query()));
    }

    @Test
    void translatesErrorResponses() {
        server.respond("GET", "/api/v2/workspaces/ws-1", 422,
            "{\"errors\":[{\"status\":\"422\",\"title\":\"invalid\",\"detail\":\"bad value\"}]}");

        TfeApiException ex = assertThrows(TfeApiException.class, () -> client.workspaces().readById("ws-1"));

        assertEquals(422, ex.getStatusCode());
        assertEquals(List.of("invalid\n\nbad value"), ex.getMessages());
    }

    @Test
    void unknownResourceIsNotFound() {
        TfeApiException ex = assertThrows(TfeApiException.class, () -> client.workspaces().readById("ws-missing"));

        assertTrue(ex.is(TfeError.RESOURCE_NOT_FOUND));
        assertEquals(404, ex.getStatusCode());
    }

    @Test
    void retriesRateLimitedRequests() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        server.on("GET", "/api/v2/ping", exchange ->
            ApiServer.reply(exchange, calls.incrementAndGet() == 1 ? 429 : 204, ""));
        AtomicInteger hooks = new AtomicInteger();
        TfeClient retrying = new TfeClient(server.config()
            .retryLogHook((attempt, response) -> hooks.incrementAndGet())
            .build(), duration -> { });

        retrying.ping();

        assertEquals(2, calls.get());
        assertEquals(1, hooks.get());
    }

    @Test
    void uploadObjectSendsRawBytesWithoutCredentials() throws Exception {
        server.respond("PUT", "/v1/object/abc", 200, "");
        String url = server.address() + "/v1/object/abc";

        client.uploadObject(url, new ByteArrayInputStream("archive".getBytes(StandardCharsets.UTF_8)));

        ApiServer.Recorded request = server.lastRequest();
        assertEquals("PUT", request.method());
        assertEquals("application/octet-stream", request.header("Content-Type"));
        assertNull(request.header("Authorization"));
        assertEquals("archive", request.body());
    }

    @Test
    void uploadObjectRejectsInvalidUrls() {
        ByteArrayInputStream data = new ByteArrayInputStream(new byte[0]);

        assertTrue(assertThrows(TfeException.class, () -> client.uploadObject("", data)).is(TfeError.INVALID_URL));
        assertTrue(assertThrows(TfeException.class, () -> client.uploadObject("v1/object", data))
            .is(TfeError.INVALID_URL));
        assertTrue(assertThrows(TfeException.class, () -> client.uploadObject("http://bad host/x", data))
            .is(TfeError.INVALID_URL));
        assertTrue(server.requests().isEmpty());
    }

    @Test
    void uploadObjectSurfacesServerErrors() {
        server.respond("PUT", "/v1/object/abc", 403, "");

        TfeApiException ex = assertThrows(TfeApiException.class,
            () -> client.uploadObject(server.address() + "/v1/object/abc", new ByteArrayInputStream(new byte[1])));

        assertEquals(403, ex.getStatusCode());
        assertEquals("403 Forbidden", ex.getMessage());
    }

    static String decode(String query) {
        return query == null ? null : URLDecoder.decode(query, StandardCharsets.UTF_8);
    }
}
