package io.terraform.tfe.user;

import com.fasterxml.jackson.databind.JsonNode;
import io.terraform.tfe.ApiServer;
import io.terraform.tfe.TfeError;
import io.terraform.tfe.TfeException;
import io.terraform.tfe.internal.Json;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class UsersTest {

    private static final String USER = "{\"data\":{\"id\":\"user-1\",\"type\":\"users\",\"attributes\":{"
        + "\"username\":\"jane\",\"email\":\"jane@acme.test\",\"is-service-account\":false,\"is-site-admin\":true,"
        + "\"two-factor\":{\"enabled\":true,\"verified\":false},\"v2-only\":true}}}";

    private ApiServer server;
    private Users users;

    @BeforeEach
    void setUp() throws Exception {
        server = ApiServer.start();
        users = server.client().users();
    }

    @AfterEach
    void tearDown() {
        server.close();
    }

    @Test
    void readsCurrentUser() throws Exception {
        server.respond("GET", "/api/v2/account/details", 200, USER);

        User user = users.readCurrent();

        assertEquals("user-1", user.getId());
        assertEquals("jane", user.getUsername());
        assertTrue(user.isSiteAdmin());
        assertFalse(user.isServiceAccount());
        assertTrue(user.getTwoFactor().enabled());
        assertFalse(user.getTwoFactor().verified());
        assertTrue(user.isV2Only());
        assertNull(user.getUnconfirmedEmail());
    }

    @Test
    void updatesCurrentUser() throws Exception {
        server.respond("PATCH", "/api/v2/account/update", 200, USER);

        users.updateCurrent(new UserUpdateOptions().email("new@acme.test"));

        JsonNode data = Json.mapper().readTree(server.lastRequest().body()).path("data");
        assertEquals("users", data.path("type").asText());
        assertEquals("new@acme.test", data.at("/attributes/email").asText());
        assertFalse(data.path("attributes").has("username"));
    }

    @Test
    void invalidTokenIsUnauthorized() {
        server.respond("GET", "/api/v2/account/details", 401, "");

        TfeException ex = assertThrows(TfeException.class, users::readCurrent);

        assertTrue(ex.is(TfeError.UNAUTHORIZED));
    }
}
