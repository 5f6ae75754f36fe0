package io.terraform.tfe.notification;

import com.fasterxml.jackson.databind.JsonNode;
import io.terraform.tfe.ApiServer;
import io.terraform.tfe.PageOptions;
import io.terraform.tfe.ResourceList;
import io.terraform.tfe.TfeError;
import io.terraform.tfe.internal.Json;
import io.terraform.tfe.user.User;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static io.terraform.tfe.TfeAssertions.assertSentinel;
import static org.junit.jupiter.api.Assertions.*;

class NotificationConfigurationsTest {

    private static final String CONFIG = "{\"id\":\"nc-1\",\"type\":\"notification-configurations\","
        + "\"attributes\":{\"name\":\"ops\",\"enabled\":true,\"destination-type\":\"slack\","
        + "\"url\":\"https://hooks.slack.test/x\",\"triggers\":[\"run:errored\",\"some:future_trigger\"],"
        + "\"delivery-responses\":[{\"code\":\"200\",\"successful\":\"true\",\"url\":\"https://hooks.slack.test/x\","
        + "\"headers\":{\"Content-Type\":[\"text/plain\"]}}]},"
        + "\"relationships\":{\"subscribable\":{\"data\":{\"id\":\"ws-1\",\"type\":\"workspaces\"}}}}";

    private ApiServer server;
    private NotificationConfigurations configurations;

    @BeforeEach
    void setUp() throws Exception {
        server = ApiServer.start();
        configurations = server.client().notificationConfigurations();
    }

    @AfterEach
    void tearDown() {
        server.close();
    }

    @Test
    void listDecodesTriggersAndDeliveryResponses() throws Exception {
        server.respond("GET", "/api/v2/workspaces/ws-1/notification-configurations", 200,
            "{\"data\":[" + CONFIG + "]}");

        ResourceList<NotificationConfiguration> list = configurations.list("ws-1", PageOptions.page(2, 10));

        NotificationConfiguration config = list.getItems().get(0);
        assertEquals(NotificationDestinationType.SLACK, config.getDestinationType());
        assertTrue(config.isEnabled());
        assertEquals(List.of("run:errored", "some:future_trigger"), config.getTriggers());
        assertEquals("200", config.getDeliveryResponses().get(0).code());
        assertEquals(List.of("text/plain"), config.getDeliveryResponses().get(0).headers().get("Content-Type"));
        assertEquals("ws-1", config.getSubscribable().getId());
        assertEquals("page%5Bnumber%5D=2&page%5Bsize%5D=10", server.lastRequest().query());
    }

    @Test
    void createSendsTriggersAsWireValues() throws Exception {
        server.respond("POST", "/api/v2/workspaces/ws-1/notification-configurations", 201, "{\"data\":" + CONFIG + "}");

        configurations.create("ws-1", new NotificationConfigurationCreateOptions()
            .destinationType(NotificationDestinationType.EMAIL)
            .enabled(true)
            .name("ops")
            .triggers(NotificationTrigger.CREATED, NotificationTrigger.ASSESSMENT_DRIFTED)
            .emailUsers(List.of(User.reference("user-1"))));

        JsonNode data = Json.mapper().readTree(server.lastRequest().body()).path("data");
        assertEquals("email", data.at("/attributes/destination-type").asText());
        assertEquals("run:created", data.at("/attributes/triggers/0").asText());
        assertEquals("assessment:drifted", data.at("/attributes/triggers/1").asText());
        assertFalse(data.path("attributes").has("url"));
        assertEquals("user-1", data.at("/relationships/users/data/0/id").asText());
    }

    @Test
    void createValidatesInOrder() {
        NotificationConfigurationCreateOptions options = new NotificationConfigurationCreateOptions();
        assertSentinel(TfeError.REQUIRED_DESTINATION_TYPE, () -> configurations.create("ws-1", options));

        options.destinationType(NotificationDestinationType.GENERIC);
        assertSentinel(TfeError.REQUIRED_ENABLED, () -> configurations.create("ws-1", options));

        options.enabled(false);
        assertSentinel(TfeError.REQUIRED_NAME, () -> configurations.create("ws-1", options));

        options.name("hook").triggers(NotificationTrigger.CHANGE_REQUEST_CREATED);
        assertSentinel(TfeError.INVALID_NOTIFICATION_TRIGGER, () -> configurations.create("ws-1", options));

        options.triggers(NotificationTrigger.COMPLETED);
        assertSentinel(TfeError.REQUIRED_URL, () -> configurations.create("ws-1", options));

        assertSentinel(TfeError.INVALID_WORKSPACE_ID, () -> configurations.create("", options));
        assertTrue(server.requests().isEmpty());
    }

    @Test
    void updateValidatesNameAndTriggers() {
        assertSentinel(TfeError.REQUIRED_NAME,
            () -> configurations.update("nc-1", new NotificationConfigurationUpdateOptions().name("")));
        assertSentinel(TfeError.INVALID_NOTIFICATION_TRIGGER, () -> configurations.update("nc-1",
            new NotificationConfigurationUpdateOptions().triggers(NotificationTrigger.CHANGE_REQUEST_CREATED)));
        assertSentinel(TfeError.INVALID_NOTIFICATION_CONFIG_ID,
            () -> configurations.update("nc 1", new NotificationConfigurationUpdateOptions()));
        assertTrue(server.requests().isEmpty());
    }

    @Test
    void readUpdateVerifyDelete() throws Exception {
        server.respond("GET", "/api/v2/notification-configurations/nc-1", 200, "{\"data\":" + CONFIG + "}");
        server.respond("PATCH", "/api/v2/notification-configurations/nc-1", 200, "{\"data\":" + CONFIG + "}");
        server.respond("POST", "/api/v2/notification-configurations/nc-1/actions/verify", 200,
            "{\"data\":" + CONFIG + "}");
        server.respond("DELETE", "/api/v2/notification-configurations/nc-1", 204, "");

        assertEquals("ops", configurations.read("nc-1").getName());

        configurations.update("nc-1", new NotificationConfigurationUpdateOptions().enabled(false));
        assertFalse(Json.mapper().readTree(server.lastRequest().body()).at("/data/attributes/enabled").asBoolean(true));

        NotificationConfiguration verified = configurations.verify("nc-1");
        assertEquals(1, verified.getDeliveryResponses().size());

        configurations.delete("nc-1");
        assertEquals(4, server.requests().size());
    }
}
