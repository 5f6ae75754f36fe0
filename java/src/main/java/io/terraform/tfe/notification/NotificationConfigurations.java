package io.terraform.tfe.notification;

import io.terraform.tfe.PageOptions;
import io.terraform.tfe.ResourceList;
import io.terraform.tfe.TfeClient;
import io.terraform.tfe.TfeError;
import io.terraform.tfe.TfeException;

import java.util.List;
import java.util.Objects;

import static io.terraform.tfe.internal.QueryEncoder.escape;
import static io.terraform.tfe.internal.Validation.validString;
import static io.terraform.tfe.internal.Validation.validStringId;

/**
 * Workspace notification configurations: where run and assessment events are delivered.
 */
public final class NotificationConfigurations {

    private final TfeClient client;

    public NotificationConfigurations(TfeClient client) {
        this.client = Objects.requireNonNull(client, "client");
    }

    public ResourceList<NotificationConfiguration> list(String workspaceId, PageOptions options)
        throws TfeException {
        return client.newRequest("GET", workspacePath(workspaceId), null, options)
            .decodeList(NotificationConfiguration.class);
    }

    public NotificationConfiguration create(String workspaceId, NotificationConfigurationCreateOptions options)
        throws TfeException {
        String path = workspacePath(workspaceId);
        Objects.requireNonNull(options, "options");
        validate(options);
        return client.newRequest("POST", path, options, null).decode(NotificationConfiguration.class);
    }

    public NotificationConfiguration read(String notificationConfigurationId) throws TfeException {
        return client.newRequest("GET", configurationPath(notificationConfigurationId), null, null)
            .decode(NotificationConfiguration.class);
    }

    public NotificationConfiguration update(
        String notificationConfigurationId,
        NotificationConfigurationUpdateOptions options
    ) throws TfeException {
        String path = configurationPath(notificationConfigurationId);
        Objects.requireNonNull(options, "options");
        if (options.getName() != null && !validString(options.getName())) {
            throw new TfeException(TfeError.REQUIRED_NAME);
        }
        checkTriggers(options.getTriggers());
        return client.newRequest("PATCH", path, options, null).decode(NotificationConfiguration.class);
    }

    public void delete(String notificationConfigurationId) throws TfeException {
        client.newRequest("DELETE", configurationPath(notificationConfigurationId), null, null).execute();
    }

    /**
     * Sends a test payload to the configured destination.
     */
    public NotificationConfiguration verify(String notificationConfigurationId) throws TfeException {
        String path = configurationPath(notificationConfigurationId) + "/actions/verify";
        return client.newRequest("POST", path, null, null).decode(NotificationConfiguration.class);
    }

    private static void validate(NotificationConfigurationCreateOptions options) throws TfeException {
        if (options.getDestinationType() == null) {
            throw new TfeException(TfeError.REQUIRED_DESTINATION_TYPE);
        }
        if (options.getEnabled() == null) {
            throw new TfeException(TfeError.REQUIRED_ENABLED);
        }
        if (!validString(options.getName())) {
            throw new TfeException(TfeError.REQUIRED_NAME);
        }
        checkTriggers(options.getTriggers());
        if (options.getDestinationType().requiresUrl() && !validString(options.getUrl())) {
            throw new TfeException(TfeError.REQUIRED_URL);
        }
    }

    private static void checkTriggers(List<NotificationTrigger> triggers) throws TfeException {
        for (NotificationTrigger trigger : triggers) {
            if (trigger == null || !trigger.appliesToWorkspaces()) {
                throw new TfeException(TfeError.INVALID_NOTIFICATION_TRIGGER);
            }
        }
    }

    private static String workspacePath(String workspaceId) throws TfeException {
        if (!validStringId(workspaceId)) {
            throw new TfeException(TfeError.INVALID_WORKSPACE_ID);
        }
        return "workspaces/" + escape(workspaceId) + "/notification-configurations";
    }

    private static String configurationPath(String notificationConfigurationId) throws TfeException {
        if (!validStringId(notificationConfigurationId)) {
            throw new TfeException(TfeError.INVALID_NOTIFICATION_CONFIG_ID);
        }
        return "notification-configurations/" + escape(notificationConfigurationId);
    }
}
