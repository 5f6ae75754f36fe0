package io.terraform.tfe.runtask;

import io.terraform.tfe.TfeClient;
import io.terraform.tfe.TfeError;
import io.terraform.tfe.TfeException;

import java.util.Objects;

/**
 * Reports run task results back to the platform. Integrations receive the callback URL and a one-off access token
 * with each task request; the access token replaces the client's own credentials for the callback.
 */
public final class RunTaskCallbacks {

    private final TfeClient client;

    public RunTaskCallbacks(TfeClient client) {
        this.client = Objects.requireNonNull(client, "client");
    }

    public void update(String callbackUrl, String accessToken, TaskResultCallbackOptions options)
        throws TfeException {
        if (callbackUrl == null || callbackUrl.isBlank()) {
            throw new TfeException(TfeError.INVALID_CALLBACK_URL);
        }
        if (accessToken == null || accessToken.isBlank()) {
            throw new TfeException(TfeError.INVALID_ACCESS_TOKEN);
        }
        if (options == null || options.getStatus() == null || !options.getStatus().isReportable()) {
            throw new TfeException(TfeError.INVALID_TASK_RESULTS_CALLBACK_STATUS);
        }
        client.newRequest("PATCH", callbackUrl, options, null)
            .header("Authorization", "Bearer " + accessToken)
            .execute();
    }
}
