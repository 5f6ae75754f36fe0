package io.terraform.tfe.run;

import io.terraform.tfe.NextPrevList;
import io.terraform.tfe.ResourceList;
import io.terraform.tfe.TfeClient;
import io.terraform.tfe.TfeError;
import io.terraform.tfe.TfeException;

import java.util.Objects;

import static io.terraform.tfe.internal.QueryEncoder.escape;
import static io.terraform.tfe.internal.Validation.validStringId;

/**
 * Queues runs and drives them through their lifecycle.
 */
public final class Runs {

    private final TfeClient client;

    public Runs(TfeClient client) {
        this.client = Objects.requireNonNull(client, "client");
    }

    public ResourceList<Run> list(String workspaceId, RunListOptions options) throws TfeException {
        if (!validStringId(workspaceId)) {
            throw new TfeException(TfeError.INVALID_WORKSPACE_ID);
        }
        return client.newRequest("GET", "workspaces/" + escape(workspaceId) + "/runs", null, options)
            .decodeList(Run.class);
    }

    /**
     * Lists runs across every workspace of an organization. This endpoint paginates with next and previous page
     * links only, without totals.
     */
    public NextPrevList<Run> listForOrganization(String organization, RunListOptions options) throws TfeException {
        if (!validStringId(organization)) {
            throw new TfeException(TfeError.INVALID_ORG);
        }
        return client.newRequest("GET", "organizations/" + escape(organization) + "/runs", null, options)
            .decodeNextPrevList(Run.class);
    }

    public Run create(RunCreateOptions options) throws TfeException {
        if (options == null || options.getWorkspace() == null) {
            throw new TfeException(TfeError.REQUIRED_WORKSPACE);
        }
        return client.newRequest("POST", "runs", options, null).decode(Run.class);
    }

    public Run read(String runId) throws TfeException {
        return readWithOptions(runId, null);
    }

    public Run readWithOptions(String runId, RunReadOptions options) throws TfeException {
        return client.newRequest("GET", runPath(runId), null, options).decode(Run.class);
    }

    /**
     * Confirms a run that is waiting for approval.
     */
    public void apply(String runId, String comment) throws TfeException {
        action(runId, "apply", comment);
    }

    public void cancel(String runId, String comment) throws TfeException {
        action(runId, "cancel", comment);
    }

    /**
     * Skips any remaining work on a run that is paused for confirmation or a policy override.
     */
    public void discard(String runId, String comment) throws TfeException {
        action(runId, "discard", comment);
    }

    private void action(String runId, String action, String comment) throws TfeException {
        String path = runPath(runId) + "/actions/" + action;
        client.newRequest("POST", path, new RunActionOptions(comment), null).execute();
    }

    private static String runPath(String runId) throws TfeException {
        if (!validStringId(runId)) {
            throw new TfeException(TfeError.INVALID_RUN_ID);
        }
        return "runs/" + escape(runId);
    }
}
