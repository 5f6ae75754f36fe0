package io.terraform.tfe.stack;

import io.terraform.tfe.ResourceList;
import io.terraform.tfe.TfeClient;
import io.terraform.tfe.TfeError;
import io.terraform.tfe.TfeException;

import java.util.Objects;

import static io.terraform.tfe.internal.QueryEncoder.escape;
import static io.terraform.tfe.internal.Validation.validString;
import static io.terraform.tfe.internal.Validation.validStringId;

public final class Stacks {

    private final TfeClient client;

    public Stacks(TfeClient client) {
        this.client = Objects.requireNonNull(client, "client");
    }

    public ResourceList<Stack> list(String organization, StackListOptions options) throws TfeException {
        if (!validStringId(organization)) {
            throw new TfeException(TfeError.INVALID_ORG);
        }
        return client.newRequest("GET", "organizations/" + escape(organization) + "/stacks", null, options)
            .decodeList(Stack.class);
    }

    public Stack create(StackCreateOptions options) throws TfeException {
        Objects.requireNonNull(options, "options");
        if (!validString(options.getName())) {
            throw new TfeException(TfeError.REQUIRED_NAME);
        }
        if (options.getProject() == null || !validString(options.getProject().getId())) {
            throw new TfeException(TfeError.REQUIRED_PROJECT);
        }
        return client.newRequest("POST", "stacks", options, null).decode(Stack.class);
    }

    public Stack read(String stackId) throws TfeException {
        return client.newRequest("GET", stackPath(stackId), null, null).decode(Stack.class);
    }

    public Stack update(String stackId, StackUpdateOptions options) throws TfeException {
        String path = stackPath(stackId);
        Objects.requireNonNull(options, "options");
        return client.newRequest("PATCH", path, options, null).decode(Stack.class);
    }

    /**
     * Deletes a stack. The server refuses while deployments still manage resources; see {@link #forceDelete}.
     */
    public void delete(String stackId) throws TfeException {
        client.newRequest("DELETE", stackPath(stackId), null, null).execute();
    }

    public void forceDelete(String stackId) throws TfeException {
        client.newRequest("DELETE", stackPath(stackId) + "?force=true", null, null).execute();
    }

    /**
     * Pulls the latest configuration from the stack's repository, which starts preparing it.
     */
    public Stack fetchLatestFromVcs(String stackId) throws TfeException {
        String path = stackPath(stackId) + "/fetch-latest-from-vcs";
        return client.newRequest("POST", path, null, null).decode(Stack.class);
    }

    private static String stackPath(String stackId) throws TfeException {
        if (!validStringId(stackId)) {
            throw new TfeException(TfeError.INVALID_STACK_ID);
        }
        return "stacks/" + escape(stackId);
    }
}
