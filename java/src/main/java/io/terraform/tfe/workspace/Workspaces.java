package io.terraform.tfe.workspace;

import io.terraform.tfe.ResourceList;
import io.terraform.tfe.TfeClient;
import io.terraform.tfe.TfeError;
import io.terraform.tfe.TfeException;

import java.util.Objects;

import static io.terraform.tfe.internal.QueryEncoder.escape;
import static io.terraform.tfe.internal.Validation.validString;
import static io.terraform.tfe.internal.Validation.validStringId;

/**
 * Workspace endpoints. Workspaces can be addressed by organization and name, or by their ID.
 */
public final class Workspaces {

    private final TfeClient client;

    public Workspaces(TfeClient client) {
        this.client = Objects.requireNonNull(client, "client");
    }

    public ResourceList<Workspace> list(String organization, WorkspaceListOptions options) throws TfeException {
        requireOrganization(organization);
        return client.newRequest("GET", "organizations/" + escape(organization) + "/workspaces", null, options)
            .decodeList(Workspace.class);
    }

    public Workspace create(String organization, WorkspaceCreateOptions options) throws TfeException {
        requireOrganization(organization);
        Objects.requireNonNull(options, "options");
        if (!validString(options.getName())) {
            throw new TfeException(TfeError.REQUIRED_NAME);
        }
        if (!validStringId(options.getName())) {
            throw new TfeException(TfeError.INVALID_NAME);
        }
        return client.newRequest("POST", "organizations/" + escape(organization) + "/workspaces", options, null)
            .decode(Workspace.class);
    }

    public Workspace read(String organization, String workspace) throws TfeException {
        return readWithOptions(organization, workspace, null);
    }

    public Workspace readWithOptions(String organization, String workspace, WorkspaceReadOptions options)
        throws TfeException {
        return client.newRequest("GET", byName(organization, workspace), null, options).decode(Workspace.class);
    }

    public Workspace readById(String workspaceId) throws TfeException {
        return client.newRequest("GET", byId(workspaceId), null, null).decode(Workspace.class);
    }

    public Workspace update(String workspaceId, WorkspaceUpdateOptions options) throws TfeException {
        String path = byId(workspaceId);
        Objects.requireNonNull(options, "options");
        if (options.getName() != null && !validStringId(options.getName())) {
            throw new TfeException(TfeError.INVALID_NAME);
        }
        return client.newRequest("PATCH", path, options, null).decode(Workspace.class);
    }

    public void delete(String organization, String workspace) throws TfeException {
        client.newRequest("DELETE", byName(organization, workspace), null, null).execute();
    }

    public void deleteById(String workspaceId) throws TfeException {
        client.newRequest("DELETE", byId(workspaceId), null, null).execute();
    }

    /**
     * Locks a workspace so no run can start until it is unlocked.
     *
     * @param reason shown to other users, may be {@code null}.
     */
    public Workspace lock(String workspaceId, String reason) throws TfeException {
        return client.newRequest("POST", byId(workspaceId) + "/actions/lock", new WorkspaceLockOptions(reason), null)
            .decode(Workspace.class);
    }

    public Workspace unlock(String workspaceId) throws TfeException {
        return client.newRequest("POST", byId(workspaceId) + "/actions/unlock", null, null).decode(Workspace.class);
    }

    /**
     * Unlocks a workspace locked by another user or run.
     */
    public Workspace forceUnlock(String workspaceId) throws TfeException {
        return client.newRequest("POST", byId(workspaceId) + "/actions/force-unlock", null, null)
            .decode(Workspace.class);
    }

    private static String byName(String organization, String workspace) throws TfeException {
        requireOrganization(organization);
        if (!validStringId(workspace)) {
            throw new TfeException(TfeError.INVALID_WORKSPACE_VALUE);
        }
        return "organizations/" + escape(organization) + "/workspaces/" + escape(workspace);
    }

    private static String byId(String workspaceId) throws TfeException {
        if (!validStringId(workspaceId)) {
            throw new TfeException(TfeError.INVALID_WORKSPACE_ID);
        }
        return "workspaces/" + escape(workspaceId);
    }

    private static void requireOrganization(String organization) throws TfeException {
        if (!validStringId(organization)) {
            throw new TfeException(TfeError.INVALID_ORG);
        }
    }
}
