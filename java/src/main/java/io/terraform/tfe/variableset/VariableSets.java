package io.terraform.tfe.variableset;

import io.terraform.tfe.ResourceList;
import io.terraform.tfe.TfeClient;
import io.terraform.tfe.TfeError;
import io.terraform.tfe.TfeException;
import io.terraform.tfe.workspace.Workspace;

import java.util.Objects;

import static io.terraform.tfe.internal.QueryEncoder.escape;
import static io.terraform.tfe.internal.Validation.validString;
import static io.terraform.tfe.internal.Validation.validStringId;

public final class VariableSets {

    private final TfeClient client;

    public VariableSets(TfeClient client) {
        this.client = Objects.requireNonNull(client, "client");
    }

    public ResourceList<VariableSet> list(String organization, VariableSetListOptions options) throws TfeException {
        return client.newRequest("GET", organizationPath(organization), null, options)
            .decodeList(VariableSet.class);
    }

    /**
     * Lists the sets applied to a workspace, global sets included.
     */
    public ResourceList<VariableSet> listForWorkspace(String workspaceId, VariableSetListOptions options)
        throws TfeException {
        if (!validStringId(workspaceId)) {
            throw new TfeException(TfeError.INVALID_WORKSPACE_ID);
        }
        return client.newRequest("GET", "workspaces/" + escape(workspaceId) + "/varsets", null, options)
            .decodeList(VariableSet.class);
    }

    public VariableSet create(String organization, VariableSetCreateOptions options) throws TfeException {
        String path = organizationPath(organization);
        Objects.requireNonNull(options, "options");
        if (!validString(options.getName())) {
            throw new TfeException(TfeError.REQUIRED_NAME);
        }
        if (options.getGlobal() == null) {
            throw new TfeException(TfeError.REQUIRED_GLOBAL_FLAG);
        }
        return client.newRequest("POST", path, options, null).decode(VariableSet.class);
    }

    public VariableSet read(String variableSetId, VariableSetReadOptions options) throws TfeException {
        return client.newRequest("GET", variableSetPath(variableSetId), null, options).decode(VariableSet.class);
    }

    public VariableSet update(String variableSetId, VariableSetUpdateOptions options) throws TfeException {
        String path = variableSetPath(variableSetId);
        Objects.requireNonNull(options, "options");
        return client.newRequest("PATCH", path, options, null).decode(VariableSet.class);
    }

    public void delete(String variableSetId) throws TfeException {
        client.newRequest("DELETE", variableSetPath(variableSetId), null, null).execute();
    }

    public void applyToWorkspaces(String variableSetId, VariableSetWorkspacesOptions options) throws TfeException {
        String path = workspacesRelationPath(variableSetId, options);
        client.newRequest("POST", path, options.workspaces(), null).execute();
    }

    public void removeFromWorkspaces(String variableSetId, VariableSetWorkspacesOptions options) throws TfeException {
        String path = workspacesRelationPath(variableSetId, options);
        client.newRequest("DELETE", path, options.workspaces(), null).execute();
    }

    private static String workspacesRelationPath(String variableSetId, VariableSetWorkspacesOptions options)
        throws TfeException {
        String path = variableSetPath(variableSetId) + "/relationships/workspaces";
        if (options == null || options.workspaces().isEmpty()) {
            throw new TfeException(TfeError.REQUIRED_WORKSPACES_LIST);
        }
        for (Workspace workspace : options.workspaces()) {
            if (workspace == null || !validStringId(workspace.getId())) {
                throw new TfeException(TfeError.INVALID_WORKSPACE_ID);
            }
        }
        return path;
    }

    private static String organizationPath(String organization) throws TfeException {
        if (!validStringId(organization)) {
            throw new TfeException(TfeError.INVALID_ORG);
        }
        return "organizations/" + escape(organization) + "/varsets";
    }

    private static String variableSetPath(String variableSetId) throws TfeException {
        if (!validStringId(variableSetId)) {
            throw new TfeException(TfeError.INVALID_VARIABLE_SET_ID);
        }
        return "varsets/" + escape(variableSetId);
    }
}
