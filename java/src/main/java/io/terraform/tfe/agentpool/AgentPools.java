package io.terraform.tfe.agentpool;

import io.terraform.tfe.ResourceList;
import io.terraform.tfe.TfeClient;
import io.terraform.tfe.TfeError;
import io.terraform.tfe.TfeException;

import java.util.Objects;

import static io.terraform.tfe.internal.QueryEncoder.escape;
import static io.terraform.tfe.internal.Validation.validString;
import static io.terraform.tfe.internal.Validation.validStringId;

/**
 * Agent pools group self-hosted agents that execute runs for an organization's workspaces.
 */
public final class AgentPools {

    private final TfeClient client;

    public AgentPools(TfeClient client) {
        this.client = Objects.requireNonNull(client, "client");
    }

    public ResourceList<AgentPool> list(String organization, AgentPoolListOptions options) throws TfeException {
        return client.newRequest("GET", organizationPath(organization), null, options).decodeList(AgentPool.class);
    }

    public AgentPool create(String organization, AgentPoolCreateOptions options) throws TfeException {
        String path = organizationPath(organization);
        Objects.requireNonNull(options, "options");
        if (!validString(options.getName())) {
            throw new TfeException(TfeError.REQUIRED_NAME);
        }
        if (!validStringId(options.getName())) {
            throw new TfeException(TfeError.INVALID_NAME);
        }
        return client.newRequest("POST", path, options, null).decode(AgentPool.class);
    }

    public AgentPool read(String agentPoolId) throws TfeException {
        return readWithOptions(agentPoolId, null);
    }

    public AgentPool readWithOptions(String agentPoolId, AgentPoolReadOptions options) throws TfeException {
        return client.newRequest("GET", poolPath(agentPoolId), null, options).decode(AgentPool.class);
    }

    public AgentPool update(String agentPoolId, AgentPoolUpdateOptions options) throws TfeException {
        String path = poolPath(agentPoolId);
        Objects.requireNonNull(options, "options");
        if (options.getName() != null && !validStringId(options.getName())) {
            throw new TfeException(TfeError.INVALID_NAME);
        }
        return client.newRequest("PATCH", path, options, null).decode(AgentPool.class);
    }

    public AgentPool updateAllowedWorkspaces(String agentPoolId, AgentPoolAllowedWorkspacesUpdateOptions options)
        throws TfeException {
        String path = poolPath(agentPoolId);
        Objects.requireNonNull(options, "options");
        return client.newRequest("PATCH", path, options, null).decode(AgentPool.class);
    }

    public void delete(String agentPoolId) throws TfeException {
        client.newRequest("DELETE", poolPath(agentPoolId), null, null).execute();
    }

    private static String organizationPath(String organization) throws TfeException {
        if (!validStringId(organization)) {
            throw new TfeException(TfeError.INVALID_ORG);
        }
        return "organizations/" + escape(organization) + "/agent-pools";
    }

    private static String poolPath(String agentPoolId) throws TfeException {
        if (!validStringId(agentPoolId)) {
            throw new TfeException(TfeError.INVALID_AGENT_POOL_ID);
        }
        return "agent-pools/" + escape(agentPoolId);
    }
}
