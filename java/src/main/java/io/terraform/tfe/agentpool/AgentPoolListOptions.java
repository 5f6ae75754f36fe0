package io.terraform.tfe.agentpool;

import io.terraform.tfe.ListOptions;
import io.terraform.tfe.QueryValues;

import java.util.ArrayList;
import java.util.List;

public final class AgentPoolListOptions extends ListOptions<AgentPoolListOptions> {

    private String query;
    private String allowedWorkspacesName;
    private final List<AgentPoolIncludeOpt> include = new ArrayList<>();

    public AgentPoolListOptions query(String query) {
        this.query = query;
        return this;
    }

    /**
     * Only pools the named workspace is allowed to use.
     */
    public AgentPoolListOptions allowedWorkspacesName(String workspaceName) {
        this.allowedWorkspacesName = workspaceName;
        return this;
    }

    public AgentPoolListOptions include(AgentPoolIncludeOpt... relations) {
        include.addAll(List.of(relations));
        return this;
    }

    @Override
    public void appendTo(QueryValues values) {
        super.appendTo(values);
        values.add("q", query);
        values.add("filter[allowed_workspaces][name]", allowedWorkspacesName);
        values.addAll("include", include);
    }

    @Override
    protected AgentPoolListOptions self() {
        return this;
    }
}
