package io.terraform.tfe.workspace;

import io.terraform.tfe.ListOptions;
import io.terraform.tfe.QueryValues;

import java.util.ArrayList;
import java.util.List;

public final class WorkspaceListOptions extends ListOptions<WorkspaceListOptions> {

    private String search;
    private String tags;
    private String excludeTags;
    private String projectId;
    private final List<WorkspaceIncludeOpt> include = new ArrayList<>();

    /**
     * Partial workspace name match.
     */
    public WorkspaceListOptions search(String search) {
        this.search = search;
        return this;
    }

    /**
     * Comma-separated tag names a workspace must carry.
     */
    public WorkspaceListOptions tags(String tags) {
        this.tags = tags;
        return this;
    }

    public WorkspaceListOptions excludeTags(String excludeTags) {
        this.excludeTags = excludeTags;
        return this;
    }

    public WorkspaceListOptions projectId(String projectId) {
        this.projectId = projectId;
        return this;
    }

    public WorkspaceListOptions include(WorkspaceIncludeOpt... relations) {
        include.addAll(List.of(relations));
        return this;
    }

    @Override
    public void appendTo(QueryValues values) {
        super.appendTo(values);
        values.add("search[name]", search);
        values.add("search[tags]", tags);
        values.add("search[exclude-tags]", excludeTags);
        values.add("filter[project][id]", projectId);
        values.addAll("include", include);
    }

    @Override
    protected WorkspaceListOptions self() {
        return this;
    }
}
