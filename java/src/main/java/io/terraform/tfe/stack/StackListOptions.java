package io.terraform.tfe.stack;

import io.terraform.tfe.ListOptions;
import io.terraform.tfe.QueryValues;

public final class StackListOptions extends ListOptions<StackListOptions> {

    private String projectId;
    private StackSortColumn sort;
    private String searchByName;

    public StackListOptions projectId(String projectId) {
        this.projectId = projectId;
        return this;
    }

    public StackListOptions sort(StackSortColumn sort) {
        this.sort = sort;
        return this;
    }

    public StackListOptions searchByName(String searchByName) {
        this.searchByName = searchByName;
        return this;
    }

    @Override
    public void appendTo(QueryValues values) {
        super.appendTo(values);
        values.add("filter[project[id]]", projectId);
        values.add("sort", sort == null ? null : sort.toString());
        values.add("search[name]", searchByName);
    }

    @Override
    protected StackListOptions self() {
        return this;
    }
}
